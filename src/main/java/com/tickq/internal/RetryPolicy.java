package com.tickq.internal;

import com.tickq.config.TickQProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Decides whether a failed attempt is retried and when.
 * <p>
 * The delay for the attempt that failed with {@code retryCount} is {@code intervals[retryCount]} seconds,
 * clamped to the last interval when the sequence is shorter than the budget, and the configured default
 * when no sequence was supplied.
 */
@Component
public class RetryPolicy {

    private final Duration defaultInterval;

    public RetryPolicy(TickQProperties properties) {
        this(properties.getJobs().getDefaultRetryInterval());
    }

    RetryPolicy(Duration defaultInterval) {
        this.defaultInterval = defaultInterval;
    }

    public boolean shouldRetry(int retryCount, int retries) {
        return retryCount < retries;
    }

    public Duration nextDelay(int retryCount, int[] retryIntervals) {
        if (retryIntervals == null || retryIntervals.length == 0) {
            return defaultInterval;
        }
        int index = Math.min(Math.max(retryCount, 0), retryIntervals.length - 1);
        return Duration.ofSeconds(retryIntervals[index]);
    }

    public RetryDecision decide(int retryCount, int retries, int[] retryIntervals, OffsetDateTime now) {
        if (!shouldRetry(retryCount, retries)) {
            return RetryDecision.exhausted();
        }
        return new RetryDecision(true, now.plus(nextDelay(retryCount, retryIntervals)));
    }

    public record RetryDecision(boolean retry, OffsetDateTime nextRunAt) {
        static RetryDecision exhausted() {
            return new RetryDecision(false, null);
        }
    }
}
