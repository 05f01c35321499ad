package com.tickq.internal;

import com.tickq.CronJob;
import com.tickq.CronOccurrence;
import com.tickq.JobKind;
import com.tickq.TimeJob;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Snapshot of one claimable unit of work. Cron occurrences carry their definition's function, payload and
 * retry settings; relatives are referenced by id only.
 */
public record ExecutionItem(
        JobKind kind,
        UUID id,
        String function,
        byte[] payload,
        OffsetDateTime executionTime,
        int retryCount,
        int retries,
        int[] retryIntervals,
        UUID cronJobId,
        UUID parentId) {

    public static ExecutionItem of(TimeJob job) {
        return new ExecutionItem(JobKind.TIME, job.getId(), job.getFunction(), job.getPayload(),
                job.getExecutionTime(), job.getRetryCount(), job.getRetries(), job.getRetryIntervals(), null,
                job.getParentId());
    }

    public static ExecutionItem of(CronOccurrence occurrence, CronJob cronJob) {
        return new ExecutionItem(JobKind.CRON, occurrence.getId(), cronJob.getFunction(), cronJob.getPayload(),
                occurrence.getExecutionTime(), occurrence.getRetryCount(), cronJob.getRetries(),
                cronJob.getRetryIntervals(), cronJob.getId(), null);
    }
}
