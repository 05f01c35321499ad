package com.tickq.internal;

import com.tickq.JobStatus;
import com.tickq.RunCondition;
import com.tickq.TimeJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Fires or skips the children of a time job when the parent starts or finishes.
 * <p>
 * A child whose run condition is met is made due immediately. A child whose condition can no longer be met
 * becomes {@link JobStatus#SKIPPED}, and its own children are resolved against that status.
 */
@Component
public class ChainingResolver {

    private static final Logger log = LoggerFactory.getLogger(ChainingResolver.class);

    private final ExecutionStore executionStore;
    private final WakeUpSignal wakeUpSignal;

    public ChainingResolver(ExecutionStore executionStore, WakeUpSignal wakeUpSignal) {
        this.executionStore = executionStore;
        this.wakeUpSignal = wakeUpSignal;
    }

    /**
     * Fires children declared with {@link RunCondition#IN_PROGRESS}.
     */
    public void onStarted(UUID parentId) {
        boolean fired = false;
        for (TimeJob child : executionStore.findChildren(parentId)) {
            if (child.getRunCondition() == RunCondition.IN_PROGRESS && isUnfired(child)
                    && executionStore.fireChild(child.getId())) {
                log.debug("Fired child {} of job {} on parent start", child.getId(), parentId);
                fired = true;
            }
        }
        if (fired) {
            wakeUpSignal.wakeNow();
        }
    }

    public void onTerminal(UUID parentId, JobStatus parentStatus) {
        boolean fired = false;
        Deque<Resolution> pending = new ArrayDeque<>();
        pending.push(new Resolution(parentId, parentStatus));

        while (!pending.isEmpty()) {
            Resolution resolution = pending.pop();
            for (TimeJob child : executionStore.findChildren(resolution.parentId())) {
                if (!isUnfired(child)) {
                    continue;
                }
                RunCondition condition = child.getRunCondition();
                if (condition != null && condition != RunCondition.IN_PROGRESS
                        && condition.isSatisfiedBy(resolution.status())) {
                    if (executionStore.fireChild(child.getId())) {
                        log.debug("Fired child {} of job {} after parent reached {}", child.getId(),
                                resolution.parentId(), resolution.status());
                        fired = true;
                    }
                    continue;
                }
                String reason = "Run condition " + condition + " not met: parent finished as "
                        + resolution.status();
                if (executionStore.skipIdle(child.getId(), reason)) {
                    log.debug("Skipped child {} of job {}: {}", child.getId(), resolution.parentId(), reason);
                    pending.push(new Resolution(child.getId(), JobStatus.SKIPPED));
                }
            }
        }

        if (fired) {
            wakeUpSignal.wakeNow();
        }
    }

    private boolean isUnfired(TimeJob child) {
        return child.getStatus() == JobStatus.IDLE && child.getExecutionTime() == null;
    }

    private record Resolution(UUID parentId, JobStatus status) {
    }
}
