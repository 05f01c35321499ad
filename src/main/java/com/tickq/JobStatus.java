package com.tickq;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a time job or cron occurrence.
 * <p>
 * {@code IDLE -> QUEUED -> IN_PROGRESS -> {DONE | DUE_DONE | FAILED | CANCELLED | SKIPPED}}.
 * Retries move an {@code IN_PROGRESS} entity back to {@code IDLE}; dead-node cleanup moves
 * {@code QUEUED}/{@code IN_PROGRESS} entities back to {@code IDLE}. Terminal statuses are final.
 */
public enum JobStatus {
    IDLE,
    QUEUED,
    IN_PROGRESS,
    /**
     * Completed after the scheduled time.
     */
    DONE,
    /**
     * Completed on schedule.
     */
    DUE_DONE,
    FAILED,
    CANCELLED,
    SKIPPED;

    public static final Set<JobStatus> TERMINAL = EnumSet.of(DONE, DUE_DONE, FAILED, CANCELLED, SKIPPED);
    public static final Set<JobStatus> PENDING = EnumSet.of(IDLE, QUEUED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isPending() {
        return PENDING.contains(this);
    }

    /**
     * Only {@code IDLE} entities accept field updates.
     */
    public boolean isUpdatable() {
        return this == IDLE;
    }

    /**
     * Everything except {@code IN_PROGRESS} may be deleted.
     */
    public boolean isDeletable() {
        return this != IN_PROGRESS;
    }

    public boolean canTransitionTo(JobStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case IDLE -> target == QUEUED || target == CANCELLED || target == SKIPPED;
            case QUEUED -> target == IN_PROGRESS || target == IDLE || target == CANCELLED;
            case IN_PROGRESS -> target == IDLE || target.isTerminal();
            default -> false;
        };
    }

    public void requireUpdatable(Object id) {
        if (!isUpdatable()) {
            throw new IllegalStateException("Job " + id + " cannot be updated while " + this);
        }
    }

    public void requireDeletable(Object id) {
        if (!isDeletable()) {
            throw new IllegalStateException("Job " + id + " cannot be deleted while " + this);
        }
    }
}
