package com.tickq;

/**
 * Decides whether a child job fires for the outcome of its parent.
 */
public enum RunCondition {
    ON_SUCCESS,
    ON_FAILURE,
    ON_CANCELLED,
    ON_FAILURE_OR_CANCELLED,
    ON_ANY_COMPLETED_STATUS,
    /**
     * Fires as soon as the parent starts executing.
     */
    IN_PROGRESS;

    /**
     * Whether a child with this condition fires once its parent reached {@code parentStatus}.
     * {@link #IN_PROGRESS} children are resolved at parent start and never match a terminal status.
     */
    public boolean isSatisfiedBy(JobStatus parentStatus) {
        if (parentStatus == null) {
            return false;
        }
        return switch (this) {
            case ON_SUCCESS -> parentStatus == JobStatus.DONE || parentStatus == JobStatus.DUE_DONE;
            case ON_FAILURE -> parentStatus == JobStatus.FAILED;
            case ON_CANCELLED -> parentStatus == JobStatus.CANCELLED;
            case ON_FAILURE_OR_CANCELLED -> parentStatus == JobStatus.FAILED || parentStatus == JobStatus.CANCELLED;
            case ON_ANY_COMPLETED_STATUS -> parentStatus.isTerminal();
            case IN_PROGRESS -> parentStatus == JobStatus.IN_PROGRESS;
        };
    }
}
