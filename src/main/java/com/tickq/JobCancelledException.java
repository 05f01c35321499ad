package com.tickq;

/**
 * Thrown by {@link JobContext#throwIfCancellationRequested()} once cancellation was requested.
 * Ends the execution as {@link JobStatus#CANCELLED}.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}
