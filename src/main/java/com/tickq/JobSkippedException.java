package com.tickq;

/**
 * Ends the current execution as {@link JobStatus#SKIPPED}: no retry, no failure.
 */
public class JobSkippedException extends RuntimeException {

    public JobSkippedException(String reason) {
        super(reason);
    }
}
