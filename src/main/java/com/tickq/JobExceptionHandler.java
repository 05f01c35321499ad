package com.tickq;

import java.util.UUID;

/**
 * Global callback for executions that end badly. Invoked once per job: after the retry budget is
 * exhausted, or when the execution is cancelled. Implementations must not throw; failures are logged
 * and swallowed.
 */
public interface JobExceptionHandler {

    void handleException(Throwable error, UUID jobId, JobKind kind);

    void handleCancelledException(Throwable error, UUID jobId, JobKind kind);
}
