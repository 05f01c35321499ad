package com.tickq;

import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Per-execution context handed to a {@link JobFunction}. Carries the cooperative cancellation signal.
 */
public class JobContext {

    private final UUID jobId;
    private final JobKind kind;
    private final String function;
    private final int retryCount;
    private final OffsetDateTime scheduledTime;
    private final BooleanSupplier otherOccurrenceRunning;

    private volatile boolean cancellationRequested;
    private volatile String cancellationReason;
    private volatile Thread executingThread;

    public JobContext(UUID jobId, JobKind kind, String function, int retryCount, OffsetDateTime scheduledTime,
            BooleanSupplier otherOccurrenceRunning) {
        this.jobId = jobId;
        this.kind = kind;
        this.function = function;
        this.retryCount = retryCount;
        this.scheduledTime = scheduledTime;
        this.otherOccurrenceRunning = otherOccurrenceRunning;
    }

    public UUID getJobId() {
        return jobId;
    }

    public JobKind getKind() {
        return kind;
    }

    public String getFunction() {
        return function;
    }

    /**
     * Zero on the first attempt.
     */
    public int getRetryCount() {
        return retryCount;
    }

    public OffsetDateTime getScheduledTime() {
        return scheduledTime;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public void throwIfCancellationRequested() {
        if (cancellationRequested) {
            throw new JobCancelledException(cancellationReason);
        }
    }

    /**
     * Terminates the execution as skipped. Never returns normally.
     */
    public void skip(String reason) {
        throw new JobSkippedException(reason);
    }

    /**
     * Skips this cron occurrence when another occurrence of the same cron job is still in progress.
     * No-op for time jobs.
     */
    public void skipIfAlreadyRunning() {
        if (kind == JobKind.CRON && otherOccurrenceRunning != null && otherOccurrenceRunning.getAsBoolean()) {
            throw new JobSkippedException("Another occurrence of '" + function + "' is still in progress");
        }
    }

    /**
     * Requests cooperative cancellation and interrupts the executing thread, if any.
     */
    public void requestCancellation(String reason) {
        this.cancellationReason = reason == null ? "Cancellation requested" : reason;
        this.cancellationRequested = true;
        Thread thread = executingThread;
        if (thread != null) {
            thread.interrupt();
        }
    }

    void bindThread(Thread thread) {
        this.executingThread = thread;
    }

    /**
     * Marks the start and end of the handler invocation on a worker thread.
     */
    public void attach() {
        bindThread(Thread.currentThread());
    }

    public void detach() {
        bindThread(null);
        // clear a pending interrupt so it does not leak into the next task on this worker
        Thread.interrupted();
    }
}
