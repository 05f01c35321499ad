package com.tickq.internal;

import com.tickq.JobCancelledException;
import com.tickq.JobContext;
import com.tickq.JobExceptionHandler;
import com.tickq.JobKind;
import com.tickq.JobSkippedException;
import com.tickq.JobStatus;
import com.tickq.config.TickQProperties;
import com.tickq.internal.FunctionRegistry.RegisteredFunction;
import com.tickq.internal.RetryPolicy.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one claimed execution and records its outcome.
 * <p>
 * Outcomes: success ends as {@link JobStatus#DUE_DONE} when the handler started within
 * {@link #ON_TIME_TOLERANCE} of the scheduled time and as {@link JobStatus#DONE} otherwise; a
 * {@link JobSkippedException} ends as {@link JobStatus#SKIPPED}; an observed cancellation ends as
 * {@link JobStatus#CANCELLED}; any other throwable is retried until the budget is spent and then ends as
 * {@link JobStatus#FAILED}.
 */
@Component
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    static final Duration ON_TIME_TOLERANCE = Duration.ofSeconds(1);
    static final int MAX_EXCEPTION_MESSAGE_LENGTH = 4000;

    private final ExecutionStore executionStore;
    private final RetryPolicy retryPolicy;
    private final ChainingResolver chainingResolver;
    private final CronOccurrenceGenerator occurrenceGenerator;
    private final WakeUpSignal wakeUpSignal;
    private final JobExceptionHandler exceptionHandler;
    private final String nodeId;

    private final Map<UUID, JobContext> activeContexts = new ConcurrentHashMap<>();

    public JobExecutor(
            ExecutionStore executionStore,
            RetryPolicy retryPolicy,
            ChainingResolver chainingResolver,
            CronOccurrenceGenerator occurrenceGenerator,
            WakeUpSignal wakeUpSignal,
            JobExceptionHandler exceptionHandler,
            TickQProperties properties) {
        this.executionStore = executionStore;
        this.retryPolicy = retryPolicy;
        this.chainingResolver = chainingResolver;
        this.occurrenceGenerator = occurrenceGenerator;
        this.wakeUpSignal = wakeUpSignal;
        this.exceptionHandler = exceptionHandler;
        this.nodeId = properties.getScheduler().getNodeIdentifier();
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * Creates and tracks the context for a claimed item so it can be cancelled while queued or running.
     */
    public JobContext prepare(ExecutionItem item) {
        JobContext context = new JobContext(item.id(), item.kind(), item.function(), item.retryCount(),
                item.executionTime(),
                item.kind() == JobKind.CRON
                        ? () -> executionStore.isOtherOccurrenceRunning(item.cronJobId(), item.id())
                        : null);
        activeContexts.put(item.id(), context);
        return context;
    }

    public int activeCount() {
        return activeContexts.size();
    }

    public void execute(ExecutionItem item, RegisteredFunction function, JobContext context) {
        try {
            run(item, function, context);
        } finally {
            activeContexts.remove(item.id(), context);
        }
    }

    /**
     * Cancels a job or occurrence. Work claimed by this node is signalled cooperatively; work not yet
     * started anywhere is cancelled in the store directly.
     *
     * @return {@code false} when the job is already terminal or running on another node
     */
    public boolean cancel(JobKind kind, UUID id, String reason) {
        String effectiveReason = reason == null || reason.isBlank() ? "Cancelled by request" : reason;
        JobContext local = activeContexts.get(id);
        if (local != null) {
            local.requestCancellation(effectiveReason);
            log.info("Cancellation requested for {} job {} running on this node", kind, id);
            return true;
        }
        if (!executionStore.cancelPending(kind, id, effectiveReason)) {
            return false;
        }
        log.info("Cancelled pending {} job {}: {}", kind, id, effectiveReason);
        handleCancelledSafely(new JobCancelledException(effectiveReason), id, kind);
        if (kind == JobKind.TIME) {
            resolveChildrenSafely(id, JobStatus.CANCELLED);
        } else {
            wakeUpSignal.wakeNow();
        }
        return true;
    }

    /**
     * Claims an item whose function is not registered and fails it without retry.
     */
    public void failUnregistered(ExecutionItem item) {
        if (!executionStore.tryClaim(item.kind(), item.id(), nodeId)
                || !executionStore.markInProgress(item, nodeId, executionStore.now())) {
            return;
        }
        IllegalStateException error = new IllegalStateException(
                "No function registered under name '" + item.function() + "'");
        log.error("Failing {} job {}: {}", item.kind(), item.id(), error.getMessage());
        if (executionStore.markFailed(item, describe(error), 0L, nodeId)) {
            handleExceptionSafely(error, item);
            afterTerminal(item, JobStatus.FAILED);
        }
    }

    private void run(ExecutionItem item, RegisteredFunction function, JobContext context) {
        if (context.isCancellationRequested()) {
            cancelBeforeStart(item, context.getCancellationReason());
            return;
        }

        OffsetDateTime startedAt = executionStore.now();
        if (!executionStore.markInProgress(item, nodeId, startedAt)) {
            log.debug("{} job {} is no longer queued for node {}; dropping it", item.kind(), item.id(), nodeId);
            return;
        }
        afterStart(item);

        long startNanos = System.nanoTime();
        Throwable error = null;
        context.attach();
        try {
            Object payload = function.payloadDeserializer().deserialize(item.payload());
            function.invoker().invoke(context, payload);
        } catch (Throwable e) {
            // Errors raised by a handler are retried like exceptions.
            error = e;
        } finally {
            context.detach();
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();

        if (error instanceof JobSkippedException skipped) {
            finishInterrupted(item, JobStatus.SKIPPED, skipped.getMessage(), elapsedMs);
        } else if (error instanceof JobCancelledException || context.isCancellationRequested()) {
            String reason = context.getCancellationReason() != null
                    ? context.getCancellationReason()
                    : error.getMessage();
            if (finishInterrupted(item, JobStatus.CANCELLED, reason, elapsedMs)) {
                handleCancelledSafely(error != null ? error : new JobCancelledException(reason), item.id(),
                        item.kind());
            }
        } else if (error == null) {
            finishSuccess(item, startedAt, elapsedMs);
        } else {
            finishFailure(item, error, elapsedMs);
        }
    }

    private void cancelBeforeStart(ExecutionItem item, String reason) {
        if (executionStore.cancelPending(item.kind(), item.id(), reason)) {
            log.info("{} job {} cancelled before start: {}", item.kind(), item.id(), reason);
            handleCancelledSafely(new JobCancelledException(reason), item.id(), item.kind());
            afterTerminal(item, JobStatus.CANCELLED);
        }
    }

    private void finishSuccess(ExecutionItem item, OffsetDateTime startedAt, long elapsedMs) {
        JobStatus status = isOnTime(item.executionTime(), startedAt) ? JobStatus.DUE_DONE : JobStatus.DONE;
        if (executionStore.markCompleted(item, status, elapsedMs, nodeId)) {
            log.debug("{} job {} ({}) finished as {} in {} ms", item.kind(), item.id(), item.function(), status,
                    elapsedMs);
            afterTerminal(item, status);
        } else {
            log.warn("{} job {} finished but its lock is no longer held by {}", item.kind(), item.id(), nodeId);
        }
    }

    private void finishFailure(ExecutionItem item, Throwable error, long elapsedMs) {
        String message = describe(error);
        RetryDecision decision = retryPolicy.decide(item.retryCount(), item.retries(), item.retryIntervals(),
                executionStore.now());
        if (decision.retry()) {
            if (executionStore.markForRetry(item, message, elapsedMs, decision.nextRunAt(), nodeId)) {
                log.warn("{} job {} ({}) failed on attempt {}; retrying at {}", item.kind(), item.id(),
                        item.function(), item.retryCount() + 1, decision.nextRunAt(), error);
                wakeUpSignal.wakeAt(decision.nextRunAt());
            } else {
                log.warn("{} job {} failed but its lock is no longer held by {}", item.kind(), item.id(), nodeId);
            }
            return;
        }

        if (executionStore.markFailed(item, message, elapsedMs, nodeId)) {
            log.error("{} job {} ({}) failed after {} retries", item.kind(), item.id(), item.function(),
                    item.retryCount(), error);
            handleExceptionSafely(error, item);
            afterTerminal(item, JobStatus.FAILED);
        } else {
            log.warn("{} job {} failed but its lock is no longer held by {}", item.kind(), item.id(), nodeId);
        }
    }

    private boolean finishInterrupted(ExecutionItem item, JobStatus status, String reason, long elapsedMs) {
        if (!executionStore.markInterrupted(item, status, reason, elapsedMs, nodeId)) {
            log.warn("{} job {} ended as {} but its lock is no longer held by {}", item.kind(), item.id(), status,
                    nodeId);
            return false;
        }
        log.info("{} job {} ({}) ended as {}: {}", item.kind(), item.id(), item.function(), status, reason);
        afterTerminal(item, status);
        return true;
    }

    private void afterStart(ExecutionItem item) {
        try {
            if (item.kind() == JobKind.TIME) {
                chainingResolver.onStarted(item.id());
            } else {
                occurrenceGenerator.generateNext(item.cronJobId());
            }
        } catch (RuntimeException e) {
            log.error("Post-start bookkeeping failed for {} job {}", item.kind(), item.id(), e);
        }
    }

    private void afterTerminal(ExecutionItem item, JobStatus status) {
        if (item.kind() == JobKind.TIME) {
            resolveChildrenSafely(item.id(), status);
            return;
        }
        try {
            occurrenceGenerator.generateNext(item.cronJobId());
        } catch (RuntimeException e) {
            log.error("Failed to generate the next occurrence of cron job {}", item.cronJobId(), e);
        }
    }

    private void resolveChildrenSafely(UUID parentId, JobStatus status) {
        try {
            chainingResolver.onTerminal(parentId, status);
        } catch (RuntimeException e) {
            log.error("Failed to resolve children of job {}", parentId, e);
        }
    }

    private void handleExceptionSafely(Throwable error, ExecutionItem item) {
        try {
            exceptionHandler.handleException(error, item.id(), item.kind());
        } catch (RuntimeException handlerFailure) {
            log.error("Exception handler failed for {} job {}", item.kind(), item.id(), handlerFailure);
        }
    }

    private void handleCancelledSafely(Throwable error, UUID id, JobKind kind) {
        try {
            exceptionHandler.handleCancelledException(error, id, kind);
        } catch (RuntimeException handlerFailure) {
            log.error("Exception handler failed for cancelled {} job {}", kind, id, handlerFailure);
        }
    }

    static boolean isOnTime(OffsetDateTime scheduledAt, OffsetDateTime startedAt) {
        return scheduledAt == null || !startedAt.isAfter(scheduledAt.plus(ON_TIME_TOLERANCE));
    }

    static String describe(Throwable error) {
        String text = error.getClass().getName() + ": " + error.getMessage();
        return text.length() <= MAX_EXCEPTION_MESSAGE_LENGTH ? text : text.substring(0, MAX_EXCEPTION_MESSAGE_LENGTH);
    }
}
