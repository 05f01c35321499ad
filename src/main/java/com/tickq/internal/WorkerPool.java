package com.tickq.internal;

import com.tickq.JobPriority;
import com.tickq.config.TickQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two lanes of worker threads. HIGH, NORMAL and LOW work shares a pool bounded by the configured max
 * concurrency and is picked in priority order; LONG_RUNNING work gets its own unbounded pool.
 */
@Component
@ConditionalOnProperty(prefix = "tickq.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final Comparator<PrioritizedTask> TASK_ORDER = Comparator
            .comparing(PrioritizedTask::priority)
            .thenComparing(PrioritizedTask::executionTime, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(PrioritizedTask::sequence);

    private final int maxConcurrency;
    private final ThreadPoolExecutor boundedExecutor;
    private final ThreadPoolExecutor longRunningExecutor;
    private final AtomicInteger boundedInFlight = new AtomicInteger();
    private final AtomicLong sequence = new AtomicLong();
    private final WakeUpSignal wakeUpSignal;

    public WorkerPool(TickQProperties properties, WakeUpSignal wakeUpSignal) {
        this(properties.getScheduler().getMaxConcurrency(), properties.getScheduler().getIdleWorkerTimeout(),
                wakeUpSignal);
    }

    WorkerPool(int maxConcurrency, Duration idleWorkerTimeout, WakeUpSignal wakeUpSignal) {
        this.maxConcurrency = maxConcurrency;
        this.wakeUpSignal = wakeUpSignal;
        long keepAliveMs = Math.max(1L, idleWorkerTimeout.toMillis());

        this.boundedExecutor = new ThreadPoolExecutor(
                maxConcurrency,
                maxConcurrency,
                keepAliveMs,
                TimeUnit.MILLISECONDS,
                new PriorityBlockingQueue<Runnable>(Math.max(11, maxConcurrency * 2),
                        (left, right) -> TASK_ORDER.compare((PrioritizedTask) left, (PrioritizedTask) right)),
                new CustomizableThreadFactory("tickq-worker-"));
        this.boundedExecutor.allowCoreThreadTimeOut(true);

        this.longRunningExecutor = new ThreadPoolExecutor(
                0,
                Integer.MAX_VALUE,
                keepAliveMs,
                TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(),
                new CustomizableThreadFactory("tickq-long-running-"));
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Bounded-lane capacity not yet taken by running or queued work.
     */
    public int availableBoundedSlots() {
        return Math.max(0, maxConcurrency - boundedInFlight.get());
    }

    public int activeWorkerCount() {
        return boundedExecutor.getPoolSize() + longRunningExecutor.getPoolSize();
    }

    public void submit(JobPriority priority, OffsetDateTime executionTime, Runnable work) {
        if (!priority.isBounded()) {
            longRunningExecutor.execute(() -> runSafely(work));
            return;
        }
        boundedInFlight.incrementAndGet();
        PrioritizedTask task = new PrioritizedTask(priority, executionTime, sequence.incrementAndGet(), () -> {
            try {
                runSafely(work);
            } finally {
                boundedInFlight.decrementAndGet();
                wakeUpSignal.wakeNow();
            }
        });
        try {
            boundedExecutor.execute(task);
        } catch (RuntimeException rejected) {
            boundedInFlight.decrementAndGet();
            throw rejected;
        }
    }

    /**
     * Stops accepting work and waits up to {@code timeout} for running work to finish.
     */
    public void shutdown(Duration timeout) {
        boundedExecutor.shutdown();
        longRunningExecutor.shutdown();
        try {
            long deadline = System.nanoTime() + timeout.toNanos();
            boolean bounded = boundedExecutor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
            boolean longRunning = longRunningExecutor.awaitTermination(
                    Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            if (!bounded || !longRunning) {
                log.warn("Worker pool did not terminate within {}; interrupting remaining workers", timeout);
                boundedExecutor.shutdownNow();
                longRunningExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            boundedExecutor.shutdownNow();
            longRunningExecutor.shutdownNow();
        }
    }

    private void runSafely(Runnable work) {
        try {
            work.run();
        } catch (RuntimeException e) {
            log.error("Worker task failed outside of job execution", e);
        }
    }

    record PrioritizedTask(JobPriority priority, OffsetDateTime executionTime, long sequence, Runnable work)
            implements Runnable {
        @Override
        public void run() {
            work.run();
        }
    }
}
