package com.tickq.internal;

import com.tickq.JobContext;
import com.tickq.JobPriority;
import com.tickq.config.TickQProperties;
import com.tickq.internal.FunctionRegistry.RegisteredFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Single loop that sleeps until the earliest due job (or the fallback interval), then claims due work up to
 * the free worker capacity and hands it to the worker pool.
 */
@Component
@ConditionalOnProperty(prefix = "tickq.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobDispatcher implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    // Earliest due time first; priority breaks ties.
    private static final Comparator<DueCandidate> DISPATCH_ORDER = Comparator
            .comparing((DueCandidate candidate) -> candidate.item().executionTime().toInstant())
            .thenComparing(candidate -> candidate.function().priority());

    private final ExecutionStore executionStore;
    private final FunctionRegistry functionRegistry;
    private final WorkerPool workerPool;
    private final JobExecutor jobExecutor;
    private final CronOccurrenceGenerator occurrenceGenerator;
    private final WakeUpSignal wakeUpSignal;
    private final Duration fallbackInterval;
    private final String nodeId;

    private final boolean autoStartup;
    private volatile boolean running = false;
    private Thread loopThread;

    public JobDispatcher(
            ExecutionStore executionStore,
            FunctionRegistry functionRegistry,
            WorkerPool workerPool,
            JobExecutor jobExecutor,
            CronOccurrenceGenerator occurrenceGenerator,
            WakeUpSignal wakeUpSignal,
            TickQProperties properties) {
        this.executionStore = executionStore;
        this.functionRegistry = functionRegistry;
        this.workerPool = workerPool;
        this.jobExecutor = jobExecutor;
        this.occurrenceGenerator = occurrenceGenerator;
        this.wakeUpSignal = wakeUpSignal;
        this.fallbackInterval = properties.getScheduler().getFallbackInterval();
        this.nodeId = properties.getScheduler().getNodeIdentifier();
        this.autoStartup = properties.getScheduler().isAutoStartup();
    }

    /**
     * One dispatch pass.
     *
     * @return number of items handed to the worker pool
     */
    public int tick() {
        occurrenceGenerator.generateMissing();

        OffsetDateTime now = executionStore.now();
        int boundedSlots = workerPool.availableBoundedSlots();
        List<ExecutionItem> due = executionStore.findDue(now, workerPool.getMaxConcurrency() * 2);
        List<DueCandidate> candidates = new ArrayList<>(due.size());
        for (ExecutionItem item : due) {
            Optional<RegisteredFunction> function = functionRegistry.find(item.function());
            if (function.isEmpty()) {
                jobExecutor.failUnregistered(item);
                continue;
            }
            candidates.add(new DueCandidate(item, function.get()));
        }
        candidates.sort(DISPATCH_ORDER);

        int dispatched = 0;
        for (DueCandidate candidate : candidates) {
            ExecutionItem item = candidate.item();
            JobPriority priority = candidate.function().priority();
            if (priority.isBounded() && boundedSlots <= 0) {
                continue;
            }
            if (!executionStore.tryClaim(item.kind(), item.id(), nodeId)) {
                log.debug("{} job {} was claimed by another node", item.kind(), item.id());
                continue;
            }
            JobContext context = jobExecutor.prepare(item);
            workerPool.submit(priority, item.executionTime(),
                    () -> jobExecutor.execute(item, candidate.function(), context));
            if (priority.isBounded()) {
                boundedSlots--;
            }
            dispatched++;
        }

        if (dispatched > 0) {
            log.debug("Dispatched {} jobs on node {}", dispatched, nodeId);
        }
        return dispatched;
    }

    /**
     * Earliest idle execution time still in the future, capped at the fallback interval. Work that is due
     * but could not be claimed waits for a freed worker slot to wake the loop.
     */
    Instant nextDeadline(OffsetDateTime now) {
        Instant fallback = now.toInstant().plus(fallbackInterval);
        return executionStore.findEarliestIdleExecutionTime()
                .map(OffsetDateTime::toInstant)
                .filter(earliest -> earliest.isAfter(now.toInstant()) && earliest.isBefore(fallback))
                .orElse(fallback);
    }

    private void loop() {
        while (running) {
            try {
                tick();
            } catch (RuntimeException e) {
                log.error("Dispatcher tick failed on node {}; retrying on next tick", nodeId, e);
            }
            try {
                Instant deadline;
                try {
                    deadline = nextDeadline(executionStore.now());
                } catch (RuntimeException e) {
                    log.warn("Failed to compute next dispatch time; using fallback interval", e);
                    deadline = Instant.now().plus(fallbackInterval);
                }
                wakeUpSignal.await(deadline);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::loop, "tickq-dispatcher");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Job dispatcher started on node {} with max concurrency {}", nodeId,
                workerPool.getMaxConcurrency());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        loopThread.interrupt();
        workerPool.shutdown(SHUTDOWN_TIMEOUT);
        log.info("Job dispatcher stopped on node {}", nodeId);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    private record DueCandidate(ExecutionItem item, RegisteredFunction function) {
    }
}
