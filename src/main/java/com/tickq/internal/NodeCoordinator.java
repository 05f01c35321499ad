package com.tickq.internal;

import com.tickq.config.TickQProperties;
import com.tickq.coordination.CoordinationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Publishes this node's heartbeat and returns work locked by dead nodes to the idle pool.
 */
@Component
@ConditionalOnProperty(prefix = "tickq.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NodeCoordinator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(NodeCoordinator.class);

    private final CoordinationStore coordinationStore;
    private final ExecutionStore executionStore;
    private final WakeUpSignal wakeUpSignal;
    private final String nodeId;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTtl;

    private ScheduledExecutorService heartbeatExecutor;
    private final boolean autoStartup;
    private volatile boolean running = false;

    public NodeCoordinator(
            CoordinationStore coordinationStore,
            ExecutionStore executionStore,
            WakeUpSignal wakeUpSignal,
            TickQProperties properties) {
        this.coordinationStore = coordinationStore;
        this.executionStore = executionStore;
        this.wakeUpSignal = wakeUpSignal;
        this.nodeId = properties.getScheduler().getNodeIdentifier();
        this.heartbeatInterval = properties.getCoordination().getHeartbeatInterval();
        this.heartbeatTtl = properties.getCoordination().getHeartbeatTtl();
        this.autoStartup = properties.getScheduler().isAutoStartup();
    }

    public String getNodeId() {
        return nodeId;
    }

    public Duration getHeartbeatTtl() {
        return heartbeatTtl;
    }

    /**
     * Startup cleanup. Every lock holder without a live heartbeat is treated as dead, including this node's
     * own identifier left behind by a previous run.
     *
     * @return number of jobs and occurrences returned to idle
     */
    public int releaseAbandonedLocks() {
        Set<String> dead = new LinkedHashSet<>();
        for (String holder : executionStore.findLockHolders()) {
            if (holder.equals(nodeId) || !coordinationStore.isLive(holder)) {
                dead.add(holder);
            }
        }
        dead.addAll(coordinationStore.listDeadNodes());
        int released = release(dead);
        if (released > 0) {
            log.info("Released {} jobs locked by dead nodes {}", released, dead);
        }
        return released;
    }

    /**
     * Periodic cleanup of registered nodes whose heartbeat expired.
     */
    public int sweepDeadNodes() {
        Set<String> dead = new LinkedHashSet<>(coordinationStore.listDeadNodes());
        dead.remove(nodeId);
        int released = release(dead);
        if (released > 0) {
            log.warn("Released {} jobs locked by dead nodes {}", released, dead);
        }
        return released;
    }

    public void heartbeat() {
        coordinationStore.heartbeat(nodeId, heartbeatTtl);
        log.trace("Heartbeat written for node {} with ttl {}", nodeId, heartbeatTtl);
    }

    private int release(Set<String> deadNodes) {
        if (deadNodes.isEmpty()) {
            return 0;
        }
        int released = executionStore.releaseLocksForDeadNodes(deadNodes);
        for (String deadNode : deadNodes) {
            if (!deadNode.equals(nodeId)) {
                coordinationStore.forget(deadNode);
            }
        }
        if (released > 0) {
            wakeUpSignal.wakeNow();
        }
        return released;
    }

    private void tick() {
        try {
            heartbeat();
        } catch (RuntimeException e) {
            log.warn("Failed to write heartbeat for node {}; continuing without coordination", nodeId, e);
            return;
        }
        try {
            sweepDeadNodes();
        } catch (RuntimeException e) {
            log.warn("Dead node sweep failed", e);
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("tickq-heartbeat-"));
        long intervalMs = Math.max(1L, heartbeatInterval.toMillis());
        heartbeatExecutor.scheduleWithFixedDelay(this::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Node {} publishing heartbeats every {} (ttl {})", nodeId, heartbeatInterval, heartbeatTtl);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        heartbeatExecutor.shutdownNow();
        try {
            coordinationStore.resign(nodeId);
        } catch (RuntimeException e) {
            log.warn("Failed to remove heartbeat of node {} on shutdown", nodeId, e);
        }
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
        return Integer.MAX_VALUE - 1;
    }
}
