package com.tickq;

import com.tickq.internal.JobDispatcher;
import com.tickq.internal.NodeCoordinator;
import com.tickq.internal.StartupSeeder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Starts background processing on demand when {@code tickq.scheduler.start-mode=manual}. Startup seeding,
 * heartbeats and the dispatcher are started in the same order the application context would use.
 * Calling {@link #start()} when already started is a no-op.
 */
@Component
public class TickQScheduler {

    private static final Logger log = LoggerFactory.getLogger(TickQScheduler.class);

    private final StartupSeeder startupSeeder;
    private final ObjectProvider<NodeCoordinator> nodeCoordinator;
    private final ObjectProvider<JobDispatcher> jobDispatcher;

    public TickQScheduler(
            StartupSeeder startupSeeder,
            ObjectProvider<NodeCoordinator> nodeCoordinator,
            ObjectProvider<JobDispatcher> jobDispatcher) {
        this.startupSeeder = startupSeeder;
        this.nodeCoordinator = nodeCoordinator;
        this.jobDispatcher = jobDispatcher;
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        log.info("Starting TickQ background processing");
        startupSeeder.start();
        NodeCoordinator coordinator = nodeCoordinator.getIfAvailable();
        if (coordinator != null) {
            coordinator.start();
        }
        JobDispatcher dispatcher = jobDispatcher.getIfAvailable();
        if (dispatcher != null) {
            dispatcher.start();
        }
    }

    /**
     * Whether startup has run and, where this node runs the scheduler, the dispatcher is active.
     */
    public boolean isRunning() {
        JobDispatcher dispatcher = jobDispatcher.getIfAvailable();
        return startupSeeder.isRunning() && (dispatcher == null || dispatcher.isRunning());
    }
}
