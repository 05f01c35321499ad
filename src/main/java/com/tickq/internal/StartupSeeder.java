package com.tickq.internal;

import com.tickq.CronJobManager;
import com.tickq.CronJobSeeder;
import com.tickq.TimeJobManager;
import com.tickq.TimeJobSeeder;
import com.tickq.config.TickQProperties;
import com.tickq.internal.FunctionRegistry.RegisteredFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Startup sequence, run before the dispatcher begins claiming work:
 * release locks abandoned by dead nodes, seed cron jobs declared on {@code @TickerFunction}, run
 * {@link TimeJobSeeder} beans, run {@link CronJobSeeder} beans, then generate any missing occurrences.
 * Declared cron seeding is skipped when {@code tickq.seeding.automatic=false}.
 */
@Component
public class StartupSeeder implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StartupSeeder.class);

    private final ObjectProvider<NodeCoordinator> nodeCoordinator;
    private final FunctionRegistry functionRegistry;
    private final TimeJobManager timeJobManager;
    private final CronJobManager cronJobManager;
    private final CronOccurrenceGenerator occurrenceGenerator;
    private final ObjectProvider<TimeJobSeeder> timeJobSeeders;
    private final ObjectProvider<CronJobSeeder> cronJobSeeders;
    private final boolean autoStartup;
    private final boolean automaticSeeding;
    private volatile boolean running = false;

    public StartupSeeder(
            ObjectProvider<NodeCoordinator> nodeCoordinator,
            FunctionRegistry functionRegistry,
            TimeJobManager timeJobManager,
            CronJobManager cronJobManager,
            CronOccurrenceGenerator occurrenceGenerator,
            ObjectProvider<TimeJobSeeder> timeJobSeeders,
            ObjectProvider<CronJobSeeder> cronJobSeeders,
            TickQProperties properties) {
        this.nodeCoordinator = nodeCoordinator;
        this.functionRegistry = functionRegistry;
        this.timeJobManager = timeJobManager;
        this.cronJobManager = cronJobManager;
        this.occurrenceGenerator = occurrenceGenerator;
        this.timeJobSeeders = timeJobSeeders;
        this.cronJobSeeders = cronJobSeeders;
        this.autoStartup = properties.getScheduler().isAutoStartup();
        this.automaticSeeding = properties.getSeeding().isAutomatic();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        NodeCoordinator coordinator = nodeCoordinator.getIfAvailable();
        if (coordinator != null) {
            try {
                coordinator.releaseAbandonedLocks();
            } catch (RuntimeException e) {
                log.warn("Startup cleanup of dead node locks failed; the periodic sweep will retry", e);
            }
        }

        if (automaticSeeding) {
            seedDeclaredCronJobs();
        } else {
            log.info("Automatic seeding of declared cron jobs is disabled");
        }

        timeJobSeeders.orderedStream().forEach(seeder -> {
            try {
                seeder.seed(timeJobManager);
            } catch (Exception e) {
                log.error("Time job seeder {} failed", seeder.getClass().getName(), e);
            }
        });
        cronJobSeeders.orderedStream().forEach(seeder -> {
            try {
                seeder.seed(cronJobManager);
            } catch (Exception e) {
                log.error("Cron job seeder {} failed", seeder.getClass().getName(), e);
            }
        });

        try {
            int generated = occurrenceGenerator.generateMissing();
            if (generated > 0) {
                log.info("Generated {} missing cron occurrences on startup", generated);
            }
        } catch (RuntimeException e) {
            log.error("Failed to generate missing cron occurrences on startup", e);
        }
        this.running = true;
    }

    private void seedDeclaredCronJobs() {
        log.info("Checking for cron jobs declared on functions...");
        for (RegisteredFunction function : functionRegistry.all()) {
            if (function.cron() == null) {
                continue;
            }
            try {
                cronJobManager.seed(function.name(), function.cron());
            } catch (RuntimeException e) {
                log.error("Failed to seed cron job for function {} with expression '{}'", function.name(),
                        function.cron(), e);
            }
        }
    }

    @Override
    public void stop() {
        this.running = false;
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
        return Integer.MAX_VALUE - 2;
    }
}
