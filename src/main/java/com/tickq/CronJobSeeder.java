package com.tickq;

/**
 * Startup callback for seeding cron jobs. Runs last in the startup sequence.
 */
@FunctionalInterface
public interface CronJobSeeder {

    void seed(CronJobManager cronJobManager) throws Exception;
}
