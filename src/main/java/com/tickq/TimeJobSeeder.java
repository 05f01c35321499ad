package com.tickq;

/**
 * Startup callback for seeding time jobs. Runs after dead-node cleanup and cron seeding.
 */
@FunctionalInterface
public interface TimeJobSeeder {

    void seed(TimeJobManager timeJobManager) throws Exception;
}
