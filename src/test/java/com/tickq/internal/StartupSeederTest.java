package com.tickq.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickq.CronJobManager;
import com.tickq.CronJobSeeder;
import com.tickq.TimeJobManager;
import com.tickq.TimeJobSeeder;
import com.tickq.annotation.TickerFunction;
import com.tickq.config.TickQProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.ObjectProvider;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StartupSeederTest {

    private NodeCoordinator nodeCoordinator;
    private TimeJobManager timeJobManager;
    private CronJobManager cronJobManager;
    private CronOccurrenceGenerator occurrenceGenerator;
    private TimeJobSeeder timeJobSeeder;
    private CronJobSeeder cronJobSeeder;
    private FunctionRegistry registry;
    private ObjectProvider<NodeCoordinator> coordinatorProvider;
    private ObjectProvider<TimeJobSeeder> timeSeeders;
    private ObjectProvider<CronJobSeeder> cronSeeders;
    private StartupSeeder seeder;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        nodeCoordinator = mock(NodeCoordinator.class);
        timeJobManager = mock(TimeJobManager.class);
        cronJobManager = mock(CronJobManager.class);
        occurrenceGenerator = mock(CronOccurrenceGenerator.class);
        timeJobSeeder = mock(TimeJobSeeder.class);
        cronJobSeeder = mock(CronJobSeeder.class);

        coordinatorProvider = mock(ObjectProvider.class);
        when(coordinatorProvider.getIfAvailable()).thenReturn(nodeCoordinator);
        timeSeeders = mock(ObjectProvider.class);
        when(timeSeeders.orderedStream()).thenAnswer(invocation -> Stream.of(timeJobSeeder));
        cronSeeders = mock(ObjectProvider.class);
        when(cronSeeders.orderedStream()).thenAnswer(invocation -> Stream.of(cronJobSeeder));

        registry = FunctionRegistry.of(
                new PayloadCodec(new ObjectMapper(), new TickQProperties()),
                new NightlyCleanup(), new OnDemandExport());
        seeder = seeder(new TickQProperties());
    }

    private StartupSeeder seeder(TickQProperties properties) {
        return new StartupSeeder(coordinatorProvider, registry, timeJobManager, cronJobManager,
                occurrenceGenerator, timeSeeders, cronSeeders, properties);
    }

    @Test
    void shouldRunStartupStepsInOrder() throws Exception {
        seeder.start();

        InOrder order = inOrder(nodeCoordinator, cronJobManager, timeJobSeeder, cronJobSeeder, occurrenceGenerator);
        order.verify(nodeCoordinator).releaseAbandonedLocks();
        order.verify(cronJobManager).seed("nightly-cleanup", "0 0 2 * * *");
        order.verify(timeJobSeeder).seed(timeJobManager);
        order.verify(cronJobSeeder).seed(cronJobManager);
        order.verify(occurrenceGenerator).generateMissing();
        verify(cronJobManager, never()).seed(eq("on-demand-export"), any());
        assertTrue(seeder.isRunning());
    }

    @Test
    void failingStepsDoNotAbortStartup() throws Exception {
        when(nodeCoordinator.releaseAbandonedLocks()).thenThrow(new IllegalStateException("redis down"));
        doThrow(new IllegalArgumentException("seed failed")).when(cronJobManager).seed(any(), any());
        doThrow(new Exception("seeder failed")).when(timeJobSeeder).seed(any());

        assertDoesNotThrow(seeder::start);

        verify(cronJobSeeder).seed(cronJobManager);
        verify(occurrenceGenerator).generateMissing();
    }

    @Test
    void disabledAutomaticSeedingSkipsDeclaredCronJobsOnly() throws Exception {
        TickQProperties properties = new TickQProperties();
        properties.getSeeding().setAutomatic(false);
        StartupSeeder withoutSeeding = seeder(properties);

        withoutSeeding.start();

        verify(cronJobManager, never()).seed(any(), any());
        verify(nodeCoordinator).releaseAbandonedLocks();
        verify(timeJobSeeder).seed(timeJobManager);
        verify(cronJobSeeder).seed(cronJobManager);
        verify(occurrenceGenerator).generateMissing();
    }

    @Test
    void manualStartModeDisablesAutoStartup() {
        assertTrue(seeder.isAutoStartup());

        TickQProperties properties = new TickQProperties();
        properties.getScheduler().setStartMode(TickQProperties.StartMode.MANUAL);

        assertFalse(seeder(properties).isAutoStartup());
    }

    @Test
    void secondStartIsIgnored() {
        seeder.start();
        seeder.start();

        verify(occurrenceGenerator).generateMissing();
    }

    @TickerFunction(value = "nightly-cleanup", cron = "0 0 2 * * *")
    static class NightlyCleanup {
        public void execute() {
        }
    }

    @TickerFunction("on-demand-export")
    static class OnDemandExport {
        public void execute() {
        }
    }
}
