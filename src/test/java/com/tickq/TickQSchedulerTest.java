package com.tickq;

import com.tickq.config.TickQProperties;
import com.tickq.internal.CronOccurrenceGenerator;
import com.tickq.internal.FunctionRegistry;
import com.tickq.internal.JobDispatcher;
import com.tickq.internal.NodeCoordinator;
import com.tickq.internal.StartupSeeder;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TickQSchedulerTest {

    @Test
    @SuppressWarnings("unchecked")
    void shouldStartComponentsInLifecycleOrder() {
        StartupSeeder startupSeeder = mock(StartupSeeder.class);
        NodeCoordinator nodeCoordinator = mock(NodeCoordinator.class);
        JobDispatcher jobDispatcher = mock(JobDispatcher.class);
        ObjectProvider<NodeCoordinator> coordinatorProvider = mock(ObjectProvider.class);
        ObjectProvider<JobDispatcher> dispatcherProvider = mock(ObjectProvider.class);
        when(coordinatorProvider.getIfAvailable()).thenReturn(nodeCoordinator);
        when(dispatcherProvider.getIfAvailable()).thenReturn(jobDispatcher);

        new TickQScheduler(startupSeeder, coordinatorProvider, dispatcherProvider).start();

        InOrder order = inOrder(startupSeeder, nodeCoordinator, jobDispatcher);
        order.verify(startupSeeder).start();
        order.verify(nodeCoordinator).start();
        order.verify(jobDispatcher).start();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNotRestartWhenAlreadyRunning() {
        StartupSeeder startupSeeder = mock(StartupSeeder.class);
        ObjectProvider<NodeCoordinator> coordinatorProvider = mock(ObjectProvider.class);
        ObjectProvider<JobDispatcher> dispatcherProvider = mock(ObjectProvider.class);
        when(startupSeeder.isRunning()).thenReturn(true);

        new TickQScheduler(startupSeeder, coordinatorProvider, dispatcherProvider).start();

        verify(startupSeeder, never()).start();
    }

    @Test
    void manualStartModeWaitsForExplicitStart() {
        CronOccurrenceGenerator occurrenceGenerator = mock(CronOccurrenceGenerator.class);

        new ApplicationContextRunner()
                .withBean(TickQProperties.class, () -> {
                    TickQProperties properties = new TickQProperties();
                    properties.getScheduler().setStartMode(TickQProperties.StartMode.MANUAL);
                    return properties;
                })
                .withBean(FunctionRegistry.class, () -> mock(FunctionRegistry.class))
                .withBean(TimeJobManager.class, () -> mock(TimeJobManager.class))
                .withBean(CronJobManager.class, () -> mock(CronJobManager.class))
                .withBean(CronOccurrenceGenerator.class, () -> occurrenceGenerator)
                .withBean(StartupSeeder.class)
                .withBean(TickQScheduler.class)
                .run(context -> {
                    TickQScheduler scheduler = context.getBean(TickQScheduler.class);
                    assertFalse(scheduler.isRunning());
                    verify(occurrenceGenerator, never()).generateMissing();

                    scheduler.start();

                    assertTrue(scheduler.isRunning());
                    verify(occurrenceGenerator).generateMissing();
                });
    }
}
