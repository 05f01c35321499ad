package com.tickq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickq.annotation.TickerFunction;
import com.tickq.config.TickQProperties;
import com.tickq.internal.FunctionRegistry;
import com.tickq.internal.JobExecutor;
import com.tickq.internal.PayloadCodec;
import com.tickq.internal.WakeUpSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TimeJobManagerValidationTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private TimeJobRepository timeJobRepository;
    private JobExecutor jobExecutor;
    private WakeUpSignal wakeUpSignal;
    private TimeJobManager manager;

    @BeforeEach
    void setUp() {
        timeJobRepository = mock(TimeJobRepository.class);
        jobExecutor = mock(JobExecutor.class);
        wakeUpSignal = mock(WakeUpSignal.class);
        PayloadCodec codec = new PayloadCodec(new ObjectMapper(), new TickQProperties());

        manager = new TimeJobManager(timeJobRepository, FunctionRegistry.of(codec, new StepFunction()), codec,
                jobExecutor, wakeUpSignal, new TransactionTemplate(mock(PlatformTransactionManager.class)),
                new MutableClock(NOW));
    }

    @Test
    void shouldRejectBlankOrUnknownFunction() {
        assertThrows(IllegalArgumentException.class, () -> manager.schedule(TimeJobRequest.builder("  ").build()));
        assertThrows(IllegalArgumentException.class,
                () -> manager.schedule(TimeJobRequest.builder("not-registered").build()));

        verifyNoInteractions(timeJobRepository);
    }

    @Test
    void shouldRejectInvalidRetrySettings() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.schedule(TimeJobRequest.builder("step").retries(-1).build()));
        assertThrows(IllegalArgumentException.class,
                () -> manager.schedule(TimeJobRequest.builder("step").retries(2).retryIntervals(5, 0).build()));

        verifyNoInteractions(timeJobRepository);
    }

    @Test
    void shouldRejectRunConditionOnRoot() {
        TimeJobRequest request = TimeJobRequest.builder("step").runCondition(RunCondition.ON_SUCCESS).build();

        assertThrows(IllegalArgumentException.class, () -> manager.schedule(request));
        verifyNoInteractions(timeJobRepository);
    }

    @Test
    void shouldRequireRunConditionOnChildren() {
        TimeJobRequest request = TimeJobRequest.builder("step")
                .child(TimeJobRequest.builder("step").build())
                .build();

        assertThrows(IllegalArgumentException.class, () -> manager.schedule(request));
        verifyNoInteractions(timeJobRepository);
    }

    @Test
    void shouldLimitChildrenPerJob() {
        TimeJobRequest.Builder five = TimeJobRequest.builder("step");
        TimeJobRequest.Builder six = TimeJobRequest.builder("step");
        for (int i = 0; i < TimeJobManager.MAX_CHILDREN; i++) {
            five.child(child(RunCondition.ON_SUCCESS));
            six.child(child(RunCondition.ON_SUCCESS));
        }
        six.child(child(RunCondition.ON_SUCCESS));

        assertThrows(IllegalArgumentException.class, () -> manager.schedule(six.build()));
        manager.schedule(five.build());

        List<TimeJob> saved = captureSaved();
        assertEquals(TimeJobManager.MAX_CHILDREN + 1, saved.size());
    }

    @Test
    void shouldLimitChainDepthToThreeGenerations() {
        TimeJobRequest grandchild = child(RunCondition.ON_ANY_COMPLETED_STATUS);
        TimeJobRequest threeGenerations = TimeJobRequest.builder("step")
                .child(TimeJobRequest.builder("step").runCondition(RunCondition.ON_SUCCESS).child(grandchild).build())
                .build();
        TimeJobRequest fourGenerations = TimeJobRequest.builder("step")
                .child(TimeJobRequest.builder("step").runCondition(RunCondition.ON_SUCCESS)
                        .child(TimeJobRequest.builder("step").runCondition(RunCondition.ON_SUCCESS)
                                .child(child(RunCondition.ON_SUCCESS))
                                .build())
                        .build())
                .build();

        assertThrows(IllegalArgumentException.class, () -> manager.schedule(fourGenerations));
        manager.schedule(threeGenerations);

        assertEquals(3, captureSaved().size());
    }

    @Test
    void shouldDefaultExecutionTimeToOneSecondFromNow() {
        UUID id = manager.schedule(TimeJobRequest.builder("step").build());

        TimeJob saved = captureSaved().get(0);
        OffsetDateTime expected = OffsetDateTime.ofInstant(NOW.plusSeconds(1), ZoneOffset.UTC);
        assertEquals(id, saved.getId());
        assertEquals(expected.toInstant(), saved.getExecutionTime().toInstant());
        assertEquals(JobStatus.IDLE, saved.getStatus());
        verify(wakeUpSignal).wakeAt(saved.getExecutionTime());
    }

    @Test
    void childrenAreStoredUnscheduledAndLinkedToTheirParent() {
        OffsetDateTime at = OffsetDateTime.parse("2025-03-01T12:00:00Z");
        UUID rootId = manager.schedule(TimeJobRequest.builder("  step  ")
                .executionTime(at)
                .child(child(RunCondition.ON_FAILURE))
                .build());

        List<TimeJob> saved = captureSaved();
        TimeJob root = saved.get(0);
        TimeJob child = saved.get(1);
        assertEquals("step", root.getFunction());
        assertEquals(at, root.getExecutionTime());
        assertEquals(rootId, child.getParentId());
        assertEquals(RunCondition.ON_FAILURE, child.getRunCondition());
        assertNull(child.getExecutionTime());
    }

    @Test
    void shouldRejectEmptyBatch() {
        assertThrows(IllegalArgumentException.class, () -> manager.scheduleAll(List.of()));
    }

    @Test
    void shouldRejectUpdateOfJobThatIsNoLongerIdle() {
        TimeJob queued = job(JobStatus.QUEUED);
        when(timeJobRepository.findForUpdateById(queued.getId())).thenReturn(Optional.of(queued));

        assertThrows(IllegalStateException.class,
                () -> manager.update(queued.getId(), TimeJobRequest.builder("step").build()));
    }

    @Test
    void shouldUpdateIdleRootJob() {
        TimeJob idle = job(JobStatus.IDLE);
        OffsetDateTime at = OffsetDateTime.parse("2025-03-02T08:00:00Z");
        when(timeJobRepository.findForUpdateById(idle.getId())).thenReturn(Optional.of(idle));

        manager.update(idle.getId(), TimeJobRequest.builder("step").executionTime(at).retries(4).build());

        assertEquals(at, idle.getExecutionTime());
        assertEquals(4, idle.getRetries());
        verify(wakeUpSignal).wakeAt(at);
    }

    @Test
    void shouldRejectDeleteWhileDescendantIsInProgress() {
        TimeJob root = job(JobStatus.DONE);
        TimeJob running = job(JobStatus.IN_PROGRESS);
        running.setParentId(root.getId());
        when(timeJobRepository.findForUpdateById(root.getId())).thenReturn(Optional.of(root));
        when(timeJobRepository.findByParentId(root.getId())).thenReturn(List.of(running));

        assertThrows(IllegalStateException.class, () -> manager.delete(root.getId()));
        verify(timeJobRepository, never()).deleteDeletable(anyCollection());
    }

    @Test
    void shouldDeleteJobTogetherWithDescendants() {
        TimeJob root = job(JobStatus.FAILED);
        TimeJob skipped = job(JobStatus.SKIPPED);
        skipped.setParentId(root.getId());
        when(timeJobRepository.findForUpdateById(root.getId())).thenReturn(Optional.of(root));
        when(timeJobRepository.findByParentId(root.getId())).thenReturn(List.of(skipped));
        when(timeJobRepository.deleteDeletable(anyCollection())).thenReturn(2);

        assertTrue(manager.delete(root.getId()));
    }

    @Test
    void deletingUnknownJobReturnsFalse() {
        when(timeJobRepository.findForUpdateById(any())).thenReturn(Optional.empty());

        assertFalse(manager.delete(UUID.randomUUID()));
    }

    @Test
    void cancelDelegatesToExecutor() {
        UUID id = UUID.randomUUID();
        when(jobExecutor.cancel(JobKind.TIME, id, "no longer needed")).thenReturn(true);

        assertTrue(manager.cancel(id, "no longer needed"));
    }

    @SuppressWarnings("unchecked")
    private List<TimeJob> captureSaved() {
        ArgumentCaptor<List<TimeJob>> captor = ArgumentCaptor.forClass(List.class);
        verify(timeJobRepository).saveAll(captor.capture());
        return captor.getValue();
    }

    private static TimeJobRequest child(RunCondition condition) {
        return TimeJobRequest.builder("step").runCondition(condition).build();
    }

    private static TimeJob job(JobStatus status) {
        TimeJob job = new TimeJob(UUID.randomUUID(), "step", null,
                OffsetDateTime.parse("2025-03-01T11:00:00Z"), 0, new int[0]);
        job.setStatus(status);
        return job;
    }

    @TickerFunction("step")
    static class StepFunction {
        public void execute() {
        }
    }
}
