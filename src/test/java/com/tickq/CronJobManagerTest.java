package com.tickq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickq.annotation.TickerFunction;
import com.tickq.config.TickQProperties;
import com.tickq.internal.CronEvaluator;
import com.tickq.internal.CronOccurrenceGenerator;
import com.tickq.internal.FunctionRegistry;
import com.tickq.internal.JobExecutor;
import com.tickq.internal.PayloadCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CronJobManagerTest {

    private CronJobRepository cronJobRepository;
    private CronOccurrenceRepository cronOccurrenceRepository;
    private CronOccurrenceGenerator occurrenceGenerator;
    private JobExecutor jobExecutor;
    private CronJobManager manager;

    @BeforeEach
    void setUp() {
        cronJobRepository = mock(CronJobRepository.class);
        cronOccurrenceRepository = mock(CronOccurrenceRepository.class);
        occurrenceGenerator = mock(CronOccurrenceGenerator.class);
        jobExecutor = mock(JobExecutor.class);
        PayloadCodec codec = new PayloadCodec(new ObjectMapper(), new TickQProperties());

        manager = new CronJobManager(cronJobRepository, cronOccurrenceRepository,
                FunctionRegistry.of(codec, new ReportFunction()), new CronEvaluator(ZoneOffset.UTC),
                occurrenceGenerator, codec, jobExecutor,
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                new MutableClock(Instant.parse("2025-03-01T10:00:00Z")));
        when(cronJobRepository.save(any(CronJob.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void shouldRejectInvalidExpression() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.create(CronJobRequest.builder("report", "every five minutes").build()));
        assertThrows(IllegalArgumentException.class,
                () -> manager.create(CronJobRequest.builder("report", " ").build()));

        verifyNoInteractions(cronJobRepository);
        verifyNoInteractions(occurrenceGenerator);
    }

    @Test
    void shouldRejectUnknownFunction() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.create(CronJobRequest.builder("unknown", "0 */5 * * * *").build()));

        verifyNoInteractions(cronJobRepository);
    }

    @Test
    void createStoresDefinitionAndGeneratesFirstOccurrence() {
        UUID id = manager.create(CronJobRequest.builder(" report ", " 0 */5 * * * * ")
                .payload(Map.of("format", "pdf"))
                .retries(2)
                .retryIntervals(10, 20)
                .build());

        ArgumentCaptor<CronJob> captor = ArgumentCaptor.forClass(CronJob.class);
        verify(cronJobRepository).save(captor.capture());
        CronJob saved = captor.getValue();
        assertEquals(id, saved.getId());
        assertEquals("report", saved.getFunction());
        assertEquals("0 */5 * * * *", saved.getExpression());
        assertEquals(2, saved.getRetries());
        assertTrue(new String(saved.getPayload(), StandardCharsets.UTF_8).contains("pdf"));
        verify(occurrenceGenerator).generateNext(saved);
    }

    @Test
    void seedReusesExistingPayloadlessDefinition() {
        CronJob existing = new CronJob(UUID.randomUUID(), "report", "0 0 3 * * *", null, 0, new int[0]);
        when(cronJobRepository.findByFunctionAndExpression("report", "0 0 3 * * *")).thenReturn(List.of(existing));

        assertEquals(existing.getId(), manager.seed("report", "0 0 3 * * *"));

        verify(cronJobRepository, never()).save(any());
        verify(occurrenceGenerator).generateNext(existing);
    }

    @Test
    void seedCreatesDefinitionWhenOnlyCustomizedOnesExist() {
        CronJob withPayload = new CronJob(UUID.randomUUID(), "report", "0 0 3 * * *",
                "{\"format\":\"csv\"}".getBytes(StandardCharsets.UTF_8), 0, new int[0]);
        when(cronJobRepository.findByFunctionAndExpression("report", "0 0 3 * * *"))
                .thenReturn(List.of(withPayload));

        UUID id = manager.seed("report", "0 0 3 * * *");

        assertNotEquals(withPayload.getId(), id);
        verify(cronJobRepository).save(any(CronJob.class));
    }

    @Test
    void expressionChangeDropsIdleOccurrences() {
        CronJob cronJob = new CronJob(UUID.randomUUID(), "report", "0 0 3 * * *", null, 0, new int[0]);
        when(cronJobRepository.findForUpdateById(cronJob.getId())).thenReturn(Optional.of(cronJob));

        manager.update(cronJob.getId(), CronJobRequest.builder("report", "0 30 4 * * *").build());

        assertEquals("0 30 4 * * *", cronJob.getExpression());
        verify(cronOccurrenceRepository).deleteIdleByCronJobId(cronJob.getId());
        verify(occurrenceGenerator).generateNext(cronJob.getId());
    }

    @Test
    void unchangedExpressionKeepsIdleOccurrences() {
        CronJob cronJob = new CronJob(UUID.randomUUID(), "report", "0 0 3 * * *", null, 0, new int[0]);
        when(cronJobRepository.findForUpdateById(cronJob.getId())).thenReturn(Optional.of(cronJob));

        manager.update(cronJob.getId(), CronJobRequest.builder("report", "0 0 3 * * *").retries(5).build());

        assertEquals(5, cronJob.getRetries());
        verify(cronOccurrenceRepository, never()).deleteIdleByCronJobId(any());
    }

    @Test
    void deleteIsRefusedWhileAnOccurrenceIsInProgress() {
        CronJob cronJob = new CronJob(UUID.randomUUID(), "report", "0 0 3 * * *", null, 0, new int[0]);
        when(cronJobRepository.findForUpdateById(cronJob.getId())).thenReturn(Optional.of(cronJob));
        when(cronOccurrenceRepository.existsByCronJobIdAndStatus(cronJob.getId(), JobStatus.IN_PROGRESS))
                .thenReturn(true);

        assertThrows(IllegalStateException.class, () -> manager.delete(cronJob.getId()));
        verify(cronJobRepository, never()).delete(any(CronJob.class));
    }

    @Test
    void deleteRemovesDefinitionAndOccurrences() {
        CronJob cronJob = new CronJob(UUID.randomUUID(), "report", "0 0 3 * * *", null, 0, new int[0]);
        when(cronJobRepository.findForUpdateById(cronJob.getId())).thenReturn(Optional.of(cronJob));

        assertTrue(manager.delete(cronJob.getId()));
        verify(cronOccurrenceRepository).deleteDeletableByCronJobId(cronJob.getId());
        verify(cronJobRepository).delete(cronJob);
    }

    @Test
    void cancelOccurrenceDelegatesToExecutor() {
        UUID occurrenceId = UUID.randomUUID();
        when(jobExecutor.cancel(JobKind.CRON, occurrenceId, "maintenance")).thenReturn(true);

        assertTrue(manager.cancelOccurrence(occurrenceId, "maintenance"));
    }

    @TickerFunction("report")
    static class ReportFunction {
        public void execute() {
        }
    }
}
