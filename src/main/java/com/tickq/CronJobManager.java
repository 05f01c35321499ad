package com.tickq;

import com.tickq.internal.CronEvaluator;
import com.tickq.internal.CronOccurrenceGenerator;
import com.tickq.internal.FunctionRegistry;
import com.tickq.internal.JobExecutor;
import com.tickq.internal.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Manages cron job definitions. Occurrences are generated from a definition one at a time.
 */
@Service
public class CronJobManager {

    private static final Logger log = LoggerFactory.getLogger(CronJobManager.class);

    private final CronJobRepository cronJobRepository;
    private final CronOccurrenceRepository cronOccurrenceRepository;
    private final FunctionRegistry functionRegistry;
    private final CronEvaluator cronEvaluator;
    private final CronOccurrenceGenerator occurrenceGenerator;
    private final PayloadCodec payloadCodec;
    private final JobExecutor jobExecutor;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public CronJobManager(
            CronJobRepository cronJobRepository,
            CronOccurrenceRepository cronOccurrenceRepository,
            FunctionRegistry functionRegistry,
            CronEvaluator cronEvaluator,
            CronOccurrenceGenerator occurrenceGenerator,
            PayloadCodec payloadCodec,
            JobExecutor jobExecutor,
            TransactionTemplate transactionTemplate,
            @Qualifier("tickqClock") Clock clock) {
        this.cronJobRepository = cronJobRepository;
        this.cronOccurrenceRepository = cronOccurrenceRepository;
        this.functionRegistry = functionRegistry;
        this.cronEvaluator = cronEvaluator;
        this.occurrenceGenerator = occurrenceGenerator;
        this.payloadCodec = payloadCodec;
        this.jobExecutor = jobExecutor;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Stores a definition and materializes its first occurrence.
     *
     * @throws IllegalArgumentException when the function is unknown or the expression cannot be parsed
     */
    public UUID create(CronJobRequest request) {
        String function = validateFunction(request.getFunction());
        String expression = cronEvaluator.validate(request.getExpression());
        validateRetries(request.getRetries(), request.getRetryIntervals());

        OffsetDateTime now = OffsetDateTime.now(clock);
        CronJob cronJob = new CronJob(UUID.randomUUID(), function, expression,
                payloadCodec.encode(request.getPayload()), request.getRetries(), request.getRetryIntervals());
        cronJob.setDescription(request.getDescription());
        cronJob.setCreatedAt(now);
        cronJob.setUpdatedAt(now);
        transactionTemplate.executeWithoutResult(status -> cronJobRepository.save(cronJob));
        log.info("Created cron job {} for function {} with expression '{}'", cronJob.getId(), function, expression);

        occurrenceGenerator.generateNext(cronJob);
        return cronJob.getId();
    }

    /**
     * Updates a definition. An expression change drops idle occurrences and regenerates from the new
     * expression; occurrences already running are unaffected.
     */
    public void update(UUID id, CronJobRequest request) {
        String function = validateFunction(request.getFunction());
        String expression = cronEvaluator.validate(request.getExpression());
        validateRetries(request.getRetries(), request.getRetryIntervals());
        OffsetDateTime now = OffsetDateTime.now(clock);

        transactionTemplate.executeWithoutResult(status -> {
            CronJob cronJob = cronJobRepository.findForUpdateById(id)
                    .orElseThrow(() -> new IllegalArgumentException("Cron job " + id + " not found"));
            if (!cronJob.getExpression().equals(expression)) {
                int dropped = cronOccurrenceRepository.deleteIdleByCronJobId(id);
                log.info("Cron job {} rescheduled from '{}' to '{}'; dropped {} idle occurrences", id,
                        cronJob.getExpression(), expression, dropped);
            }
            cronJob.setFunction(function);
            cronJob.setExpression(expression);
            cronJob.setDescription(request.getDescription());
            cronJob.setPayload(payloadCodec.encode(request.getPayload()));
            cronJob.setRetries(request.getRetries());
            cronJob.setRetryIntervals(request.getRetryIntervals());
            cronJob.setUpdatedAt(now);
        });
        occurrenceGenerator.generateNext(id);
    }

    /**
     * Deletes a definition and all of its occurrences.
     *
     * @return {@code false} when no definition exists with this id
     * @throws IllegalStateException while an occurrence is in progress
     */
    public boolean delete(UUID id) {
        Boolean deleted = transactionTemplate.execute(status -> {
            Optional<CronJob> cronJob = cronJobRepository.findForUpdateById(id);
            if (cronJob.isEmpty()) {
                return false;
            }
            if (cronOccurrenceRepository.existsByCronJobIdAndStatus(id, JobStatus.IN_PROGRESS)) {
                throw new IllegalStateException("Cron job " + id + " cannot be deleted while an occurrence is "
                        + JobStatus.IN_PROGRESS);
            }
            cronOccurrenceRepository.deleteDeletableByCronJobId(id);
            cronJobRepository.delete(cronJob.get());
            return true;
        });
        if (Boolean.TRUE.equals(deleted)) {
            log.info("Deleted cron job {}", id);
        }
        return Boolean.TRUE.equals(deleted);
    }

    /**
     * Cancels a single occurrence. The definition keeps generating further occurrences.
     */
    public boolean cancelOccurrence(UUID occurrenceId, String reason) {
        return jobExecutor.cancel(JobKind.CRON, occurrenceId, reason);
    }

    public Optional<CronJob> find(UUID id) {
        return cronJobRepository.findById(id);
    }

    /**
     * Most recent occurrences first.
     */
    public List<CronOccurrence> findOccurrences(UUID cronJobId, int limit) {
        return cronOccurrenceRepository.findByCronJobIdOrderByExecutionTimeDesc(cronJobId,
                PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Creates a payload-less definition unless one with the same function and expression already exists.
     *
     * @return id of the existing or created definition
     */
    public UUID seed(String function, String expression) {
        String normalizedFunction = validateFunction(function);
        String normalizedExpression = cronEvaluator.validate(expression);
        Optional<CronJob> existing = cronJobRepository
                .findByFunctionAndExpression(normalizedFunction, normalizedExpression)
                .stream()
                .filter(cronJob -> cronJob.getPayload() == null || cronJob.getPayload().length == 0)
                .findFirst();
        if (existing.isPresent()) {
            log.debug("Cron job for function {} with expression '{}' already exists", normalizedFunction,
                    normalizedExpression);
            occurrenceGenerator.generateNext(existing.get());
            return existing.get().getId();
        }
        return create(CronJobRequest.builder(normalizedFunction, normalizedExpression).build());
    }

    private String validateFunction(String function) {
        if (function == null || function.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        String trimmed = function.trim();
        if (!functionRegistry.contains(trimmed)) {
            throw new IllegalArgumentException("No function registered under name '" + trimmed + "'");
        }
        return trimmed;
    }

    private void validateRetries(int retries, int[] retryIntervals) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        for (int interval : retryIntervals) {
            if (interval <= 0) {
                throw new IllegalArgumentException("Retry intervals must be positive, got " + interval);
            }
        }
    }
}
