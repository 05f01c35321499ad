package com.tickq.internal;

import com.tickq.CronJob;
import com.tickq.CronJobRepository;
import com.tickq.CronOccurrence;
import com.tickq.CronOccurrenceRepository;
import com.tickq.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Materializes the next occurrence of a cron job once it has no idle or queued occurrence left.
 * The next slot is strictly after both the latest existing occurrence and the current time, so generation
 * never backfills missed slots.
 */
@Component
public class CronOccurrenceGenerator {

    private static final Logger log = LoggerFactory.getLogger(CronOccurrenceGenerator.class);

    private final CronJobRepository cronJobRepository;
    private final CronOccurrenceRepository cronOccurrenceRepository;
    private final CronEvaluator cronEvaluator;
    private final TransactionTemplate transactionTemplate;
    private final WakeUpSignal wakeUpSignal;
    private final Clock clock;

    public CronOccurrenceGenerator(
            CronJobRepository cronJobRepository,
            CronOccurrenceRepository cronOccurrenceRepository,
            CronEvaluator cronEvaluator,
            TransactionTemplate transactionTemplate,
            WakeUpSignal wakeUpSignal,
            @Qualifier("tickqClock") Clock clock) {
        this.cronJobRepository = cronJobRepository;
        this.cronOccurrenceRepository = cronOccurrenceRepository;
        this.cronEvaluator = cronEvaluator;
        this.transactionTemplate = transactionTemplate;
        this.wakeUpSignal = wakeUpSignal;
        this.clock = clock;
    }

    /**
     * Generates the next occurrence for every cron job that has none pending.
     *
     * @return number of occurrences created
     */
    public int generateMissing() {
        int created = 0;
        for (CronJob cronJob : cronJobRepository.findWithoutPendingOccurrence()) {
            if (generateNext(cronJob).isPresent()) {
                created++;
            }
        }
        return created;
    }

    public Optional<CronOccurrence> generateNext(UUID cronJobId) {
        return cronJobRepository.findById(cronJobId).flatMap(this::generateNext);
    }

    public Optional<CronOccurrence> generateNext(CronJob cronJob) {
        if (!pendingOccurrences(cronJob.getId()).isEmpty()) {
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime base = cronOccurrenceRepository
                .findByCronJobIdOrderByExecutionTimeDesc(cronJob.getId(), PageRequest.of(0, 1))
                .stream()
                .findFirst()
                .map(CronOccurrence::getExecutionTime)
                .filter(latest -> latest.isAfter(now))
                .orElse(now);

        OffsetDateTime next;
        try {
            next = cronEvaluator.next(cronJob.getExpression(), base);
        } catch (IllegalArgumentException e) {
            log.error("Cron job {} has an invalid expression '{}'; no occurrence generated", cronJob.getId(),
                    cronJob.getExpression(), e);
            return Optional.empty();
        }
        if (next == null) {
            log.info("Cron job {} with expression '{}' has no further occurrences", cronJob.getId(),
                    cronJob.getExpression());
            return Optional.empty();
        }

        CronOccurrence occurrence = new CronOccurrence(UUID.randomUUID(), cronJob.getId(), next);
        try {
            transactionTemplate.executeWithoutResult(status -> cronOccurrenceRepository.saveAndFlush(occurrence));
        } catch (DataIntegrityViolationException duplicateSlot) {
            log.debug("Occurrence of cron job {} at {} was already generated by another node", cronJob.getId(),
                    next);
            return Optional.empty();
        }

        // Another node may have inserted a different slot concurrently; keep only the earliest.
        List<CronOccurrence> pending = pendingOccurrences(cronJob.getId());
        if (pending.size() > 1) {
            CronOccurrence earliest = pending.stream()
                    .min(Comparator.comparing(CronOccurrence::getExecutionTime)
                            .thenComparing(CronOccurrence::getId))
                    .orElseThrow();
            if (!earliest.getId().equals(occurrence.getId())) {
                transactionTemplate.executeWithoutResult(
                        status -> cronOccurrenceRepository.deleteIdleById(occurrence.getId()));
                return Optional.empty();
            }
        }

        log.debug("Generated occurrence {} of cron job {} for {}", occurrence.getId(), cronJob.getId(), next);
        wakeUpSignal.wakeAt(next);
        return Optional.of(occurrence);
    }

    private List<CronOccurrence> pendingOccurrences(UUID cronJobId) {
        return cronOccurrenceRepository.findByCronJobIdAndStatusIn(cronJobId, JobStatus.PENDING);
    }
}
