package com.tickq.internal;

import com.tickq.CronJob;
import com.tickq.CronJobRepository;
import com.tickq.CronOccurrence;
import com.tickq.CronOccurrenceRepository;
import com.tickq.JobKind;
import com.tickq.JobStatus;
import com.tickq.TimeJob;
import com.tickq.TimeJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Atomic per-entity operations shared by time jobs and cron occurrences. Every transition is a conditional
 * update that reports whether this node won it.
 */
@Component
public class ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStore.class);

    private final TimeJobRepository timeJobRepository;
    private final CronJobRepository cronJobRepository;
    private final CronOccurrenceRepository cronOccurrenceRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ExecutionStore(
            TimeJobRepository timeJobRepository,
            CronJobRepository cronJobRepository,
            CronOccurrenceRepository cronOccurrenceRepository,
            TransactionTemplate transactionTemplate,
            @Qualifier("tickqClock") Clock clock) {
        this.timeJobRepository = timeJobRepository;
        this.cronJobRepository = cronJobRepository;
        this.cronOccurrenceRepository = cronOccurrenceRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    /**
     * Idle time jobs and occurrences due at {@code now}, earliest first.
     */
    public List<ExecutionItem> findDue(OffsetDateTime now, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<ExecutionItem> items = new ArrayList<>();
        for (TimeJob job : timeJobRepository.findDueJobs(now, page)) {
            items.add(ExecutionItem.of(job));
        }

        List<CronOccurrence> occurrences = cronOccurrenceRepository.findDueOccurrences(now, page);
        if (!occurrences.isEmpty()) {
            Set<UUID> cronJobIds = occurrences.stream().map(CronOccurrence::getCronJobId).collect(Collectors.toSet());
            Map<UUID, CronJob> cronJobs = cronJobRepository.findAllById(cronJobIds).stream()
                    .collect(Collectors.toMap(CronJob::getId, Function.identity()));
            for (CronOccurrence occurrence : occurrences) {
                CronJob cronJob = cronJobs.get(occurrence.getCronJobId());
                if (cronJob == null) {
                    log.warn("Dropping occurrence {} because cron job {} no longer exists", occurrence.getId(),
                            occurrence.getCronJobId());
                    transactionTemplate.executeWithoutResult(
                            status -> cronOccurrenceRepository.deleteIdleById(occurrence.getId()));
                    continue;
                }
                items.add(ExecutionItem.of(occurrence, cronJob));
            }
        }

        items.sort(Comparator.comparing(ExecutionItem::executionTime));
        return items.size() > limit ? List.copyOf(items.subList(0, limit)) : items;
    }

    public Optional<OffsetDateTime> findEarliestIdleExecutionTime() {
        Optional<OffsetDateTime> timeJobs = timeJobRepository.findEarliestIdleExecutionTime();
        Optional<OffsetDateTime> occurrences = cronOccurrenceRepository.findEarliestIdleExecutionTime();
        if (timeJobs.isEmpty()) {
            return occurrences;
        }
        if (occurrences.isEmpty()) {
            return timeJobs;
        }
        return Optional.of(timeJobs.get().isBefore(occurrences.get()) ? timeJobs.get() : occurrences.get());
    }

    public boolean tryClaim(JobKind kind, UUID id, String nodeId) {
        OffsetDateTime now = now();
        Integer updated = transactionTemplate.execute(status -> kind == JobKind.TIME
                ? timeJobRepository.claim(id, nodeId, now)
                : cronOccurrenceRepository.claim(id, nodeId, now));
        return toAffectedRows(updated) > 0;
    }

    public boolean markInProgress(ExecutionItem item, String nodeId, OffsetDateTime startedAt) {
        Integer updated = transactionTemplate.execute(status -> item.kind() == JobKind.TIME
                ? timeJobRepository.markInProgress(item.id(), nodeId, startedAt)
                : cronOccurrenceRepository.markInProgress(item.id(), nodeId, startedAt));
        return toAffectedRows(updated) > 0;
    }

    public boolean markCompleted(ExecutionItem item, JobStatus finalStatus, long elapsedMs, String nodeId) {
        OffsetDateTime now = now();
        Integer updated = transactionTemplate.execute(status -> item.kind() == JobKind.TIME
                ? timeJobRepository.markCompleted(item.id(), finalStatus, elapsedMs, now, nodeId)
                : cronOccurrenceRepository.markCompleted(item.id(), finalStatus, elapsedMs, now, nodeId));
        return toAffectedRows(updated) > 0;
    }

    public boolean markFailed(ExecutionItem item, String exceptionMessage, long elapsedMs, String nodeId) {
        OffsetDateTime now = now();
        Integer updated = transactionTemplate.execute(status -> item.kind() == JobKind.TIME
                ? timeJobRepository.markFailedTerminal(item.id(), item.retryCount(), exceptionMessage, elapsedMs,
                        now, nodeId)
                : cronOccurrenceRepository.markFailedTerminal(item.id(), item.retryCount(), exceptionMessage,
                        elapsedMs, now, nodeId));
        return toAffectedRows(updated) > 0;
    }

    public boolean markForRetry(ExecutionItem item, String exceptionMessage, long elapsedMs, OffsetDateTime nextRunAt,
            String nodeId) {
        OffsetDateTime now = now();
        int nextRetryCount = item.retryCount() + 1;
        Integer updated = transactionTemplate.execute(status -> item.kind() == JobKind.TIME
                ? timeJobRepository.markForRetry(item.id(), item.retryCount(), nextRetryCount, exceptionMessage,
                        elapsedMs, nextRunAt, now, nodeId)
                : cronOccurrenceRepository.markForRetry(item.id(), item.retryCount(), nextRetryCount,
                        exceptionMessage, elapsedMs, nextRunAt, now, nodeId));
        return toAffectedRows(updated) > 0;
    }

    /**
     * Moves an in-progress entity owned by {@code nodeId} to {@link JobStatus#CANCELLED} or
     * {@link JobStatus#SKIPPED}.
     */
    public boolean markInterrupted(ExecutionItem item, JobStatus finalStatus, String reason, long elapsedMs,
            String nodeId) {
        OffsetDateTime now = now();
        Integer updated = transactionTemplate.execute(status -> item.kind() == JobKind.TIME
                ? timeJobRepository.markInterrupted(item.id(), finalStatus, reason, elapsedMs, now, nodeId)
                : cronOccurrenceRepository.markInterrupted(item.id(), finalStatus, reason, elapsedMs, now, nodeId));
        return toAffectedRows(updated) > 0;
    }

    /**
     * Cancels an entity that has not started yet.
     */
    public boolean cancelPending(JobKind kind, UUID id, String reason) {
        OffsetDateTime now = now();
        Integer updated = transactionTemplate.execute(status -> kind == JobKind.TIME
                ? timeJobRepository.cancelPending(id, reason, now)
                : cronOccurrenceRepository.cancelPending(id, reason, now));
        return toAffectedRows(updated) > 0;
    }

    public Optional<JobStatus> findStatus(JobKind kind, UUID id) {
        return kind == JobKind.TIME
                ? timeJobRepository.findById(id).map(TimeJob::getStatus)
                : cronOccurrenceRepository.findById(id).map(CronOccurrence::getStatus);
    }

    public boolean isOtherOccurrenceRunning(UUID cronJobId, UUID occurrenceId) {
        return cronOccurrenceRepository.existsByCronJobIdAndStatusAndIdNot(cronJobId, JobStatus.IN_PROGRESS,
                occurrenceId);
    }

    public List<TimeJob> findChildren(UUID parentId) {
        return timeJobRepository.findByParentId(parentId);
    }

    /**
     * Makes an unfired child due now.
     */
    public boolean fireChild(UUID childId) {
        OffsetDateTime now = now();
        Integer updated = transactionTemplate.execute(status -> timeJobRepository.fireChild(childId, now));
        return toAffectedRows(updated) > 0;
    }

    public boolean skipIdle(UUID timeJobId, String reason) {
        OffsetDateTime now = now();
        Integer updated = transactionTemplate.execute(status -> timeJobRepository.skipIdle(timeJobId, reason, now));
        return toAffectedRows(updated) > 0;
    }

    public Set<String> findLockHolders() {
        Set<String> holders = new HashSet<>(timeJobRepository.findLockHolders());
        holders.addAll(cronOccurrenceRepository.findLockHolders());
        return holders;
    }

    /**
     * Returns queued and in-progress entities locked by the given nodes to {@link JobStatus#IDLE} and clears
     * their locks.
     */
    public int releaseLocksForDeadNodes(Collection<String> deadNodeIds) {
        if (deadNodeIds == null || deadNodeIds.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = now();
        Integer released = transactionTemplate.execute(status -> timeJobRepository.releaseLocks(deadNodeIds, now)
                + cronOccurrenceRepository.releaseLocks(deadNodeIds, now));
        return toAffectedRows(released);
    }

    private int toAffectedRows(Integer updatedRows) {
        return updatedRows == null ? 0 : updatedRows;
    }
}
