package com.tickq;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CronOccurrenceRepository extends JpaRepository<CronOccurrence, UUID> {

    @Query("""
            SELECT o FROM CronOccurrence o
            WHERE o.status = com.tickq.JobStatus.IDLE
              AND o.lockHolder IS NULL
              AND o.executionTime <= :now
            ORDER BY o.executionTime ASC
            """)
    List<CronOccurrence> findDueOccurrences(@Param("now") OffsetDateTime now, Pageable pageable);

    @Query("SELECT MIN(o.executionTime) FROM CronOccurrence o WHERE o.status = com.tickq.JobStatus.IDLE")
    Optional<OffsetDateTime> findEarliestIdleExecutionTime();

    List<CronOccurrence> findByCronJobIdAndStatusIn(UUID cronJobId, Collection<JobStatus> statuses);

    List<CronOccurrence> findByCronJobIdOrderByExecutionTimeDesc(UUID cronJobId, Pageable pageable);

    boolean existsByCronJobIdAndStatus(UUID cronJobId, JobStatus status);

    boolean existsByCronJobIdAndStatusAndIdNot(UUID cronJobId, JobStatus status, UUID id);

    @Query("SELECT DISTINCT o.lockHolder FROM CronOccurrence o WHERE o.lockHolder IS NOT NULL")
    List<String> findLockHolders();

    @Query("SELECT o.status AS status, COUNT(o) AS count FROM CronOccurrence o GROUP BY o.status")
    List<TimeJobRepository.StatusCount> countByStatus();

    @Modifying
    @Query("""
            UPDATE CronOccurrence o
            SET o.status = com.tickq.JobStatus.QUEUED,
                o.lockHolder = :nodeId,
                o.lockedAt = :now,
                o.updatedAt = :now
            WHERE o.id = :id
              AND o.status = com.tickq.JobStatus.IDLE
              AND o.lockHolder IS NULL
            """)
    int claim(@Param("id") UUID id, @Param("nodeId") String nodeId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE CronOccurrence o
            SET o.status = com.tickq.JobStatus.IN_PROGRESS,
                o.executedAt = :now,
                o.updatedAt = :now
            WHERE o.id = :id
              AND o.status = com.tickq.JobStatus.QUEUED
              AND o.lockHolder = :nodeId
            """)
    int markInProgress(@Param("id") UUID id, @Param("nodeId") String nodeId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE CronOccurrence o
            SET o.status = :status,
                o.elapsedMs = :elapsedMs,
                o.exceptionMessage = NULL,
                o.lockHolder = NULL,
                o.lockedAt = NULL,
                o.updatedAt = :now
            WHERE o.id = :id
              AND o.status = com.tickq.JobStatus.IN_PROGRESS
              AND o.lockHolder = :nodeId
            """)
    int markCompleted(
            @Param("id") UUID id,
            @Param("status") JobStatus status,
            @Param("elapsedMs") long elapsedMs,
            @Param("now") OffsetDateTime now,
            @Param("nodeId") String nodeId);

    @Modifying
    @Query("""
            UPDATE CronOccurrence o
            SET o.status = com.tickq.JobStatus.FAILED,
                o.exceptionMessage = :exceptionMessage,
                o.elapsedMs = :elapsedMs,
                o.lockHolder = NULL,
                o.lockedAt = NULL,
                o.updatedAt = :now
            WHERE o.id = :id
              AND o.retryCount = :expectedRetryCount
              AND o.status = com.tickq.JobStatus.IN_PROGRESS
              AND o.lockHolder = :nodeId
            """)
    int markFailedTerminal(
            @Param("id") UUID id,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("exceptionMessage") String exceptionMessage,
            @Param("elapsedMs") long elapsedMs,
            @Param("now") OffsetDateTime now,
            @Param("nodeId") String nodeId);

    @Modifying
    @Query("""
            UPDATE CronOccurrence o
            SET o.status = com.tickq.JobStatus.IDLE,
                o.retryCount = :nextRetryCount,
                o.exceptionMessage = :exceptionMessage,
                o.elapsedMs = :elapsedMs,
                o.executionTime = :nextRunAt,
                o.lockHolder = NULL,
                o.lockedAt = NULL,
                o.updatedAt = :now
            WHERE o.id = :id
              AND o.retryCount = :expectedRetryCount
              AND o.status = com.tickq.JobStatus.IN_PROGRESS
              AND o.lockHolder = :nodeId
            """)
    int markForRetry(
            @Param("id") UUID id,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("nextRetryCount") int nextRetryCount,
            @Param("exceptionMessage") String exceptionMessage,
            @Param("elapsedMs") long elapsedMs,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("now") OffsetDateTime now,
            @Param("nodeId") String nodeId);

    @Modifying
    @Query("""
            UPDATE CronOccurrence o
            SET o.status = :status,
                o.skippedReason = :reason,
                o.elapsedMs = :elapsedMs,
                o.lockHolder = NULL,
                o.lockedAt = NULL,
                o.updatedAt = :now
            WHERE o.id = :id
              AND o.status = com.tickq.JobStatus.IN_PROGRESS
              AND o.lockHolder = :nodeId
            """)
    int markInterrupted(
            @Param("id") UUID id,
            @Param("status") JobStatus status,
            @Param("reason") String reason,
            @Param("elapsedMs") long elapsedMs,
            @Param("now") OffsetDateTime now,
            @Param("nodeId") String nodeId);

    @Modifying
    @Query("""
            UPDATE CronOccurrence o
            SET o.status = com.tickq.JobStatus.CANCELLED,
                o.skippedReason = :reason,
                o.lockHolder = NULL,
                o.lockedAt = NULL,
                o.updatedAt = :now
            WHERE o.id = :id
              AND o.status IN (com.tickq.JobStatus.IDLE, com.tickq.JobStatus.QUEUED)
            """)
    int cancelPending(@Param("id") UUID id, @Param("reason") String reason, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE CronOccurrence o
            SET o.status = com.tickq.JobStatus.IDLE,
                o.lockHolder = NULL,
                o.lockedAt = NULL,
                o.updatedAt = :now
            WHERE o.lockHolder IN :nodeIds
              AND o.status IN (com.tickq.JobStatus.QUEUED, com.tickq.JobStatus.IN_PROGRESS)
            """)
    int releaseLocks(@Param("nodeIds") Collection<String> nodeIds, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            DELETE FROM CronOccurrence o
            WHERE o.cronJobId = :cronJobId
              AND o.status = com.tickq.JobStatus.IDLE
              AND o.lockHolder IS NULL
            """)
    int deleteIdleByCronJobId(@Param("cronJobId") UUID cronJobId);

    @Modifying
    @Query("""
            DELETE FROM CronOccurrence o
            WHERE o.cronJobId = :cronJobId
              AND o.status <> com.tickq.JobStatus.IN_PROGRESS
            """)
    int deleteDeletableByCronJobId(@Param("cronJobId") UUID cronJobId);

    @Modifying
    @Query("""
            DELETE FROM CronOccurrence o
            WHERE o.id = :id
              AND o.status = com.tickq.JobStatus.IDLE
              AND o.lockHolder IS NULL
            """)
    int deleteIdleById(@Param("id") UUID id);
}
