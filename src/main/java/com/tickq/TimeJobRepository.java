package com.tickq;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
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
public interface TimeJobRepository extends JpaRepository<TimeJob, UUID> {

    /**
     * Status histogram used by metrics.
     */
    interface StatusCount {
        JobStatus getStatus();

        Long getCount();
    }

    @Query("""
            SELECT j FROM TimeJob j
            WHERE j.status = com.tickq.JobStatus.IDLE
              AND j.lockHolder IS NULL
              AND j.executionTime IS NOT NULL
              AND j.executionTime <= :now
            ORDER BY j.executionTime ASC
            """)
    List<TimeJob> findDueJobs(@Param("now") OffsetDateTime now, Pageable pageable);

    @Query("""
            SELECT MIN(j.executionTime) FROM TimeJob j
            WHERE j.status = com.tickq.JobStatus.IDLE
              AND j.executionTime IS NOT NULL
            """)
    Optional<OffsetDateTime> findEarliestIdleExecutionTime();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM TimeJob j WHERE j.id = :id")
    Optional<TimeJob> findForUpdateById(@Param("id") UUID id);

    List<TimeJob> findByParentId(UUID parentId);

    long countByParentId(UUID parentId);

    @Query("SELECT DISTINCT j.lockHolder FROM TimeJob j WHERE j.lockHolder IS NOT NULL")
    List<String> findLockHolders();

    @Query("SELECT j.status AS status, COUNT(j) AS count FROM TimeJob j GROUP BY j.status")
    List<StatusCount> countByStatus();

    @Modifying
    @Query("""
            UPDATE TimeJob j
            SET j.status = com.tickq.JobStatus.QUEUED,
                j.lockHolder = :nodeId,
                j.lockedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.tickq.JobStatus.IDLE
              AND j.lockHolder IS NULL
            """)
    int claim(@Param("id") UUID id, @Param("nodeId") String nodeId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE TimeJob j
            SET j.status = com.tickq.JobStatus.IN_PROGRESS,
                j.executedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.tickq.JobStatus.QUEUED
              AND j.lockHolder = :nodeId
            """)
    int markInProgress(@Param("id") UUID id, @Param("nodeId") String nodeId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE TimeJob j
            SET j.status = :status,
                j.elapsedMs = :elapsedMs,
                j.exceptionMessage = NULL,
                j.lockHolder = NULL,
                j.lockedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.tickq.JobStatus.IN_PROGRESS
              AND j.lockHolder = :nodeId
            """)
    int markCompleted(
            @Param("id") UUID id,
            @Param("status") JobStatus status,
            @Param("elapsedMs") long elapsedMs,
            @Param("now") OffsetDateTime now,
            @Param("nodeId") String nodeId);

    @Modifying
    @Query("""
            UPDATE TimeJob j
            SET j.status = com.tickq.JobStatus.FAILED,
                j.exceptionMessage = :exceptionMessage,
                j.elapsedMs = :elapsedMs,
                j.lockHolder = NULL,
                j.lockedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.retryCount = :expectedRetryCount
              AND j.status = com.tickq.JobStatus.IN_PROGRESS
              AND j.lockHolder = :nodeId
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
            UPDATE TimeJob j
            SET j.status = com.tickq.JobStatus.IDLE,
                j.retryCount = :nextRetryCount,
                j.exceptionMessage = :exceptionMessage,
                j.elapsedMs = :elapsedMs,
                j.executionTime = :nextRunAt,
                j.lockHolder = NULL,
                j.lockedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.retryCount = :expectedRetryCount
              AND j.status = com.tickq.JobStatus.IN_PROGRESS
              AND j.lockHolder = :nodeId
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
            UPDATE TimeJob j
            SET j.status = :status,
                j.skippedReason = :reason,
                j.elapsedMs = :elapsedMs,
                j.lockHolder = NULL,
                j.lockedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.tickq.JobStatus.IN_PROGRESS
              AND j.lockHolder = :nodeId
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
            UPDATE TimeJob j
            SET j.status = com.tickq.JobStatus.CANCELLED,
                j.skippedReason = :reason,
                j.lockHolder = NULL,
                j.lockedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status IN (com.tickq.JobStatus.IDLE, com.tickq.JobStatus.QUEUED)
            """)
    int cancelPending(@Param("id") UUID id, @Param("reason") String reason, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE TimeJob j
            SET j.status = com.tickq.JobStatus.SKIPPED,
                j.skippedReason = :reason,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.tickq.JobStatus.IDLE
              AND j.lockHolder IS NULL
            """)
    int skipIdle(@Param("id") UUID id, @Param("reason") String reason, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE TimeJob j
            SET j.executionTime = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.parentId IS NOT NULL
              AND j.status = com.tickq.JobStatus.IDLE
              AND j.executionTime IS NULL
            """)
    int fireChild(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE TimeJob j
            SET j.status = com.tickq.JobStatus.IDLE,
                j.lockHolder = NULL,
                j.lockedAt = NULL,
                j.updatedAt = :now
            WHERE j.lockHolder IN :nodeIds
              AND j.status IN (com.tickq.JobStatus.QUEUED, com.tickq.JobStatus.IN_PROGRESS)
            """)
    int releaseLocks(@Param("nodeIds") Collection<String> nodeIds, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            DELETE FROM TimeJob j
            WHERE j.id IN :ids
              AND j.status <> com.tickq.JobStatus.IN_PROGRESS
            """)
    int deleteDeletable(@Param("ids") Collection<UUID> ids);
}
