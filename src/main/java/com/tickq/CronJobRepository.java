package com.tickq;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CronJobRepository extends JpaRepository<CronJob, UUID> {

    List<CronJob> findByFunctionAndExpression(String function, String expression);

    /**
     * Definitions that currently have no idle or queued occurrence.
     */
    @Query("""
            SELECT c FROM CronJob c
            WHERE NOT EXISTS (
                SELECT o.id FROM CronOccurrence o
                WHERE o.cronJobId = c.id
                  AND o.status IN (com.tickq.JobStatus.IDLE, com.tickq.JobStatus.QUEUED)
            )
            """)
    List<CronJob> findWithoutPendingOccurrence();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CronJob c WHERE c.id = :id")
    Optional<CronJob> findForUpdateById(@Param("id") UUID id);
}
