package com.tickq;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One materialized execution slot of a {@link CronJob}. Unique per (cron job, execution time).
 */
@Entity
@Table(name = "tickq_cron_occurrences",
        uniqueConstraints = @UniqueConstraint(name = "uq_tickq_cron_occurrences_slot",
                columnNames = { "cron_job_id", "execution_time" }),
        indexes = {
                @Index(name = "idx_tickq_cron_occurrences_due", columnList = "status, execution_time"),
                @Index(name = "idx_tickq_cron_occurrences_lock_holder", columnList = "lock_holder")
        })
public class CronOccurrence {

    @Id
    private UUID id;

    @Column(name = "cron_job_id", nullable = false)
    private UUID cronJobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.IDLE;

    @Column(name = "execution_time", nullable = false)
    private OffsetDateTime executionTime;

    @Column(name = "executed_at")
    private OffsetDateTime executedAt;

    @Column(name = "elapsed_ms")
    private long elapsedMs;

    @Column(name = "retry_count")
    private int retryCount;

    @Column(name = "lock_holder")
    private String lockHolder;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "exception_message", columnDefinition = "text")
    private String exceptionMessage;

    @Column(name = "skipped_reason")
    private String skippedReason;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public CronOccurrence() {
    }

    public CronOccurrence(UUID id, UUID cronJobId, OffsetDateTime executionTime) {
        this.id = id;
        this.cronJobId = cronJobId;
        this.executionTime = executionTime;
    }

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getCronJobId() {
        return cronJobId;
    }

    public void setCronJobId(UUID cronJobId) {
        this.cronJobId = cronJobId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public OffsetDateTime getExecutionTime() {
        return executionTime;
    }

    public void setExecutionTime(OffsetDateTime executionTime) {
        this.executionTime = executionTime;
    }

    public OffsetDateTime getExecutedAt() {
        return executedAt;
    }

    public void setExecutedAt(OffsetDateTime executedAt) {
        this.executedAt = executedAt;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public void setElapsedMs(long elapsedMs) {
        this.elapsedMs = elapsedMs;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public String getLockHolder() {
        return lockHolder;
    }

    public void setLockHolder(String lockHolder) {
        this.lockHolder = lockHolder;
    }

    public OffsetDateTime getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(OffsetDateTime lockedAt) {
        this.lockedAt = lockedAt;
    }

    public String getExceptionMessage() {
        return exceptionMessage;
    }

    public void setExceptionMessage(String exceptionMessage) {
        this.exceptionMessage = exceptionMessage;
    }

    public String getSkippedReason() {
        return skippedReason;
    }

    public void setSkippedReason(String skippedReason) {
        this.skippedReason = skippedReason;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
