package com.tickq;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "tickq_time_jobs", indexes = {
        @Index(name = "idx_tickq_time_jobs_due", columnList = "status, execution_time"),
        @Index(name = "idx_tickq_time_jobs_parent", columnList = "parent_id"),
        @Index(name = "idx_tickq_time_jobs_lock_holder", columnList = "lock_holder")
})
public class TimeJob {

    @Id
    private UUID id;

    @Column(name = "function_name", nullable = false)
    private String function;

    @Column(name = "description")
    private String description;

    @Column(name = "payload")
    private byte[] payload;

    @Column(name = "execution_time")
    private OffsetDateTime executionTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.IDLE;

    @Column(name = "executed_at")
    private OffsetDateTime executedAt;

    @Column(name = "elapsed_ms")
    private long elapsedMs;

    @Column(name = "retries")
    private int retries;

    @Convert(converter = RetryIntervalsConverter.class)
    @Column(name = "retry_intervals")
    private int[] retryIntervals = new int[0];

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

    @Column(name = "parent_id")
    private UUID parentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_condition", length = 32)
    private RunCondition runCondition;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public TimeJob() {
    }

    public TimeJob(UUID id, String function, byte[] payload, OffsetDateTime executionTime, int retries,
            int[] retryIntervals) {
        this.id = id;
        this.function = function;
        this.payload = payload;
        this.executionTime = executionTime;
        this.retries = retries;
        this.retryIntervals = retryIntervals == null ? new int[0] : retryIntervals;
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

    public boolean isChild() {
        return parentId != null;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public byte[] getPayload() {
        return payload;
    }

    public void setPayload(byte[] payload) {
        this.payload = payload;
    }

    public OffsetDateTime getExecutionTime() {
        return executionTime;
    }

    public void setExecutionTime(OffsetDateTime executionTime) {
        this.executionTime = executionTime;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
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

    public int getRetries() {
        return retries;
    }

    public void setRetries(int retries) {
        this.retries = retries;
    }

    public int[] getRetryIntervals() {
        return retryIntervals;
    }

    public void setRetryIntervals(int[] retryIntervals) {
        this.retryIntervals = retryIntervals;
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

    public UUID getParentId() {
        return parentId;
    }

    public void setParentId(UUID parentId) {
        this.parentId = parentId;
    }

    public RunCondition getRunCondition() {
        return runCondition;
    }

    public void setRunCondition(RunCondition runCondition) {
        this.runCondition = runCondition;
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
