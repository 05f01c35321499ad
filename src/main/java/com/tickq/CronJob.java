package com.tickq;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Recurring schedule template. Executions live in {@link CronOccurrence}.
 */
@Entity
@Table(name = "tickq_cron_jobs", indexes = {
        @Index(name = "idx_tickq_cron_jobs_function", columnList = "function_name, expression")
})
public class CronJob {

    @Id
    private UUID id;

    @Column(name = "function_name", nullable = false)
    private String function;

    @Column(name = "expression", nullable = false)
    private String expression;

    @Column(name = "description")
    private String description;

    @Column(name = "payload")
    private byte[] payload;

    @Column(name = "retries")
    private int retries;

    @Convert(converter = RetryIntervalsConverter.class)
    @Column(name = "retry_intervals")
    private int[] retryIntervals = new int[0];

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public CronJob() {
    }

    public CronJob(UUID id, String function, String expression, byte[] payload, int retries, int[] retryIntervals) {
        this.id = id;
        this.function = function;
        this.expression = expression;
        this.payload = payload;
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

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
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
