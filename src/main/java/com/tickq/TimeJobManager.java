package com.tickq;

import com.tickq.internal.FunctionRegistry;
import com.tickq.internal.JobExecutor;
import com.tickq.internal.PayloadCodec;
import com.tickq.internal.WakeUpSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates, updates, cancels and deletes time jobs and their child trees.
 */
@Service
public class TimeJobManager {

    private static final Logger log = LoggerFactory.getLogger(TimeJobManager.class);

    static final int MAX_CHILDREN = 5;
    static final int MAX_GENERATIONS = 3;
    static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);

    private final TimeJobRepository timeJobRepository;
    private final FunctionRegistry functionRegistry;
    private final PayloadCodec payloadCodec;
    private final JobExecutor jobExecutor;
    private final WakeUpSignal wakeUpSignal;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public TimeJobManager(
            TimeJobRepository timeJobRepository,
            FunctionRegistry functionRegistry,
            PayloadCodec payloadCodec,
            JobExecutor jobExecutor,
            WakeUpSignal wakeUpSignal,
            TransactionTemplate transactionTemplate,
            @Qualifier("tickqClock") Clock clock) {
        this.timeJobRepository = timeJobRepository;
        this.functionRegistry = functionRegistry;
        this.payloadCodec = payloadCodec;
        this.jobExecutor = jobExecutor;
        this.wakeUpSignal = wakeUpSignal;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Schedules a job and its children.
     *
     * @return id of the root job
     * @throws IllegalArgumentException when the request or any child is invalid
     */
    public UUID schedule(TimeJobRequest request) {
        return scheduleAll(List.of(request)).get(0);
    }

    /**
     * Schedules several job trees in one transaction.
     *
     * @return root job ids, in request order
     */
    public List<UUID> scheduleAll(List<TimeJobRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("At least one time job request is required");
        }
        for (TimeJobRequest request : requests) {
            validateTree(request, 1);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<TimeJob> entities = new ArrayList<>();
        List<UUID> rootIds = new ArrayList<>(requests.size());
        OffsetDateTime earliest = null;
        for (TimeJobRequest request : requests) {
            TimeJob root = addTree(request, null, now, entities);
            rootIds.add(root.getId());
            if (earliest == null || root.getExecutionTime().isBefore(earliest)) {
                earliest = root.getExecutionTime();
            }
        }

        transactionTemplate.executeWithoutResult(status -> timeJobRepository.saveAll(entities));
        log.debug("Scheduled {} time jobs ({} roots)", entities.size(), rootIds.size());
        wakeUpSignal.wakeAt(earliest);
        return rootIds;
    }

    /**
     * Replaces the function, payload, timing and retry settings of an idle job. Children are left untouched.
     *
     * @throws IllegalStateException when the job is no longer idle
     */
    public void update(UUID id, TimeJobRequest request) {
        validateFunction(request.getFunction());
        validateRetries(request.getRetries(), request.getRetryIntervals());
        OffsetDateTime now = OffsetDateTime.now(clock);

        OffsetDateTime executionTime = transactionTemplate.execute(status -> {
            TimeJob job = timeJobRepository.findForUpdateById(id)
                    .orElseThrow(() -> new IllegalArgumentException("Time job " + id + " not found"));
            job.getStatus().requireUpdatable(id);
            if (job.isChild()) {
                if (request.getRunCondition() == null) {
                    throw new IllegalArgumentException("Child job " + id + " requires a run condition");
                }
                job.setRunCondition(request.getRunCondition());
            } else {
                if (request.getRunCondition() != null) {
                    throw new IllegalArgumentException("Root job " + id + " must not declare a run condition");
                }
                job.setExecutionTime(resolveExecutionTime(request, now));
            }
            job.setFunction(request.getFunction().trim());
            job.setDescription(request.getDescription());
            job.setPayload(payloadCodec.encode(request.getPayload()));
            job.setRetries(request.getRetries());
            job.setRetryIntervals(request.getRetryIntervals());
            job.setUpdatedAt(now);
            return job.getExecutionTime();
        });
        log.debug("Updated time job {}", id);
        wakeUpSignal.wakeAt(executionTime);
    }

    /**
     * Deletes a job together with all its descendants.
     *
     * @return {@code false} when no job exists with this id
     * @throws IllegalStateException when the job or a descendant is in progress
     */
    public boolean delete(UUID id) {
        Boolean deleted = transactionTemplate.execute(status -> {
            Optional<TimeJob> job = timeJobRepository.findForUpdateById(id);
            if (job.isEmpty()) {
                return false;
            }
            List<UUID> ids = new ArrayList<>();
            Deque<TimeJob> pending = new ArrayDeque<>();
            pending.push(job.get());
            while (!pending.isEmpty()) {
                TimeJob current = pending.pop();
                current.getStatus().requireDeletable(current.getId());
                ids.add(current.getId());
                timeJobRepository.findByParentId(current.getId()).forEach(pending::push);
            }
            int rows = timeJobRepository.deleteDeletable(ids);
            if (rows != ids.size()) {
                throw new IllegalStateException("Job " + id + " changed state while being deleted");
            }
            return true;
        });
        if (Boolean.TRUE.equals(deleted)) {
            log.debug("Deleted time job {} with its descendants", id);
        }
        return Boolean.TRUE.equals(deleted);
    }

    public boolean cancel(UUID id) {
        return cancel(id, null);
    }

    /**
     * Cancels a pending job immediately, or signals cancellation to the handler when the job is running on
     * this node.
     *
     * @return {@code false} when the job is terminal or running on another node
     */
    public boolean cancel(UUID id, String reason) {
        return jobExecutor.cancel(JobKind.TIME, id, reason);
    }

    public Optional<TimeJob> find(UUID id) {
        return timeJobRepository.findById(id);
    }

    public List<TimeJob> findChildren(UUID parentId) {
        return timeJobRepository.findByParentId(parentId);
    }

    private TimeJob addTree(TimeJobRequest request, TimeJob parent, OffsetDateTime now, List<TimeJob> entities) {
        OffsetDateTime executionTime = parent == null ? resolveExecutionTime(request, now) : null;
        TimeJob job = new TimeJob(UUID.randomUUID(), request.getFunction().trim(),
                payloadCodec.encode(request.getPayload()), executionTime, request.getRetries(),
                request.getRetryIntervals());
        job.setDescription(request.getDescription());
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        if (parent != null) {
            job.setParentId(parent.getId());
            job.setRunCondition(request.getRunCondition());
        }
        entities.add(job);
        for (TimeJobRequest child : request.getChildren()) {
            addTree(child, job, now, entities);
        }
        return job;
    }

    private void validateTree(TimeJobRequest request, int generation) {
        if (request == null) {
            throw new IllegalArgumentException("Time job request must not be null");
        }
        validateFunction(request.getFunction());
        validateRetries(request.getRetries(), request.getRetryIntervals());
        if (generation == 1 && request.getRunCondition() != null) {
            throw new IllegalArgumentException("A root job must not declare a run condition");
        }
        if (generation > 1 && request.getRunCondition() == null) {
            throw new IllegalArgumentException("Child job of function '" + request.getFunction()
                    + "' requires a run condition");
        }
        List<TimeJobRequest> children = request.getChildren();
        if (children.size() > MAX_CHILDREN) {
            throw new IllegalArgumentException("A job may have at most " + MAX_CHILDREN + " children, got "
                    + children.size());
        }
        if (!children.isEmpty() && generation >= MAX_GENERATIONS) {
            throw new IllegalArgumentException("Job chains are limited to " + MAX_GENERATIONS + " generations");
        }
        for (TimeJobRequest child : children) {
            validateTree(child, generation + 1);
        }
    }

    private void validateFunction(String function) {
        if (function == null || function.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        if (!functionRegistry.contains(function.trim())) {
            throw new IllegalArgumentException("No function registered under name '" + function.trim() + "'");
        }
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

    private OffsetDateTime resolveExecutionTime(TimeJobRequest request, OffsetDateTime now) {
        return request.getExecutionTime() != null ? request.getExecutionTime() : now.plus(DEFAULT_DELAY);
    }
}
