package com.tickq;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Describes a time job to schedule, with up to two further generations of children.
 * <pre>
 * TimeJobRequest.builder("send-invoice")
 *         .payload(invoice)
 *         .executionTime(at)
 *         .retries(3)
 *         .retryIntervals(10, 60, 300)
 *         .child(TimeJobRequest.builder("notify-accounting").runCondition(RunCondition.ON_SUCCESS).build())
 *         .build();
 * </pre>
 */
public final class TimeJobRequest {

    private final String function;
    private final String description;
    private final Object payload;
    private final OffsetDateTime executionTime;
    private final int retries;
    private final int[] retryIntervals;
    private final RunCondition runCondition;
    private final List<TimeJobRequest> children;

    private TimeJobRequest(Builder builder) {
        this.function = builder.function;
        this.description = builder.description;
        this.payload = builder.payload;
        this.executionTime = builder.executionTime;
        this.retries = builder.retries;
        this.retryIntervals = builder.retryIntervals.clone();
        this.runCondition = builder.runCondition;
        this.children = List.copyOf(builder.children);
    }

    public static Builder builder(String function) {
        return new Builder(function);
    }

    public String getFunction() {
        return function;
    }

    public String getDescription() {
        return description;
    }

    public Object getPayload() {
        return payload;
    }

    /**
     * {@code null} means one second from now for root jobs; ignored for children.
     */
    public OffsetDateTime getExecutionTime() {
        return executionTime;
    }

    public int getRetries() {
        return retries;
    }

    public int[] getRetryIntervals() {
        return retryIntervals.clone();
    }

    public RunCondition getRunCondition() {
        return runCondition;
    }

    public List<TimeJobRequest> getChildren() {
        return children;
    }

    public static final class Builder {
        private final String function;
        private String description;
        private Object payload;
        private OffsetDateTime executionTime;
        private int retries;
        private int[] retryIntervals = new int[0];
        private RunCondition runCondition;
        private final List<TimeJobRequest> children = new ArrayList<>();

        private Builder(String function) {
            this.function = function;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder executionTime(OffsetDateTime executionTime) {
            this.executionTime = executionTime;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        /**
         * Delays in seconds, indexed by retry count.
         */
        public Builder retryIntervals(int... retryIntervals) {
            this.retryIntervals = retryIntervals == null ? new int[0] : retryIntervals.clone();
            return this;
        }

        public Builder runCondition(RunCondition runCondition) {
            this.runCondition = runCondition;
            return this;
        }

        public Builder child(TimeJobRequest child) {
            this.children.add(child);
            return this;
        }

        public TimeJobRequest build() {
            return new TimeJobRequest(this);
        }
    }
}
