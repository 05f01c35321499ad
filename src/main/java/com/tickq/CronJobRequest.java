package com.tickq;

/**
 * Describes a cron job definition.
 */
public final class CronJobRequest {

    private final String function;
    private final String expression;
    private final String description;
    private final Object payload;
    private final int retries;
    private final int[] retryIntervals;

    private CronJobRequest(Builder builder) {
        this.function = builder.function;
        this.expression = builder.expression;
        this.description = builder.description;
        this.payload = builder.payload;
        this.retries = builder.retries;
        this.retryIntervals = builder.retryIntervals.clone();
    }

    /**
     * @param expression 6-field cron expression, seconds first
     */
    public static Builder builder(String function, String expression) {
        return new Builder(function, expression);
    }

    public String getFunction() {
        return function;
    }

    public String getExpression() {
        return expression;
    }

    public String getDescription() {
        return description;
    }

    public Object getPayload() {
        return payload;
    }

    public int getRetries() {
        return retries;
    }

    public int[] getRetryIntervals() {
        return retryIntervals.clone();
    }

    public static final class Builder {
        private final String function;
        private final String expression;
        private String description;
        private Object payload;
        private int retries;
        private int[] retryIntervals = new int[0];

        private Builder(String function, String expression) {
            this.function = function;
            this.expression = expression;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryIntervals(int... retryIntervals) {
            this.retryIntervals = retryIntervals == null ? new int[0] : retryIntervals.clone();
            return this;
        }

        public CronJobRequest build() {
            return new CronJobRequest(this);
        }
    }
}
