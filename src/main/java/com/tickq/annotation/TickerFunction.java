package com.tickq.annotation;

import com.tickq.JobPriority;

import java.lang.annotation.*;

/**
 * Declares a job function bean: its name, lane priority and an optional cron schedule
 * that is seeded as a cron job on startup.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TickerFunction {

    /**
     * The function name jobs refer to.
     */
    String value();

    /**
     * A 6-field cron expression (seconds first). If provided, a cron job for this function is
     * created on startup unless one with the same expression and no payload already exists.
     */
    String cron() default "";

    /**
     * Worker lane used for every execution of this function.
     */
    JobPriority priority() default JobPriority.NORMAL;

    /**
     * Payload type for annotation-only beans. Inferred from the {@code execute(...)} signature when left as
     * {@code Void.class}.
     */
    Class<?> payload() default Void.class;
}
