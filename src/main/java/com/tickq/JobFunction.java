package com.tickq;

import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A handler that time jobs and cron occurrences reference by function name.
 * Note: The class must be registered as a Spring Bean to be detected by the
 * function registry.
 *
 * @param <T> the type of the payload expected by this function
 */
public interface JobFunction<T> {

    Map<Class<?>, Class<?>> PAYLOAD_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * Returns the globally unique function name. By default, this is extracted from the
     * {@link com.tickq.annotation.TickerFunction} annotation.
     */
    default String getFunctionName() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        com.tickq.annotation.TickerFunction annotation = org.springframework.core.annotation.AnnotationUtils
                .findAnnotation(targetClass, com.tickq.annotation.TickerFunction.class);
        if (annotation == null || annotation.value().isBlank()) {
            throw new IllegalStateException("JobFunction " + targetClass.getName() +
                    " must either be annotated with @TickerFunction or override getFunctionName()");
        }
        return annotation.value();
    }

    /**
     * Executes one attempt.
     * Throwing marks the attempt as failed and schedules a retry while budget remains.
     * Throw {@link JobSkippedException} (or call {@link JobContext#skip(String)}) to finish without retry,
     * and honor {@link JobContext#isCancellationRequested()} for cooperative cancellation.
     *
     * @param context execution metadata and cancellation signal
     * @param payload the deserialized payload, {@code null} when the job has none
     * @throws Exception if execution fails
     */
    void execute(JobContext context, T payload) throws Exception;

    /**
     * Optionally returns the payload class so the generic payload can be explicitly
     * converted dynamically. By default, this is inferred from {@code JobFunction<T>}.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        Class<?> payloadClass = PAYLOAD_CLASS_CACHE.computeIfAbsent(targetClass, JobFunction::inferPayloadClass);
        return (Class<T>) payloadClass;
    }

    private static Class<?> inferPayloadClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(JobFunction.class)
                .getGeneric(0)
                .resolve();
        if (resolved == null) {
            throw new IllegalStateException("JobFunction " + targetClass.getName()
                    + " payload type cannot be inferred. Specify a concrete generic type or override getPayloadClass().");
        }
        return resolved;
    }
}
