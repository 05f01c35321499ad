package com.tickq.internal;

import com.tickq.config.TickQProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates 6-field cron expressions (second minute hour day month weekday) in the scheduler time zone.
 */
@Component
public class CronEvaluator {

    static final int MAX_CACHED_EXPRESSIONS = 256;

    private final ZoneId zone;
    private final Map<String, CronExpression> parsed = new ConcurrentHashMap<>();

    public CronEvaluator(TickQProperties properties) {
        this(properties.getScheduler().resolveZone());
    }

    public CronEvaluator(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * @throws IllegalArgumentException when the expression cannot be parsed
     */
    public String validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        String trimmed = expression.trim();
        parse(trimmed);
        return trimmed;
    }

    /**
     * First occurrence strictly after {@code after}, or {@code null} when the expression never fires again.
     * Expressions of stored definitions pass through here and are cached; validation alone caches nothing.
     */
    public OffsetDateTime next(String expression, OffsetDateTime after) {
        ZonedDateTime next = cached(expression.trim()).next(after.atZoneSameInstant(zone));
        return next == null ? null : next.toOffsetDateTime();
    }

    int cachedCount() {
        return parsed.size();
    }

    private CronExpression cached(String expression) {
        CronExpression cached = parsed.get(expression);
        if (cached != null) {
            return cached;
        }
        CronExpression cron = parse(expression);
        if (parsed.size() >= MAX_CACHED_EXPRESSIONS) {
            parsed.clear();
        }
        parsed.putIfAbsent(expression, cron);
        return cron;
    }

    private static CronExpression parse(String expression) {
        try {
            return CronExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }
}
