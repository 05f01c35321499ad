package com.tickq.internal;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronEvaluatorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:30Z");

    private final CronEvaluator evaluator = new CronEvaluator(ZoneOffset.UTC);

    @Test
    void validationTrimsAndDoesNotCache() {
        assertThat(evaluator.validate("  0 * * * * *  ")).isEqualTo("0 * * * * *");
        assertThat(evaluator.cachedCount()).isZero();
    }

    @Test
    void invalidExpressionIsRejected() {
        assertThatThrownBy(() -> evaluator.validate("every minute"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid cron expression 'every minute'");
        assertThatThrownBy(() -> evaluator.validate(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nextIsStrictlyAfterTheGivenTime() {
        assertThat(evaluator.next("0 * * * * *", NOW)).isEqualTo(OffsetDateTime.parse("2025-03-01T10:01:00Z"));
        assertThat(evaluator.next("0 * * * * *", OffsetDateTime.parse("2025-03-01T10:01:00Z")))
                .isEqualTo(OffsetDateTime.parse("2025-03-01T10:02:00Z"));
        assertThat(evaluator.cachedCount()).isEqualTo(1);
    }

    @Test
    void cacheStaysBounded() {
        for (int second = 0; second < 60; second++) {
            for (int minute = 0; minute < 6; minute++) {
                evaluator.next(second + " " + minute + " * * * *", NOW);
            }
        }

        assertThat(evaluator.cachedCount()).isLessThanOrEqualTo(CronEvaluator.MAX_CACHED_EXPRESSIONS);
    }
}
