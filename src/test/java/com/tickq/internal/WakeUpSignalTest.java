package com.tickq.internal;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WakeUpSignalTest {

    private final WakeUpSignal signal = new WakeUpSignal(Clock.systemUTC());

    @Test
    void awaitReturnsAtDeadline() throws Exception {
        long start = System.nanoTime();

        signal.await(Instant.now().plusMillis(100));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
    }

    @Test
    void wakeRequestedBeforeAwaitIsNotLost() throws Exception {
        signal.wakeNow();
        long start = System.nanoTime();

        signal.await(Instant.now().plusSeconds(30));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void earlierWakeTimeShortensTheWait() throws Exception {
        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try {
                signal.await(Instant.now().plusSeconds(30));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Thread.sleep(50);

        signal.wakeAt(OffsetDateTime.now().plusNanos(100_000_000));

        waiter.get(5, TimeUnit.SECONDS);
        assertThat(waiter).isDone();
    }

    @Test
    void multipleWakeRequestsCoalesce() throws Exception {
        signal.wakeNow();
        signal.wakeNow();
        signal.await(Instant.now().plusSeconds(30));

        long start = System.nanoTime();
        signal.await(Instant.now().plusMillis(100));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
    }
}
