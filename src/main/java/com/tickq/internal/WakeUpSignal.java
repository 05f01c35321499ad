package com.tickq.internal;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sleep/wake channel for the dispatcher. Wake requests made while the dispatcher is busy are coalesced into
 * a single immediate wake-up on its next wait.
 */
@Component
public class WakeUpSignal {

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private boolean wakeRequested;
    private Instant plannedWake;

    public WakeUpSignal(@Qualifier("tickqClock") Clock clock) {
        this.clock = clock;
    }

    public void wakeNow() {
        lock.lock();
        try {
            wakeRequested = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Brings the next wake-up forward to {@code at} if it is earlier than the one currently planned.
     */
    public void wakeAt(OffsetDateTime at) {
        if (at == null) {
            return;
        }
        Instant instant = at.toInstant();
        lock.lock();
        try {
            if (plannedWake == null || instant.isBefore(plannedWake)) {
                plannedWake = instant;
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until {@code deadline}, an earlier planned wake-up, or an explicit wake request.
     */
    public void await(Instant deadline) throws InterruptedException {
        lock.lock();
        try {
            if (plannedWake == null || deadline.isBefore(plannedWake)) {
                plannedWake = deadline;
            }
            while (!wakeRequested) {
                long waitNanos = Duration.between(clock.instant(), plannedWake).toNanos();
                if (waitNanos <= 0) {
                    break;
                }
                changed.awaitNanos(waitNanos);
            }
            wakeRequested = false;
            plannedWake = null;
        } finally {
            lock.unlock();
        }
    }
}
