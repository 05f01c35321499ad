package com.tickq.internal;

import com.tickq.CronOccurrenceRepository;
import com.tickq.JobKind;
import com.tickq.JobStatus;
import com.tickq.TimeJobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Gauges {@code tickq.jobs.count} tagged by kind and status, backed by a snapshot refreshed at most once
 * per second.
 */
public class TickQMetrics {

    private static final Logger log = LoggerFactory.getLogger(TickQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final TimeJobRepository timeJobRepository;
    private final CronOccurrenceRepository cronOccurrenceRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Map<JobKind, Map<JobStatus, Long>> cachedSnapshot = emptySnapshot();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean captured = false;

    public TickQMetrics(TimeJobRepository timeJobRepository, CronOccurrenceRepository cronOccurrenceRepository,
            MeterRegistry meterRegistry) {
        this.timeJobRepository = timeJobRepository;
        this.cronOccurrenceRepository = cronOccurrenceRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering TickQ gauges...");
        for (JobKind kind : JobKind.values()) {
            for (JobStatus status : JobStatus.values()) {
                Gauge.builder("tickq.jobs.count", this, metrics -> metrics.countFor(kind, status))
                        .description("Number of TickQ jobs by kind and status")
                        .tag("kind", kind.name())
                        .tag("status", status.name())
                        .register(meterRegistry);
            }
        }
    }

    double countFor(JobKind kind, JobStatus status) {
        return getSnapshot().get(kind).getOrDefault(status, 0L);
    }

    private Map<JobKind, Map<JobStatus, Long>> getSnapshot() {
        long now = System.nanoTime();
        if (captured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }
        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (captured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            captured = true;
            return cachedSnapshot;
        }
    }

    private Map<JobKind, Map<JobStatus, Long>> loadSnapshot() {
        try {
            Map<JobKind, Map<JobStatus, Long>> snapshot = new EnumMap<>(JobKind.class);
            snapshot.put(JobKind.TIME, toMap(timeJobRepository.countByStatus()));
            snapshot.put(JobKind.CRON, toMap(cronOccurrenceRepository.countByStatus()));
            return snapshot;
        } catch (Exception e) {
            log.trace("Failed to query status counts for metrics: {}", e.getMessage());
            return emptySnapshot();
        }
    }

    private static Map<JobStatus, Long> toMap(List<TimeJobRepository.StatusCount> counts) {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (TimeJobRepository.StatusCount count : counts) {
            byStatus.put(count.getStatus(), count.getCount() == null ? 0L : count.getCount());
        }
        return byStatus;
    }

    private static Map<JobKind, Map<JobStatus, Long>> emptySnapshot() {
        Map<JobKind, Map<JobStatus, Long>> snapshot = new EnumMap<>(JobKind.class);
        snapshot.put(JobKind.TIME, new EnumMap<>(JobStatus.class));
        snapshot.put(JobKind.CRON, new EnumMap<>(JobStatus.class));
        return snapshot;
    }
}
