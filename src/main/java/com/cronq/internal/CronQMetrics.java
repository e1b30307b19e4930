package com.cronq.internal;

import com.cronq.JobRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class CronQMetrics {

    private static final Logger log = LoggerFactory.getLogger(CronQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();
    private final Map<AttemptDecision.Action, Counter> decisionCounters = new EnumMap<>(AttemptDecision.Action.class);

    private volatile LifecycleSnapshot cachedSnapshot = LifecycleSnapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;

    public CronQMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering CronQ meters...");

        for (Status status : Status.values()) {
            Gauge.builder("cronq.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of CronQ jobs")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }

        for (AttemptDecision.Action action : AttemptDecision.Action.values()) {
            decisionCounters.put(action, Counter.builder("cronq.attempts.decided")
                    .description("Completed job attempts by resulting action")
                    .tag("action", action.name())
                    .register(meterRegistry));
        }
    }

    public void recordDecision(AttemptDecision.Action action) {
        Counter counter = decisionCounters.get(action);
        if (counter != null) {
            counter.increment();
        }
    }

    private double countFor(Status status) {
        LifecycleSnapshot snapshot = getSnapshot();
        return switch (status) {
            case PENDING -> snapshot.pendingCount();
            case PROCESSING -> snapshot.processingCount();
            case FAILED -> snapshot.failedCount();
        };
    }

    private LifecycleSnapshot getSnapshot() {
        long now = System.nanoTime();
        LifecycleSnapshot currentSnapshot = cachedSnapshot;
        if (snapshotCapturedAtNanos != 0L && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return currentSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotCapturedAtNanos != 0L && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            return cachedSnapshot;
        }
    }

    private LifecycleSnapshot loadSnapshot() {
        try {
            JobRepository.LifecycleCounts counts = jobRepository.countLifecycleCounts();
            return new LifecycleSnapshot(
                    countOrZero(counts.getPendingCount()),
                    countOrZero(counts.getProcessingCount()),
                    countOrZero(counts.getFailedCount()));
        } catch (Exception e) {
            log.trace("Failed to query lifecycle counts for metrics: {}", e.getMessage());
            return LifecycleSnapshot.empty();
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private enum Status {
        PENDING,
        PROCESSING,
        FAILED
    }

    private record LifecycleSnapshot(long pendingCount, long processingCount, long failedCount) {
        private static LifecycleSnapshot empty() {
            return new LifecycleSnapshot(0, 0, 0);
        }
    }
}
