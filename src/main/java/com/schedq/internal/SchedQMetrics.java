package com.schedq.internal;

import com.schedq.JobRepository;
import com.schedq.JobStatus;
import com.schedq.queue.QueueCounts;
import com.schedq.queue.QueueItemState;
import com.schedq.queue.QueueName;
import com.schedq.queue.QueueRouter;
import com.schedq.queue.QueueStats;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Job status and queue depth gauges. Both are read from one snapshot refreshed at most once per second, so a
 * scrape costs two queries regardless of the number of gauges.
 */
public class SchedQMetrics {

    private static final Logger log = LoggerFactory.getLogger(SchedQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final QueueRouter queueRouter;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Snapshot cachedSnapshot = Snapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public SchedQMetrics(JobRepository jobRepository, QueueRouter queueRouter, MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.queueRouter = queueRouter;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering scheduler gauges...");

        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("schedq.jobs.count", this, metrics -> metrics.jobCount(status))
                    .description("Number of jobs by status")
                    .tag("status", status.getValue())
                    .register(meterRegistry);
        }

        Gauge.builder("schedq.jobs.total", this, SchedQMetrics::totalJobs)
                .description("Total number of jobs in the database")
                .register(meterRegistry);

        for (QueueName queue : QueueName.values()) {
            for (QueueItemState state : QueueItemState.values()) {
                Gauge.builder("schedq.queue.items", this, metrics -> metrics.queueCount(queue, state))
                        .description("Number of queue items by queue and state")
                        .tag("queue", queue.getValue())
                        .tag("state", state.getValue())
                        .register(meterRegistry);
            }
        }
    }

    private double jobCount(JobStatus status) {
        return getSnapshot().jobCounts().getOrDefault(status, 0L);
    }

    private double totalJobs() {
        return getSnapshot().jobCounts().values().stream().mapToLong(Long::longValue).sum();
    }

    private double queueCount(QueueName queue, QueueItemState state) {
        QueueCounts counts = getSnapshot().queueStats().queues().get(queue.getValue());
        return counts == null ? 0 : counts.count(state);
    }

    private Snapshot getSnapshot() {
        long now = System.nanoTime();
        Snapshot currentSnapshot = cachedSnapshot;
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return currentSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = new Snapshot(loadJobCounts(), loadQueueStats());
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private Map<JobStatus, Long> loadJobCounts() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        try {
            for (JobRepository.StatusCount row : jobRepository.countGroupedByStatus()) {
                counts.put(row.getStatus(), row.getCount() == null ? 0L : row.getCount());
            }
        } catch (Exception e) {
            log.trace("Failed to query job counts for metrics: {}", e.getMessage());
        }
        return counts;
    }

    private QueueStats loadQueueStats() {
        try {
            return queueRouter.getQueueStats();
        } catch (Exception e) {
            log.trace("Failed to query queue counts for metrics: {}", e.getMessage());
            return Snapshot.emptyQueueStats();
        }
    }

    private record Snapshot(Map<JobStatus, Long> jobCounts, QueueStats queueStats) {
        private static Snapshot empty() {
            return new Snapshot(Map.of(), emptyQueueStats());
        }

        private static QueueStats emptyQueueStats() {
            return new QueueStats(Map.of(), QueueCounts.empty());
        }
    }
}
