package com.schedq.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.schedq.config.SchedQProperties;
import com.schedq.util.BackoffCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Routes work onto the {@code scheduler}, {@code priority} and {@code delayed} queues of a {@link QueueBackend}
 * and presents them as one system.
 * <p>
 * Item ids are unique across all three queues, so lookups probe them in a fixed order.
 */
@Service
public class QueueRouter {

    private static final Logger log = LoggerFactory.getLogger(QueueRouter.class);

    static final List<QueueName> PROBE_ORDER = List.of(QueueName.SCHEDULER, QueueName.PRIORITY, QueueName.DELAYED);
    static final int CLEAN_BATCH_SIZE = 100;

    private final QueueBackend backend;
    private final SchedQProperties.Queue settings;
    private final BackoffCalculator backoffCalculator;

    @Autowired
    public QueueRouter(QueueBackend backend, SchedQProperties properties) {
        this(backend, properties, new BackoffCalculator());
    }

    QueueRouter(QueueBackend backend, SchedQProperties properties, BackoffCalculator backoffCalculator) {
        this.backend = backend;
        this.settings = properties.getQueue();
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * High priority wins over delay; anything else lands on the default queue.
     */
    public QueueName selectQueue(QueueOptions options) {
        if (options != null && options.priority() != null
                && options.priority() >= settings.getHighPriorityThreshold()) {
            return QueueName.PRIORITY;
        }
        if (options != null && options.delayMs() != null && options.delayMs() > 0) {
            return QueueName.DELAYED;
        }
        return QueueName.SCHEDULER;
    }

    public QueueItem addJob(String name, JsonNode data, QueueOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Queue item name must not be blank");
        }
        QueueOptions effective = options == null ? QueueOptions.none() : options;
        QueueName queue = selectQueue(effective);
        NewQueueItem item = new NewQueueItem(
                effective.itemId() != null ? effective.itemId() : UUID.randomUUID().toString(),
                name,
                data,
                effective.ownerId(),
                effective.priority() != null ? effective.priority() : 0,
                effective.delayMs() != null ? Math.max(0L, effective.delayMs()) : 0L,
                effective.attempts() != null ? effective.attempts() : settings.getDefaultAttempts(),
                effective.backoffDelayMs() != null ? effective.backoffDelayMs() : settings.getDefaultBackoffDelayMs(),
                effective.removeOnComplete() != null ? effective.removeOnComplete() : settings.getRemoveOnComplete(),
                effective.removeOnFail() != null ? effective.removeOnFail() : settings.getRemoveOnFail());
        if (item.attempts() < 1) {
            throw new IllegalArgumentException("attempts must be >= 1 but was " + item.attempts());
        }
        QueueItem added = backend.enqueue(queue, item);
        log.debug("Added item {} ({}) to queue {} with delay {} ms", added.id(), name, queue.getValue(),
                item.delayMs());
        return added;
    }

    public Optional<QueueItem> getJob(String itemId) {
        for (QueueName queue : PROBE_ORDER) {
            Optional<QueueItem> item = backend.find(queue, itemId);
            if (item.isPresent()) {
                return item;
            }
        }
        return Optional.empty();
    }

    /**
     * Tries every queue; a failure on one queue is logged and the others are still attempted.
     */
    public boolean removeJob(String itemId) {
        boolean removed = false;
        for (QueueName queue : PROBE_ORDER) {
            try {
                removed |= backend.remove(queue, itemId);
            } catch (RuntimeException e) {
                log.warn("Failed to remove item {} from queue {}: {}", itemId, queue.getValue(), e.getMessage());
            }
        }
        return removed;
    }

    public int removeOwnedItems(UUID ownerId) {
        int removed = 0;
        for (QueueName queue : PROBE_ORDER) {
            removed += backend.removeByOwner(queue, ownerId);
        }
        return removed;
    }

    public int pauseOwnedItems(UUID ownerId) {
        int paused = 0;
        for (QueueName queue : PROBE_ORDER) {
            paused += backend.pauseByOwner(queue, ownerId);
        }
        return paused;
    }

    public int resumeOwnedItems(UUID ownerId) {
        int resumed = 0;
        for (QueueName queue : PROBE_ORDER) {
            resumed += backend.resumeByOwner(queue, ownerId);
        }
        return resumed;
    }

    public QueueStats getQueueStats() {
        Map<String, QueueCounts> perQueue = new LinkedHashMap<>();
        QueueCounts total = QueueCounts.empty();
        for (QueueName queue : PROBE_ORDER) {
            QueueCounts counts = backend.counts(queue);
            perQueue.put(queue.getValue(), counts);
            total = total.plus(counts);
        }
        return new QueueStats(perQueue, total);
    }

    /**
     * Unhealthy when the aggregate or any single queue has {@code failed >= 0.1 * completed}.
     */
    public QueueHealth getQueueHealth() {
        Map<String, QueueHealth.QueueStatus> perQueue = new LinkedHashMap<>();
        QueueCounts total = QueueCounts.empty();
        boolean healthy = true;
        for (QueueName queue : PROBE_ORDER) {
            QueueCounts counts = backend.counts(queue);
            boolean queueHealthy = counts.isHealthy();
            perQueue.put(queue.getValue(), new QueueHealth.QueueStatus(queueHealthy, backend.isPaused(queue), counts));
            healthy &= queueHealthy;
            total = total.plus(counts);
        }
        healthy &= total.isHealthy();
        return new QueueHealth(healthy, perQueue, total);
    }

    public void pauseQueue(String name) {
        backend.pause(QueueName.fromValue(name));
    }

    public void resumeQueue(String name) {
        backend.resume(QueueName.fromValue(name));
    }

    /**
     * Removes terminal items older than {@code olderThanMs} from all queues, at most a batch per queue.
     *
     * @return removed counts keyed by queue name
     */
    public Map<String, Integer> cleanQueue(QueueItemState state, long olderThanMs) {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("Only completed or failed items can be cleaned, got " + state);
        }
        if (olderThanMs < 0) {
            throw new IllegalArgumentException("olderThanMs must not be negative");
        }
        Map<String, Integer> removed = new LinkedHashMap<>();
        for (QueueName queue : PROBE_ORDER) {
            try {
                int count = backend.clean(queue, state, olderThanMs, CLEAN_BATCH_SIZE);
                removed.put(queue.getValue(), count);
                if (count > 0) {
                    log.info("Cleaned {} {} items from queue {}", count, state.getValue(), queue.getValue());
                }
            } catch (RuntimeException e) {
                log.error("Failed to clean {} items from queue {}", state.getValue(), queue.getValue(), e);
                removed.put(queue.getValue(), 0);
            }
        }
        return removed;
    }

    public int retryFailedJobs(int limit) {
        if (limit <= 0) {
            return 0;
        }
        int retried = 0;
        for (QueueName queue : PROBE_ORDER) {
            if (retried >= limit) {
                break;
            }
            for (QueueItem item : backend.list(queue, QueueItemState.FAILED, 0, limit - retried)) {
                if (backend.retry(queue, item.id())) {
                    retried++;
                }
            }
        }
        log.info("Retried {} failed queue items", retried);
        return retried;
    }

    /**
     * Items in {@code state} across all queues, newest first.
     */
    public List<QueueItem> getJobsByState(QueueItemState state, int limit, int offset) {
        if (limit <= 0) {
            return List.of();
        }
        int window = Math.max(0, offset) + limit;
        List<QueueItem> merged = new ArrayList<>();
        for (QueueName queue : PROBE_ORDER) {
            merged.addAll(backend.list(queue, state, 0, window));
        }
        return merged.stream()
                .sorted(Comparator.comparing(QueueItem::createdAt).reversed())
                .skip(Math.max(0, offset))
                .limit(limit)
                .toList();
    }

    public List<QueueItem> getFailedJobs(int limit) {
        return getJobsByState(QueueItemState.FAILED, limit, 0);
    }

    /**
     * Claims due items of one queue for a worker.
     */
    public List<QueueItem> claim(QueueName queue, int maxItems, String workerId) {
        return backend.dequeue(queue, maxItems, workerId);
    }

    public void completeItem(QueueItem item, String result) {
        backend.complete(item.queue(), item.id(), result);
    }

    /**
     * Redelivers the item with jittered exponential backoff while it has attempts left, otherwise fails it.
     */
    public void failItem(QueueItem item, String reason) {
        if (item.hasAttemptsLeft()) {
            long delay = backoffCalculator.calculateBackoffDelay(Math.max(1, item.attemptsMade()),
                    item.backoffDelayMs(), settings.getMaxBackoffDelayMs());
            backend.retryLater(item.queue(), item.id(), reason, delay);
            log.debug("Item {} on queue {} failed attempt {}/{}; retrying in {} ms", item.id(),
                    item.queue().getValue(), item.attemptsMade(), item.attempts(), delay);
            return;
        }
        backend.fail(item.queue(), item.id(), reason);
        log.warn("Item {} on queue {} failed permanently after {} attempts: {}", item.id(), item.queue().getValue(),
                item.attemptsMade(), reason);
    }
}
