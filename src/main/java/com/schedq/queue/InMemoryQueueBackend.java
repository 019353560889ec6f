package com.schedq.queue;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-process backend. Each queue is a {@link QueueStore} guarding its own items with its monitor, so
 * operations on different queues never contend.
 */
@Component
@ConditionalOnProperty(prefix = "schedq.queue", name = "backend", havingValue = "memory")
public class InMemoryQueueBackend implements QueueBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryQueueBackend.class);

    private final Clock clock;
    private final Map<QueueName, QueueStore> stores = new EnumMap<>(QueueName.class);

    public InMemoryQueueBackend() {
        this(Clock.systemUTC());
    }

    public InMemoryQueueBackend(Clock clock) {
        this.clock = clock;
        for (QueueName queue : QueueName.values()) {
            stores.put(queue, new QueueStore(queue));
        }
        log.info("Using in-memory queue backend");
    }

    @Override
    public QueueItem enqueue(QueueName queue, NewQueueItem item) {
        return store(queue).enqueue(item, now());
    }

    @Override
    public List<QueueItem> dequeue(QueueName queue, int maxItems, String workerId) {
        return store(queue).dequeue(maxItems, now());
    }

    @Override
    public void complete(QueueName queue, String itemId, String result) {
        store(queue).complete(itemId, result, now());
    }

    @Override
    public void fail(QueueName queue, String itemId, String reason) {
        store(queue).fail(itemId, reason, now());
    }

    @Override
    public void retryLater(QueueName queue, String itemId, String reason, long delayMs) {
        store(queue).retryLater(itemId, reason, delayMs, now());
    }

    @Override
    public Optional<QueueItem> find(QueueName queue, String itemId) {
        return store(queue).find(itemId);
    }

    @Override
    public boolean remove(QueueName queue, String itemId) {
        return store(queue).remove(itemId);
    }

    @Override
    public int removeByOwner(QueueName queue, UUID ownerId) {
        return store(queue).removeByOwner(ownerId);
    }

    @Override
    public int pauseByOwner(QueueName queue, UUID ownerId) {
        return store(queue).pauseByOwner(ownerId);
    }

    @Override
    public int resumeByOwner(QueueName queue, UUID ownerId) {
        return store(queue).resumeByOwner(ownerId, now());
    }

    @Override
    public QueueCounts counts(QueueName queue) {
        return store(queue).counts();
    }

    @Override
    public List<QueueItem> list(QueueName queue, QueueItemState state, int offset, int limit) {
        return store(queue).list(state, offset, limit);
    }

    @Override
    public void pause(QueueName queue) {
        store(queue).setPaused(true);
    }

    @Override
    public void resume(QueueName queue) {
        store(queue).setPaused(false);
    }

    @Override
    public boolean isPaused(QueueName queue) {
        return store(queue).isPaused();
    }

    @Override
    public int clean(QueueName queue, QueueItemState state, long olderThanMs, int limit) {
        return store(queue).clean(state, now().minusNanos(olderThanMs * 1_000_000), limit);
    }

    @Override
    public boolean retry(QueueName queue, String itemId) {
        return store(queue).retry(itemId, now());
    }

    private QueueStore store(QueueName queue) {
        return stores.get(queue);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static final class QueueStore {

        private final QueueName queue;
        private final Map<String, Entry> items = new LinkedHashMap<>();
        private boolean paused;

        private QueueStore(QueueName queue) {
            this.queue = queue;
        }

        synchronized QueueItem enqueue(NewQueueItem request, OffsetDateTime now) {
            Entry existing = items.get(request.itemId());
            if (existing != null) {
                return existing.snapshot(queue);
            }
            Entry entry = new Entry(request, now);
            items.put(entry.id, entry);
            return entry.snapshot(queue);
        }

        synchronized List<QueueItem> dequeue(int maxItems, OffsetDateTime now) {
            if (paused || maxItems <= 0) {
                return List.of();
            }
            List<Entry> due = items.values().stream()
                    .filter(entry -> entry.state == QueueItemState.WAITING || entry.state == QueueItemState.DELAYED)
                    .filter(entry -> !entry.processAt.isAfter(now))
                    .sorted(Comparator.comparingInt((Entry entry) -> entry.priority).reversed()
                            .thenComparing(entry -> entry.processAt))
                    .limit(maxItems)
                    .toList();
            List<QueueItem> claimed = new ArrayList<>(due.size());
            for (Entry entry : due) {
                entry.state = QueueItemState.ACTIVE;
                entry.processedAt = now;
                entry.attemptsMade++;
                claimed.add(entry.snapshot(queue));
            }
            return claimed;
        }

        synchronized void complete(String itemId, String result, OffsetDateTime now) {
            Entry entry = items.get(itemId);
            if (entry == null || entry.state != QueueItemState.ACTIVE) {
                return;
            }
            entry.state = QueueItemState.COMPLETED;
            entry.returnValue = result;
            entry.finishedAt = now;
            trim(QueueItemState.COMPLETED, entry.removeOnComplete);
        }

        synchronized void fail(String itemId, String reason, OffsetDateTime now) {
            Entry entry = items.get(itemId);
            if (entry == null || entry.state != QueueItemState.ACTIVE) {
                return;
            }
            entry.state = QueueItemState.FAILED;
            entry.failedReason = reason;
            entry.finishedAt = now;
            trim(QueueItemState.FAILED, entry.removeOnFail);
        }

        synchronized void retryLater(String itemId, String reason, long delayMs, OffsetDateTime now) {
            Entry entry = items.get(itemId);
            if (entry == null || entry.state != QueueItemState.ACTIVE) {
                return;
            }
            entry.state = QueueItemState.DELAYED;
            entry.failedReason = reason;
            entry.processAt = now.plusNanos(delayMs * 1_000_000);
        }

        synchronized Optional<QueueItem> find(String itemId) {
            Entry entry = items.get(itemId);
            return entry == null ? Optional.empty() : Optional.of(entry.snapshot(queue));
        }

        synchronized boolean remove(String itemId) {
            Entry entry = items.get(itemId);
            if (entry == null || entry.state == QueueItemState.ACTIVE) {
                return false;
            }
            items.remove(itemId);
            return true;
        }

        synchronized int removeByOwner(UUID ownerId) {
            int before = items.size();
            items.values().removeIf(entry -> ownerId.equals(entry.ownerId) && entry.state != QueueItemState.ACTIVE);
            return before - items.size();
        }

        synchronized int pauseByOwner(UUID ownerId) {
            int changed = 0;
            for (Entry entry : items.values()) {
                if (ownerId.equals(entry.ownerId)
                        && (entry.state == QueueItemState.WAITING || entry.state == QueueItemState.DELAYED)) {
                    entry.state = QueueItemState.PAUSED;
                    changed++;
                }
            }
            return changed;
        }

        synchronized int resumeByOwner(UUID ownerId, OffsetDateTime now) {
            int changed = 0;
            for (Entry entry : items.values()) {
                if (ownerId.equals(entry.ownerId) && entry.state == QueueItemState.PAUSED) {
                    entry.state = entry.processAt.isAfter(now) ? QueueItemState.DELAYED : QueueItemState.WAITING;
                    changed++;
                }
            }
            return changed;
        }

        synchronized QueueCounts counts() {
            Map<QueueItemState, Long> byState = new EnumMap<>(QueueItemState.class);
            for (Entry entry : items.values()) {
                byState.merge(entry.state, 1L, Long::sum);
            }
            long waiting = byState.getOrDefault(QueueItemState.WAITING, 0L);
            long pausedCount = byState.getOrDefault(QueueItemState.PAUSED, 0L);
            if (paused) {
                pausedCount += waiting;
                waiting = 0;
            }
            return new QueueCounts(
                    waiting,
                    byState.getOrDefault(QueueItemState.ACTIVE, 0L),
                    byState.getOrDefault(QueueItemState.COMPLETED, 0L),
                    byState.getOrDefault(QueueItemState.FAILED, 0L),
                    byState.getOrDefault(QueueItemState.DELAYED, 0L),
                    pausedCount);
        }

        synchronized List<QueueItem> list(QueueItemState state, int offset, int limit) {
            return items.values().stream()
                    .filter(entry -> entry.state == state)
                    .sorted(Comparator.comparing((Entry entry) -> entry.createdAt).reversed())
                    .skip(Math.max(0, offset))
                    .limit(Math.max(0, limit))
                    .map(entry -> entry.snapshot(queue))
                    .toList();
        }

        synchronized void setPaused(boolean paused) {
            this.paused = paused;
        }

        synchronized boolean isPaused() {
            return paused;
        }

        synchronized int clean(QueueItemState state, OffsetDateTime threshold, int limit) {
            List<String> expired = items.values().stream()
                    .filter(entry -> entry.state == state)
                    .filter(entry -> entry.finishedAt != null && entry.finishedAt.isBefore(threshold))
                    .limit(Math.max(0, limit))
                    .map(entry -> entry.id)
                    .toList();
            expired.forEach(items::remove);
            return expired.size();
        }

        synchronized boolean retry(String itemId, OffsetDateTime now) {
            Entry entry = items.get(itemId);
            if (entry == null || entry.state != QueueItemState.FAILED) {
                return false;
            }
            entry.state = QueueItemState.WAITING;
            entry.attemptsMade = 0;
            entry.failedReason = null;
            entry.finishedAt = null;
            entry.processAt = now;
            return true;
        }

        private void trim(QueueItemState state, int keep) {
            if (keep < 0) {
                return;
            }
            List<Entry> terminal = items.values().stream()
                    .filter(entry -> entry.state == state)
                    .sorted(Comparator.comparing((Entry entry) -> entry.finishedAt).reversed())
                    .toList();
            for (int i = keep; i < terminal.size(); i++) {
                items.remove(terminal.get(i).id);
            }
        }
    }

    private static final class Entry {
        private final String id;
        private final String name;
        private final JsonNode data;
        private final UUID ownerId;
        private final int priority;
        private final int attempts;
        private final long backoffDelayMs;
        private final int removeOnComplete;
        private final int removeOnFail;
        private final OffsetDateTime createdAt;
        private int attemptsMade;
        private QueueItemState state;
        private String failedReason;
        private String returnValue;
        private OffsetDateTime processAt;
        private OffsetDateTime processedAt;
        private OffsetDateTime finishedAt;

        private Entry(NewQueueItem request, OffsetDateTime now) {
            this.id = request.itemId();
            this.name = request.name();
            this.data = request.data();
            this.ownerId = request.ownerId();
            this.priority = request.priority();
            this.attempts = request.attempts();
            this.backoffDelayMs = request.backoffDelayMs();
            this.removeOnComplete = request.removeOnComplete();
            this.removeOnFail = request.removeOnFail();
            this.createdAt = now;
            this.processAt = now.plusNanos(Math.max(0L, request.delayMs()) * 1_000_000);
            this.state = request.delayMs() > 0 ? QueueItemState.DELAYED : QueueItemState.WAITING;
        }

        private QueueItem snapshot(QueueName queue) {
            return new QueueItem(id, queue, name, data, ownerId, priority, attempts, attemptsMade, backoffDelayMs,
                    state, failedReason, returnValue, createdAt, processAt, processedAt, finishedAt);
        }
    }
}
