package com.schedq.queue;

import com.schedq.exception.QueueBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL backed queues. Workers claim due rows with {@code FOR UPDATE SKIP LOCKED}, so several nodes can
 * poll the same table without handing an item to two of them.
 */
@Component
@ConditionalOnProperty(prefix = "schedq.queue", name = "backend", havingValue = "database", matchIfMissing = true)
public class DatabaseQueueBackend implements QueueBackend {

    private static final Logger log = LoggerFactory.getLogger(DatabaseQueueBackend.class);

    private static final String UPSERT_PAUSED_SQL = """
            INSERT INTO schedq_queue_state (queue_name, paused, updated_at)
            VALUES (?, ?, CURRENT_TIMESTAMP)
            ON CONFLICT (queue_name) DO UPDATE
            SET paused = EXCLUDED.paused,
                updated_at = EXCLUDED.updated_at
            """;

    private final QueueItemRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public DatabaseQueueBackend(QueueItemRepository repository, JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate) {
        this.repository = repository;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public QueueItem enqueue(QueueName queue, NewQueueItem item) {
        return transactionTemplate.execute(status -> {
            Optional<QueueItemEntity> existing = repository.findByQueueNameAndItemId(queue.getValue(), item.itemId());
            if (existing.isPresent()) {
                log.debug("Item {} already present in queue {}", item.itemId(), queue.getValue());
                return existing.get().toItem();
            }
            try {
                return repository.saveAndFlush(new QueueItemEntity(queue, item, OffsetDateTime.now())).toItem();
            } catch (DataIntegrityViolationException e) {
                throw new QueueBackendException(
                        "Item " + item.itemId() + " was enqueued concurrently on queue " + queue.getValue(), e);
            }
        });
    }

    @Override
    public List<QueueItem> dequeue(QueueName queue, int maxItems, String workerId) {
        if (maxItems <= 0 || isPaused(queue)) {
            return List.of();
        }
        return transactionTemplate.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now();
            List<QueueItemEntity> due = repository.findDueForUpdate(queue.getValue(), now,
                    PageRequest.of(0, maxItems));
            if (due.isEmpty()) {
                return List.<QueueItem>of();
            }
            for (QueueItemEntity entity : due) {
                entity.claim(workerId, now);
            }
            repository.saveAll(due);
            return due.stream().map(QueueItemEntity::toItem).toList();
        });
    }

    @Override
    public void complete(QueueName queue, String itemId, String result) {
        transactionTemplate.executeWithoutResult(status -> lockActive(queue, itemId).ifPresent(entity -> {
            entity.complete(result, OffsetDateTime.now());
            repository.save(entity);
            trim(queue, QueueItemState.COMPLETED, entity.getRemoveOnComplete());
        }));
    }

    @Override
    public void fail(QueueName queue, String itemId, String reason) {
        transactionTemplate.executeWithoutResult(status -> lockActive(queue, itemId).ifPresent(entity -> {
            entity.fail(reason, OffsetDateTime.now());
            repository.save(entity);
            trim(queue, QueueItemState.FAILED, entity.getRemoveOnFail());
        }));
    }

    @Override
    public void retryLater(QueueName queue, String itemId, String reason, long delayMs) {
        transactionTemplate.executeWithoutResult(status -> lockActive(queue, itemId).ifPresent(entity -> {
            entity.retryLater(reason, OffsetDateTime.now().plusNanos(delayMs * 1_000_000));
            repository.save(entity);
        }));
    }

    @Override
    public Optional<QueueItem> find(QueueName queue, String itemId) {
        return repository.findByQueueNameAndItemId(queue.getValue(), itemId).map(QueueItemEntity::toItem);
    }

    @Override
    public boolean remove(QueueName queue, String itemId) {
        return repository.deleteInactive(queue.getValue(), itemId) > 0;
    }

    @Override
    public int removeByOwner(QueueName queue, UUID ownerId) {
        return repository.deleteInactiveByOwner(queue.getValue(), ownerId);
    }

    @Override
    public int pauseByOwner(QueueName queue, UUID ownerId) {
        return repository.pauseByOwner(queue.getValue(), ownerId);
    }

    @Override
    public int resumeByOwner(QueueName queue, UUID ownerId) {
        return repository.resumeByOwner(queue.getValue(), ownerId, OffsetDateTime.now());
    }

    @Override
    public QueueCounts counts(QueueName queue) {
        Map<QueueItemState, Long> byState = new EnumMap<>(QueueItemState.class);
        for (QueueItemRepository.StateCount row : repository.countByState(queue.getValue())) {
            byState.put(row.getState(), row.getCount() == null ? 0L : row.getCount());
        }
        long waiting = byState.getOrDefault(QueueItemState.WAITING, 0L);
        long paused = byState.getOrDefault(QueueItemState.PAUSED, 0L);
        if (isPaused(queue)) {
            paused += waiting;
            waiting = 0;
        }
        return new QueueCounts(
                waiting,
                byState.getOrDefault(QueueItemState.ACTIVE, 0L),
                byState.getOrDefault(QueueItemState.COMPLETED, 0L),
                byState.getOrDefault(QueueItemState.FAILED, 0L),
                byState.getOrDefault(QueueItemState.DELAYED, 0L),
                paused);
    }

    @Override
    public List<QueueItem> list(QueueName queue, QueueItemState state, int offset, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        // Fetch through the end of the requested window, then skip; offsets are small admin paging values.
        List<QueueItemEntity> rows = repository.findByQueueNameAndStateOrderByCreatedAtDesc(queue.getValue(), state,
                PageRequest.of(0, Math.max(0, offset) + limit));
        return rows.stream().skip(Math.max(0, offset)).map(QueueItemEntity::toItem).toList();
    }

    @Override
    public void pause(QueueName queue) {
        jdbcTemplate.update(UPSERT_PAUSED_SQL, queue.getValue(), true);
        log.info("Paused queue {}", queue.getValue());
    }

    @Override
    public void resume(QueueName queue) {
        jdbcTemplate.update(UPSERT_PAUSED_SQL, queue.getValue(), false);
        log.info("Resumed queue {}", queue.getValue());
    }

    @Override
    public boolean isPaused(QueueName queue) {
        List<Boolean> rows = jdbcTemplate.queryForList(
                "SELECT paused FROM schedq_queue_state WHERE queue_name = ?", Boolean.class, queue.getValue());
        return !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0));
    }

    @Override
    public int clean(QueueName queue, QueueItemState state, long olderThanMs, int limit) {
        if (limit <= 0) {
            return 0;
        }
        OffsetDateTime threshold = OffsetDateTime.now().minusNanos(olderThanMs * 1_000_000);
        Integer removed = transactionTemplate.execute(status -> {
            List<UUID> ids = repository.findFinishedBefore(queue.getValue(), state, threshold,
                    PageRequest.of(0, limit));
            if (ids.isEmpty()) {
                return 0;
            }
            repository.deleteAllByIdInBatch(ids);
            return ids.size();
        });
        return removed == null ? 0 : removed;
    }

    @Override
    public boolean retry(QueueName queue, String itemId) {
        Boolean retried = transactionTemplate.execute(status -> repository
                .findByQueueNameAndItemIdForUpdate(queue.getValue(), itemId)
                .filter(entity -> entity.getState() == QueueItemState.FAILED)
                .map(entity -> {
                    entity.requeue(OffsetDateTime.now());
                    repository.save(entity);
                    return true;
                })
                .orElse(false));
        return Boolean.TRUE.equals(retried);
    }

    private Optional<QueueItemEntity> lockActive(QueueName queue, String itemId) {
        Optional<QueueItemEntity> entity = repository.findByQueueNameAndItemIdForUpdate(queue.getValue(), itemId)
                .filter(candidate -> candidate.getState() == QueueItemState.ACTIVE);
        if (entity.isEmpty()) {
            log.debug("Ignoring state change for item {} on queue {}: not active", itemId, queue.getValue());
        }
        return entity;
    }

    private void trim(QueueName queue, QueueItemState state, int keep) {
        if (keep < 0) {
            return;
        }
        int trimmed = repository.trimFinished(queue.getValue(), state.name(), keep);
        if (trimmed > 0) {
            log.debug("Trimmed {} {} items from queue {}", trimmed, state.getValue(), queue.getValue());
        }
    }
}
