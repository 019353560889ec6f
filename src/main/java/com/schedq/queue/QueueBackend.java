package com.schedq.queue;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage and delivery for queue items. The three named queues are a routing policy on top of this seam; an
 * implementation only has to keep items of different queues apart.
 * <p>
 * Item ids are unique within a queue. Enqueueing an id that is already present returns the existing item.
 */
public interface QueueBackend {

    QueueItem enqueue(QueueName queue, NewQueueItem item);

    /**
     * Claims up to {@code maxItems} due items, highest priority first, and marks them {@code ACTIVE}.
     * Returns nothing while the queue is paused.
     */
    List<QueueItem> dequeue(QueueName queue, int maxItems, String workerId);

    void complete(QueueName queue, String itemId, String result);

    /**
     * Terminal failure. The backend keeps at most the item's {@code removeOnFail} most recent failures.
     */
    void fail(QueueName queue, String itemId, String reason);

    /**
     * Records a failed attempt and redelivers the item after {@code delayMs}.
     */
    void retryLater(QueueName queue, String itemId, String reason, long delayMs);

    Optional<QueueItem> find(QueueName queue, String itemId);

    /**
     * Removes the item unless a worker currently holds it.
     */
    boolean remove(QueueName queue, String itemId);

    int removeByOwner(QueueName queue, UUID ownerId);

    int pauseByOwner(QueueName queue, UUID ownerId);

    int resumeByOwner(QueueName queue, UUID ownerId);

    QueueCounts counts(QueueName queue);

    List<QueueItem> list(QueueName queue, QueueItemState state, int offset, int limit);

    void pause(QueueName queue);

    void resume(QueueName queue);

    boolean isPaused(QueueName queue);

    /**
     * Removes up to {@code limit} items in the terminal {@code state} that finished more than {@code olderThanMs}
     * ago. Returns the number removed.
     */
    int clean(QueueName queue, QueueItemState state, long olderThanMs, int limit);

    /**
     * Moves a {@code FAILED} item back to {@code WAITING}. Returns {@code false} if the item is not failed.
     */
    boolean retry(QueueName queue, String itemId);
}
