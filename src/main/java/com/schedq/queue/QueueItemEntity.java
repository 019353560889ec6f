package com.schedq.queue;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "schedq_queue_items")
public class QueueItemEntity {

    @Id
    private UUID id;

    @Column(name = "queue_name", nullable = false)
    private String queueName;

    @Column(name = "item_id", nullable = false)
    private String itemId;

    @Column(nullable = false)
    private String name;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode data;

    @Column(name = "owner_id")
    private UUID ownerId;

    private int priority;

    private int attempts;

    @Column(name = "attempts_made")
    private int attemptsMade;

    @Column(name = "backoff_delay_ms")
    private long backoffDelayMs;

    @Column(name = "remove_on_complete")
    private int removeOnComplete;

    @Column(name = "remove_on_fail")
    private int removeOnFail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QueueItemState state;

    @Column(name = "failed_reason", columnDefinition = "text")
    private String failedReason;

    @Column(name = "return_value", columnDefinition = "text")
    private String returnValue;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "process_at", nullable = false)
    private OffsetDateTime processAt;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;

    protected QueueItemEntity() {
    }

    QueueItemEntity(QueueName queue, NewQueueItem request, OffsetDateTime now) {
        this.id = UUID.randomUUID();
        this.queueName = queue.getValue();
        this.itemId = request.itemId();
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

    QueueItem toItem() {
        return new QueueItem(itemId, QueueName.fromValue(queueName), name, data, ownerId, priority, attempts,
                attemptsMade, backoffDelayMs, state, failedReason, returnValue, createdAt, processAt, processedAt,
                finishedAt);
    }

    void claim(String workerId, OffsetDateTime now) {
        this.state = QueueItemState.ACTIVE;
        this.lockedBy = workerId;
        this.processedAt = now;
        this.attemptsMade++;
    }

    void complete(String result, OffsetDateTime now) {
        this.state = QueueItemState.COMPLETED;
        this.returnValue = result;
        this.finishedAt = now;
        this.lockedBy = null;
    }

    void fail(String reason, OffsetDateTime now) {
        this.state = QueueItemState.FAILED;
        this.failedReason = reason;
        this.finishedAt = now;
        this.lockedBy = null;
    }

    void retryLater(String reason, OffsetDateTime processAt) {
        this.state = QueueItemState.DELAYED;
        this.failedReason = reason;
        this.processAt = processAt;
        this.lockedBy = null;
    }

    void requeue(OffsetDateTime now) {
        this.state = QueueItemState.WAITING;
        this.attemptsMade = 0;
        this.failedReason = null;
        this.finishedAt = null;
        this.processAt = now;
    }

    public UUID getId() {
        return id;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getItemId() {
        return itemId;
    }

    public QueueItemState getState() {
        return state;
    }

    public int getRemoveOnComplete() {
        return removeOnComplete;
    }

    public int getRemoveOnFail() {
        return removeOnFail;
    }
}
