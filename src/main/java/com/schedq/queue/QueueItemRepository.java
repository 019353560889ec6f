package com.schedq.queue;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface QueueItemRepository extends JpaRepository<QueueItemEntity, UUID> {

    interface StateCount {
        QueueItemState getState();

        Long getCount();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT q FROM QueueItemEntity q
            WHERE q.queueName = :queueName
              AND q.state IN (com.schedq.queue.QueueItemState.WAITING, com.schedq.queue.QueueItemState.DELAYED)
              AND q.processAt <= :now
            ORDER BY q.priority DESC, q.processAt ASC
            """)
    List<QueueItemEntity> findDueForUpdate(@Param("queueName") String queueName, @Param("now") OffsetDateTime now,
            Pageable pageable);

    Optional<QueueItemEntity> findByQueueNameAndItemId(String queueName, String itemId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT q FROM QueueItemEntity q WHERE q.queueName = :queueName AND q.itemId = :itemId")
    Optional<QueueItemEntity> findByQueueNameAndItemIdForUpdate(@Param("queueName") String queueName,
            @Param("itemId") String itemId);

    List<QueueItemEntity> findByQueueNameAndStateOrderByCreatedAtDesc(String queueName, QueueItemState state,
            Pageable pageable);

    @Query("""
            SELECT q.id FROM QueueItemEntity q
            WHERE q.queueName = :queueName
              AND q.state = :state
              AND q.finishedAt < :threshold
            ORDER BY q.finishedAt ASC
            """)
    List<UUID> findFinishedBefore(@Param("queueName") String queueName, @Param("state") QueueItemState state,
            @Param("threshold") OffsetDateTime threshold, Pageable pageable);

    @Query("""
            SELECT q.state AS state, COUNT(q) AS count FROM QueueItemEntity q
            WHERE q.queueName = :queueName
            GROUP BY q.state
            """)
    List<StateCount> countByState(@Param("queueName") String queueName);

    @Modifying
    @Transactional
    @Query("""
            DELETE FROM QueueItemEntity q
            WHERE q.queueName = :queueName
              AND q.itemId = :itemId
              AND q.state <> com.schedq.queue.QueueItemState.ACTIVE
            """)
    int deleteInactive(@Param("queueName") String queueName, @Param("itemId") String itemId);

    @Modifying
    @Transactional
    @Query("""
            DELETE FROM QueueItemEntity q
            WHERE q.queueName = :queueName
              AND q.ownerId = :ownerId
              AND q.state <> com.schedq.queue.QueueItemState.ACTIVE
            """)
    int deleteInactiveByOwner(@Param("queueName") String queueName, @Param("ownerId") UUID ownerId);

    @Modifying
    @Transactional
    @Query("""
            UPDATE QueueItemEntity q
            SET q.state = com.schedq.queue.QueueItemState.PAUSED
            WHERE q.queueName = :queueName
              AND q.ownerId = :ownerId
              AND q.state IN (com.schedq.queue.QueueItemState.WAITING, com.schedq.queue.QueueItemState.DELAYED)
            """)
    int pauseByOwner(@Param("queueName") String queueName, @Param("ownerId") UUID ownerId);

    @Modifying
    @Transactional
    @Query("""
            UPDATE QueueItemEntity q
            SET q.state = CASE
                WHEN q.processAt > :now THEN com.schedq.queue.QueueItemState.DELAYED
                ELSE com.schedq.queue.QueueItemState.WAITING END
            WHERE q.queueName = :queueName
              AND q.ownerId = :ownerId
              AND q.state = com.schedq.queue.QueueItemState.PAUSED
            """)
    int resumeByOwner(@Param("queueName") String queueName, @Param("ownerId") UUID ownerId,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query(value = """
            DELETE FROM schedq_queue_items
            WHERE id IN (
                SELECT id FROM schedq_queue_items
                WHERE queue_name = :queueName AND state = :state
                ORDER BY finished_at DESC
                OFFSET :keep
            )
            """, nativeQuery = true)
    int trimFinished(@Param("queueName") String queueName, @Param("state") String state, @Param("keep") int keep);
}
