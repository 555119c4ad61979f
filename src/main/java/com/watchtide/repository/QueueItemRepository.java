package com.watchtide.repository;

import com.watchtide.model.QueueItem;
import com.watchtide.model.QueueItemStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Database access for the lease queue.
 *
 * Every status transition is a single conditional UPDATE on one row:
 *   claimLease → UPDATE event_queue SET item_status = 'LEASED' ... WHERE id = ? AND item_status = 'PENDING'
 * A return value of 0 means another worker won the row; no lock is held
 * across transitions.
 */
public interface QueueItemRepository extends JpaRepository<QueueItem, String> {

    List<QueueItem> findByStatusOrderByCreatedAtAsc(QueueItemStatus status, Pageable pageable);

    long countByStatus(QueueItemStatus status);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE QueueItem q SET q.status = :to, q.leaseUntil = :leaseUntil, q.updatedAt = :now "
            + "WHERE q.id = :id AND q.status = :from")
    int claimLease(@Param("id") String id,
                   @Param("from") QueueItemStatus from,
                   @Param("to") QueueItemStatus to,
                   @Param("leaseUntil") Instant leaseUntil,
                   @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE QueueItem q SET q.status = :status, q.leaseUntil = NULL, q.updatedAt = :now WHERE q.id = :id")
    int finish(@Param("id") String id,
               @Param("status") QueueItemStatus status,
               @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE QueueItem q SET q.status = :to, q.leaseUntil = NULL, q.updatedAt = :now "
            + "WHERE q.status = :from AND q.leaseUntil < :now")
    int releaseExpiredLeases(@Param("from") QueueItemStatus from,
                             @Param("to") QueueItemStatus to,
                             @Param("now") Instant now);

    // Used by markFailed's read-modify-write; the caller owns the transaction
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT q FROM QueueItem q WHERE q.id = :id")
    Optional<QueueItem> findForUpdate(@Param("id") String id);
}
