package dev.autoapply.repository;

import dev.autoapply.entity.QueueEntry;
import dev.autoapply.entity.QueueStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for submission queue entries.
 */
@Repository
public interface QueueEntryRepository extends JpaRepository<QueueEntry, Long> {

    interface StatusCount {
        QueueStatus getStatus();

        long getTotal();
    }

    /**
     * Load an entry and hold a row lock until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT q FROM QueueEntry q WHERE q.id = :id")
    Optional<QueueEntry> findByIdForUpdate(@Param("id") Long id);

    List<QueueEntry> findByStatusOrderByPriorityDescCreatedAtAsc(QueueStatus status, Pageable pageable);

    List<QueueEntry> findByUserIdAndStatusOrderByCreatedAtAsc(Long userId, QueueStatus status);

    @Query("SELECT DISTINCT q.userId FROM QueueEntry q WHERE q.status = :status")
    List<Long> findUserIdsWithStatus(@Param("status") QueueStatus status);

    /**
     * Entries of a user in the given status whose last change falls in [from, to).
     * For PROCESSING entries the last change is the claim.
     */
    @Query("SELECT COUNT(q) FROM QueueEntry q WHERE q.userId = :userId AND q.status = :status "
            + "AND q.updatedAt >= :from AND q.updatedAt < :to")
    long countByStatusUpdatedBetween(@Param("userId") Long userId,
                                     @Param("status") QueueStatus status,
                                     @Param("from") LocalDateTime from,
                                     @Param("to") LocalDateTime to);

    @Query("SELECT q.status AS status, COUNT(q) AS total FROM QueueEntry q GROUP BY q.status")
    List<StatusCount> countByStatus();

    @Query("SELECT q.status AS status, COUNT(q) AS total FROM QueueEntry q WHERE q.userId = :userId GROUP BY q.status")
    List<StatusCount> countByStatusForUser(@Param("userId") Long userId);
}
