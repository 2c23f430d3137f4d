package dev.autoapply.repository;

import dev.autoapply.entity.JobTrackerRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

/**
 * Repository for permanent application records.
 */
@Repository
public interface JobTrackerRepository extends JpaRepository<JobTrackerRecord, Long> {

    /**
     * Count applications submitted by a user in [start, end).
     */
    @Query("SELECT COUNT(j) FROM JobTrackerRecord j WHERE j.userId = :userId "
            + "AND j.status = :status AND j.appliedAt >= :start AND j.appliedAt < :end")
    long countAppliedBetween(@Param("userId") Long userId,
                                @Param("status") String status,
                                @Param("start") LocalDateTime start,
                                @Param("end") LocalDateTime end);
}
