package dev.autoapply.repository;

import dev.autoapply.entity.JobLink;
import dev.autoapply.entity.JobLinkStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Repository for discovered postings.
 */
@Repository
public interface JobLinkRepository extends JpaRepository<JobLink, Long> {

    /**
     * Id and URL only, for slug clustering.
     */
    interface LinkUrl {
        Long getId();

        String getUrl();
    }

    List<LinkUrl> findByUserIdOrderByIdAsc(Long userId);

    @Query("SELECT DISTINCT l.userId FROM JobLink l")
    List<Long> findDistinctUserIds();

    /**
     * Set priority to 0 for the given links. Links already at 0 are not counted.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE JobLink l SET l.priority = 0 WHERE l.id IN :ids AND l.priority <> 0")
    int demote(@Param("ids") Collection<Long> ids);

    @Query("SELECT l.url FROM JobLink l WHERE l.userId = :userId AND l.url IN :urls")
    Set<String> findExistingUrls(@Param("userId") Long userId, @Param("urls") Set<String> urls);

    /**
     * Next links to turn into queue entries: highest priority first, then oldest.
     * Demoted links (priority 0) are never returned.
     */
    @Query("SELECT l FROM JobLink l WHERE l.userId = :userId AND l.status IN :statuses AND l.priority > 0 "
            + "ORDER BY l.priority DESC, l.createdAt ASC")
    List<JobLink> findNextToProcess(@Param("userId") Long userId,
                                    @Param("statuses") Collection<JobLinkStatus> statuses,
                                    Pageable pageable);

    @Query("SELECT COUNT(l) FROM JobLink l WHERE l.userId = :userId AND l.status IN :statuses AND l.priority > 0")
    long countProcessable(@Param("userId") Long userId, @Param("statuses") Collection<JobLinkStatus> statuses);
}
