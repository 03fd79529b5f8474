package dev.jobfeed.repository;

import dev.jobfeed.entity.JobPosting;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for stored job postings.
 */
@Repository
public interface JobPostingRepository extends JpaRepository<JobPosting, Long> {

    /**
     * Find a posting by identity, locking the row for the rest of the transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM JobPosting j WHERE j.source = :source AND j.externalId = :externalId")
    Optional<JobPosting> findForUpdate(@Param("source") String source, @Param("externalId") String externalId);

    Optional<JobPosting> findBySourceAndExternalId(String source, String externalId);

    long countBySourceAndExternalId(String source, String externalId);

    long countByActiveTrue();

    /**
     * Soft-delete postings not refreshed since the cutoff.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE JobPosting j
               SET j.active = false,
                   j.updatedAt = :now
             WHERE j.active = true
               AND j.fetchedAt < :cutoff
            """)
    int deactivateFetchedBefore(@Param("cutoff") Instant cutoff, @Param("now") Instant now);
}
