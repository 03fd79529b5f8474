package dev.jobfeed.repository;

import dev.jobfeed.entity.TaskExecutionRecord;
import dev.jobfeed.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for task execution records. Status transitions are conditional updates so that a
 * worker and the reaper never overwrite each other.
 */
@Repository
public interface TaskExecutionRecordRepository extends JpaRepository<TaskExecutionRecord, Long> {

    boolean existsByTaskNameAndScheduledFor(String taskName, Instant scheduledFor);

    List<TaskExecutionRecord> findByStatusIn(Collection<TaskStatus> statuses);

    List<TaskExecutionRecord> findByTaskNameOrderByEnqueuedAtDesc(String taskName);

    Optional<TaskExecutionRecord> findByLockToken(String lockToken);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE TaskExecutionRecord r
               SET r.status = dev.jobfeed.model.TaskStatus.RUNNING,
                   r.workerId = :workerId,
                   r.startedAt = :startedAt
             WHERE r.id = :id
               AND r.status = dev.jobfeed.model.TaskStatus.PENDING
            """)
    int markRunningIfPending(@Param("id") Long id,
                             @Param("workerId") String workerId,
                             @Param("startedAt") Instant startedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE TaskExecutionRecord r
               SET r.retryCount = :retryCount,
                   r.lastError = :lastError
             WHERE r.id = :id
            """)
    int recordRetry(@Param("id") Long id,
                    @Param("retryCount") int retryCount,
                    @Param("lastError") String lastError);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE TaskExecutionRecord r
               SET r.status = :status,
                   r.lastError = :lastError,
                   r.resultSummary = :resultSummary,
                   r.finishedAt = :finishedAt
             WHERE r.id = :id
               AND r.status IN (dev.jobfeed.model.TaskStatus.PENDING, dev.jobfeed.model.TaskStatus.RUNNING)
            """)
    int finishIfInFlight(@Param("id") Long id,
                         @Param("status") TaskStatus status,
                         @Param("lastError") String lastError,
                         @Param("resultSummary") String resultSummary,
                         @Param("finishedAt") Instant finishedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE TaskExecutionRecord r
               SET r.cancelRequested = true
             WHERE r.id = :id
               AND r.status IN (dev.jobfeed.model.TaskStatus.PENDING, dev.jobfeed.model.TaskStatus.RUNNING)
            """)
    int requestCancel(@Param("id") Long id);

    @Query("SELECT r.cancelRequested FROM TaskExecutionRecord r WHERE r.id = :id")
    Boolean isCancelRequested(@Param("id") Long id);
}
