package dev.jobfeed.queue;

import dev.jobfeed.entity.TaskExecutionRecord;
import dev.jobfeed.entity.TaskLock;
import dev.jobfeed.model.TaskStatus;
import dev.jobfeed.repository.TaskExecutionRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Fails in-flight executions whose process died. An execution is abandoned when its task lock
 * lease expired or the lock now belongs to someone else.
 */
@Slf4j
@Component
public class StaleExecutionReaper {

    static final String ABANDONED = "abandoned: lock lease expired";

    private final TaskExecutionRecordRepository executionRepository;
    private final TaskLockService lockService;
    private final Clock clock;
    private final TransactionTemplate tx;

    public StaleExecutionReaper(TaskExecutionRecordRepository executionRepository, TaskLockService lockService,
                                PlatformTransactionManager txManager, Clock clock) {
        this.executionRepository = executionRepository;
        this.lockService = lockService;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
    }

    @Scheduled(fixedDelayString = "${worker.reaper-interval-ms:60000}",
            initialDelayString = "${worker.reaper-interval-ms:60000}")
    public void scheduledReap() {
        try {
            reap();
        } catch (RuntimeException e) {
            log.error("Reaper pass failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of executions marked failed
     */
    public int reap() {
        Instant now = clock.instant();
        List<TaskExecutionRecord> inFlight =
                executionRepository.findByStatusIn(EnumSet.of(TaskStatus.PENDING, TaskStatus.RUNNING));

        int reaped = 0;
        for (TaskExecutionRecord execution : inFlight) {
            if (!isAbandoned(execution, now)) {
                continue;
            }
            Integer updated = tx.execute(status -> executionRepository.finishIfInFlight(
                    execution.getId(), TaskStatus.FAILED, ABANDONED, null, now));
            if (updated != null && updated == 1) {
                reaped++;
                log.warn("Reaped abandoned execution {} of {} (worker {})",
                        execution.getId(), execution.getTaskName(), execution.getWorkerId());
            }
        }
        if (reaped > 0) {
            log.info("Reaper marked {} abandoned executions as failed", reaped);
        }
        return reaped;
    }

    private boolean isAbandoned(TaskExecutionRecord execution, Instant now) {
        Optional<TaskLock> lock = lockService.find(execution.getTaskName());
        if (lock.isEmpty() || lock.get().getOwnerId() == null) {
            return true;
        }
        TaskLock held = lock.get();
        return !held.getOwnerId().equals(execution.getLockToken())
                || held.getLockedUntil() == null
                || held.getLockedUntil().isBefore(now);
    }
}
