package dev.jobfeed.queue;

import dev.jobfeed.config.WorkerConfig;
import dev.jobfeed.entity.TaskLock;
import dev.jobfeed.repository.TaskLockRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Mutex keyed by task name, held in the {@code task_locks} table so it is shared by every process
 * using the same store. Locks are leases: a holder that dies stops renewing and the lock frees itself.
 */
@Slf4j
@Service
public class TaskLockService {

    private final TaskLockRepository taskLockRepository;
    private final WorkerConfig workerConfig;
    private final Clock clock;
    private final TransactionTemplate tx;

    public TaskLockService(TaskLockRepository taskLockRepository, WorkerConfig workerConfig,
                           PlatformTransactionManager txManager, Clock clock) {
        this.taskLockRepository = taskLockRepository;
        this.workerConfig = workerConfig;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * @return true when {@code ownerId} now holds the lock
     */
    public boolean tryAcquire(String name, String ownerId) {
        ensureRow(name);
        Instant now = clock.instant();
        Integer acquired = tx.execute(status ->
                taskLockRepository.acquireIfFree(name, ownerId, now.plus(workerConfig.getLockLease()), now));
        boolean held = acquired != null && acquired == 1;
        log.debug("Lock {} {} by {}", name, held ? "acquired" : "busy, not acquired", ownerId);
        return held;
    }

    /**
     * Extend the lease.
     *
     * @return false when the lock was lost to another owner
     */
    public boolean renew(String name, String ownerId) {
        Instant until = clock.instant().plus(workerConfig.getLockLease());
        Integer renewed = tx.execute(status -> taskLockRepository.renewIfOwned(name, ownerId, until));
        return renewed != null && renewed == 1;
    }

    /**
     * Take a lock over from an owner known to be finished, even though its lease has not run out.
     *
     * @return false when the lock no longer belongs to {@code staleOwnerId}
     */
    public boolean takeOver(String name, String staleOwnerId, String ownerId) {
        Instant until = clock.instant().plus(workerConfig.getLockLease());
        Integer taken = tx.execute(status -> taskLockRepository.takeOverFrom(name, staleOwnerId, ownerId, until));
        boolean held = taken != null && taken == 1;
        if (held) {
            log.warn("Lock {} taken over from finished owner {} by {}", name, staleOwnerId, ownerId);
        }
        return held;
    }

    public void release(String name, String ownerId) {
        Integer released = tx.execute(status -> taskLockRepository.releaseIfOwned(name, ownerId));
        if (released == null || released == 0) {
            log.warn("Lock {} was no longer held by {} at release", name, ownerId);
        } else {
            log.debug("Lock {} released by {}", name, ownerId);
        }
    }

    public Optional<TaskLock> find(String name) {
        return taskLockRepository.findById(name);
    }

    private void ensureRow(String name) {
        if (taskLockRepository.existsById(name)) {
            return;
        }
        try {
            tx.executeWithoutResult(status -> taskLockRepository.insertFree(name));
        } catch (DataIntegrityViolationException e) {
            log.debug("Lock row {} created concurrently", name);
        }
    }
}
