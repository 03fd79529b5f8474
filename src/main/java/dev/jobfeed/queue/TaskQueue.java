package dev.jobfeed.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobfeed.config.WorkerConfig;
import dev.jobfeed.entity.TaskExecutionRecord;
import dev.jobfeed.entity.TaskLock;
import dev.jobfeed.metrics.IngestionMetrics;
import dev.jobfeed.model.TaskParams;
import dev.jobfeed.model.TaskStatus;
import dev.jobfeed.model.TaskType;
import dev.jobfeed.repository.TaskExecutionRecordRepository;
import dev.jobfeed.scheduler.ScheduledTaskDefinition;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accepts task executions and runs them on a fixed worker pool.
 * Enqueue takes the task-name lock first, so a second run of a task that is still in flight is
 * rejected without creating a record. Execution records double as the durable queue.
 */
@Slf4j
@Component
public class TaskQueue {

    private final TaskExecutionRecordRepository executionRepository;
    private final TaskLockService lockService;
    private final TaskWorker worker;
    private final WorkerConfig workerConfig;
    private final IngestionMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate tx;

    private ExecutorService workers;

    public TaskQueue(TaskExecutionRecordRepository executionRepository, TaskLockService lockService,
                     TaskWorker worker, WorkerConfig workerConfig, IngestionMetrics metrics,
                     ObjectMapper objectMapper, PlatformTransactionManager txManager, Clock clock) {
        this.executionRepository = executionRepository;
        this.lockService = lockService;
        this.worker = worker;
        this.workerConfig = workerConfig;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @PostConstruct
    void startWorkers() {
        workers = Executors.newFixedThreadPool(workerConfig.getPoolSize(), new WorkerThreadFactory());
        log.info("Worker pool started with {} threads", workerConfig.getPoolSize());
    }

    @PreDestroy
    void stopWorkers() throws InterruptedException {
        if (workers == null) {
            return;
        }
        workers.shutdownNow();
        if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("Worker pool did not terminate within 10 seconds");
        }
    }

    public TaskHandle enqueue(ScheduledTaskDefinition definition, Instant occurrence) {
        return enqueue(definition.name(), definition.taskType(), definition.params(), occurrence);
    }

    /**
     * Enqueue one occurrence of a task.
     *
     * @param scheduledFor occurrence timestamp; (taskName, scheduledFor) is enqueued at most once
     * @return an accepted handle, or a rejected one when the task is still running or the occurrence already exists
     */
    public TaskHandle enqueue(String taskName, TaskType taskType, TaskParams params, Instant scheduledFor) {
        if (executionRepository.existsByTaskNameAndScheduledFor(taskName, scheduledFor)) {
            return reject(taskName, scheduledFor, "occurrence already enqueued");
        }

        String lockToken = UUID.randomUUID().toString();
        if (!lockService.tryAcquire(taskName, lockToken) && !takeOverFromFinishedRun(taskName, lockToken)) {
            return reject(taskName, scheduledFor, "previous run still holds the lock");
        }

        TaskExecutionRecord execution;
        try {
            String paramsJson = toJson(params);
            execution = tx.execute(status -> executionRepository.saveAndFlush(TaskExecutionRecord.builder()
                    .taskName(taskName)
                    .taskType(taskType)
                    .paramsJson(paramsJson)
                    .scheduledFor(scheduledFor)
                    .status(TaskStatus.PENDING)
                    .lockToken(lockToken)
                    .enqueuedAt(clock.instant())
                    .build()));
        } catch (DataIntegrityViolationException e) {
            lockService.release(taskName, lockToken);
            return reject(taskName, scheduledFor, "occurrence already enqueued");
        } catch (RuntimeException e) {
            lockService.release(taskName, lockToken);
            throw e;
        }

        CompletableFuture<TaskStatus> completion = new CompletableFuture<>();
        TaskExecutionRecord submitted = execution;
        try {
            workers.execute(() -> {
                try {
                    completion.complete(worker.execute(submitted, lockToken));
                } catch (RuntimeException | Error e) {
                    log.error("Worker crashed on execution {} of {}", submitted.getId(), taskName, e);
                    completion.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            tx.execute(status -> executionRepository.finishIfInFlight(submitted.getId(), TaskStatus.FAILED,
                    "Worker pool is shut down", null, clock.instant()));
            lockService.release(taskName, lockToken);
            throw e;
        }

        metrics.recordEnqueued(taskName, true);
        log.info("Enqueued {} (execution {}, occurrence {})", taskName, execution.getId(), scheduledFor);
        return TaskHandle.accepted(execution.getId(), taskName, scheduledFor, completion, this);
    }

    /**
     * Request cooperative cancellation. The worker honours it at the next checkpoint or before the next retry.
     *
     * @return false when the execution is unknown or already finished
     */
    public boolean cancel(long executionId) {
        Integer requested = tx.execute(status -> executionRepository.requestCancel(executionId));
        boolean accepted = requested != null && requested == 1;
        log.info("Cancellation of execution {} {}", executionId, accepted ? "requested" : "ignored, not in flight");
        return accepted;
    }

    /**
     * A lock can outlive its run: the process may stop between finishing the record and releasing the
     * lock, or the reaper may have failed the run. Such a lock is stale even while its lease lasts.
     * A holder with no record yet is a concurrent enqueue and keeps the lock.
     */
    private boolean takeOverFromFinishedRun(String taskName, String lockToken) {
        Optional<String> holder = lockService.find(taskName).map(TaskLock::getOwnerId);
        if (holder.isEmpty()) {
            return false;
        }
        boolean finished = executionRepository.findByLockToken(holder.get())
                .map(previous -> !previous.getStatus().isInFlight())
                .orElse(false);
        return finished && lockService.takeOver(taskName, holder.get(), lockToken);
    }

    private TaskHandle reject(String taskName, Instant scheduledFor, String reason) {
        metrics.recordEnqueued(taskName, false);
        log.warn("Not enqueuing {} for {}: {}", taskName, scheduledFor, reason);
        return TaskHandle.rejected(taskName, scheduledFor, reason);
    }

    private String toJson(TaskParams params) {
        try {
            return objectMapper.writeValueAsString(params != null ? params : TaskParams.builder().build());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task params are not serializable", e);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "task-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
