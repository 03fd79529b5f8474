package dev.jobfeed.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobfeed.JobFeedException;
import dev.jobfeed.config.WorkerConfig;
import dev.jobfeed.entity.TaskExecutionRecord;
import dev.jobfeed.metrics.IngestionMetrics;
import dev.jobfeed.model.TaskParams;
import dev.jobfeed.model.TaskStatus;
import dev.jobfeed.repository.TaskExecutionRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs one execution record to a terminal status: claims it, invokes the handler, retries retryable
 * failures with exponential backoff and always releases the task lock.
 */
@Slf4j
@Component
public class TaskWorker {

    private static final int MAX_ERROR_LENGTH = 2000;
    private static final int MAX_SUMMARY_LENGTH = 1000;

    private final TaskExecutionRecordRepository executionRepository;
    private final TaskHandlerRegistry handlerRegistry;
    private final TaskLockService lockService;
    private final WorkerConfig workerConfig;
    private final IngestionMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate tx;

    public TaskWorker(TaskExecutionRecordRepository executionRepository, TaskHandlerRegistry handlerRegistry,
                      TaskLockService lockService, WorkerConfig workerConfig, IngestionMetrics metrics,
                      ObjectMapper objectMapper, PlatformTransactionManager txManager, Clock clock) {
        this.executionRepository = executionRepository;
        this.handlerRegistry = handlerRegistry;
        this.lockService = lockService;
        this.workerConfig = workerConfig;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Execute a pending record. Never throws for handler failures; they end up in the record.
     *
     * @param lockToken owner token of the task lock taken at enqueue, released when this returns
     * @return the terminal status written to the record
     */
    public TaskStatus execute(TaskExecutionRecord execution, String lockToken) {
        long id = execution.getId();
        String taskName = execution.getTaskName();
        metrics.taskStarted();
        try {
            Integer claimed = tx.execute(status ->
                    executionRepository.markRunningIfPending(id, WorkerId.current(), clock.instant()));
            if (claimed == null || claimed == 0) {
                TaskStatus current = executionRepository.findById(id)
                        .map(TaskExecutionRecord::getStatus)
                        .orElse(TaskStatus.FAILED);
                log.info("Execution {} of {} is no longer pending ({}), skipping", id, taskName, current);
                return current;
            }
            log.info("Task {} started (execution {}, occurrence {})", taskName, id, execution.getScheduledFor());
            TaskStatus result = runWithRetries(execution, lockToken);
            metrics.recordCompletion(taskName, result);
            return result;
        } finally {
            metrics.taskFinished();
            lockService.release(taskName, lockToken);
        }
    }

    private TaskStatus runWithRetries(TaskExecutionRecord execution, String lockToken) {
        long id = execution.getId();
        String taskName = execution.getTaskName();

        Optional<TaskHandler> handler = handlerRegistry.find(execution.getTaskType());
        if (handler.isEmpty()) {
            return finish(execution, TaskStatus.FAILED, "No handler for task type " + execution.getTaskType(), null);
        }
        TaskParams params;
        try {
            params = objectMapper.readValue(execution.getParamsJson(), TaskParams.class);
        } catch (JsonProcessingException e) {
            return finish(execution, TaskStatus.FAILED, "Unreadable task params: " + e.getOriginalMessage(), null);
        }

        TaskContext context = new TaskContext(id, taskName, execution.getTaskType(), params,
                execution.getScheduledFor(), () -> checkpoint(id, taskName, lockToken));

        int retries = 0;
        while (true) {
            try {
                if (retries > 0) {
                    context.checkpoint();
                }
                String summary = handler.get().handle(context);
                log.info("Task {} succeeded (execution {}, attempt {}): {}", taskName, id, context.getAttempt(), summary);
                return finish(execution, TaskStatus.SUCCEEDED, null, summary);
            } catch (TaskCancelledException e) {
                log.info("Task {} cancelled (execution {})", taskName, id);
                return finish(execution, TaskStatus.CANCELLED, e.getMessage(), null);
            } catch (RuntimeException e) {
                String error = describe(e);
                if (!isRetryable(e)) {
                    log.error("Task {} failed with a non-retryable error (execution {}): {}", taskName, id, error, e);
                    return finish(execution, TaskStatus.FAILED, error, null);
                }
                if (retries >= workerConfig.getMaxRetries()) {
                    log.error("Task {} failed after {} retries (execution {}): {}", taskName, retries, id, error);
                    return finish(execution, TaskStatus.FAILED, error, null);
                }

                retries++;
                int retryCount = retries;
                Duration wait = Backoff.expJitter(retries - 1, workerConfig.getBackoffBase(),
                        workerConfig.getBackoffCap(), workerConfig.getJitterRatio());
                tx.execute(status -> executionRepository.recordRetry(id, retryCount, truncate(error, MAX_ERROR_LENGTH)));
                metrics.recordRetry(taskName);
                log.warn("Task {} attempt {} failed ({}), retry {}/{} in {} ms",
                        taskName, context.getAttempt(), error, retries, workerConfig.getMaxRetries(), wait.toMillis());

                if (!sleep(wait)) {
                    return finish(execution, TaskStatus.CANCELLED, "Interrupted during backoff", null);
                }
                context.nextAttempt();
            }
        }
    }

    private void checkpoint(long id, String taskName, String lockToken) {
        if (Boolean.TRUE.equals(executionRepository.isCancelRequested(id))) {
            throw new TaskCancelledException(taskName, id);
        }
        if (!lockService.renew(taskName, lockToken)) {
            log.warn("Lock of {} lost while execution {} was running", taskName, id);
        }
    }

    private TaskStatus finish(TaskExecutionRecord execution, TaskStatus status, String error, String summary) {
        Integer updated = tx.execute(s -> executionRepository.finishIfInFlight(execution.getId(), status,
                truncate(error, MAX_ERROR_LENGTH), truncate(summary, MAX_SUMMARY_LENGTH), clock.instant()));
        if (updated == null || updated == 0) {
            log.warn("Execution {} of {} was finished elsewhere before it could be marked {}",
                    execution.getId(), execution.getTaskName(), status);
        }
        return status;
    }

    static boolean isRetryable(Throwable e) {
        if (e instanceof JobFeedException jfe) {
            return jfe.isRetryable();
        }
        // Timeouts, storage hiccups and other unexpected failures are treated as transient
        return true;
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    private static boolean sleep(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Backoff interrupted");
            return false;
        }
    }
}
