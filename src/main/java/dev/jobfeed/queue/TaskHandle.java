package dev.jobfeed.queue;

import dev.jobfeed.model.TaskStatus;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Result of {@link TaskQueue#enqueue}. A rejected handle has no execution id and is already complete.
 */
@Getter
public class TaskHandle {

    private final Long executionId;
    private final String taskName;
    private final Instant scheduledFor;
    private final boolean accepted;
    private final String rejectionReason;
    private final CompletableFuture<TaskStatus> completion;

    @Getter(AccessLevel.NONE)
    private final TaskQueue queue;

    private TaskHandle(Long executionId, String taskName, Instant scheduledFor, boolean accepted,
                       String rejectionReason, CompletableFuture<TaskStatus> completion, TaskQueue queue) {
        this.executionId = executionId;
        this.taskName = taskName;
        this.scheduledFor = scheduledFor;
        this.accepted = accepted;
        this.rejectionReason = rejectionReason;
        this.completion = completion;
        this.queue = queue;
    }

    static TaskHandle accepted(long executionId, String taskName, Instant scheduledFor,
                               CompletableFuture<TaskStatus> completion, TaskQueue queue) {
        return new TaskHandle(executionId, taskName, scheduledFor, true, null, completion, queue);
    }

    static TaskHandle rejected(String taskName, Instant scheduledFor, String reason) {
        return new TaskHandle(null, taskName, scheduledFor, false, reason,
                CompletableFuture.completedFuture(null), null);
    }

    /**
     * Request cooperative cancellation.
     *
     * @return false when the handle was rejected or the execution already finished
     */
    public boolean cancel() {
        return accepted && queue.cancel(executionId);
    }

    /**
     * Block until the execution reaches a terminal status.
     *
     * @return the terminal status, or null for a rejected handle
     */
    public TaskStatus await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Execution " + executionId + " of " + taskName + " crashed", e.getCause());
        }
    }

    @Override
    public String toString() {
        return accepted
                ? taskName + "#" + executionId + "@" + scheduledFor
                : taskName + "@" + scheduledFor + " (rejected: " + rejectionReason + ")";
    }
}
