package dev.jobfeed.queue;

import dev.jobfeed.model.TaskParams;
import dev.jobfeed.model.TaskType;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State of one execution shared by all of its attempts.
 * Handlers record finished units of work so that a retry resumes with the units that did not complete.
 */
@Getter
public class TaskContext {

    private final long executionId;
    private final String taskName;
    private final TaskType taskType;
    private final TaskParams params;
    private final Instant scheduledFor;

    @Getter(AccessLevel.NONE)
    private final Runnable checkpointHook;

    @Getter(AccessLevel.NONE)
    private final Set<String> completedUnits = ConcurrentHashMap.newKeySet();

    private volatile int attempt = 1;

    public TaskContext(long executionId, String taskName, TaskType taskType, TaskParams params,
                       Instant scheduledFor, Runnable checkpointHook) {
        this.executionId = executionId;
        this.taskName = taskName;
        this.taskType = taskType;
        this.params = params;
        this.scheduledFor = scheduledFor;
        this.checkpointHook = checkpointHook;
    }

    /**
     * A context without cancellation or lock renewal, for running a handler directly.
     */
    public static TaskContext detached(String taskName, TaskType taskType, TaskParams params, Instant scheduledFor) {
        return new TaskContext(0L, taskName, taskType, params, scheduledFor, () -> { });
    }

    /**
     * Cooperative cancellation point. Call between units of work, never in the middle of a fetch.
     * Also renews the task lock lease.
     *
     * @throws TaskCancelledException when cancellation was requested
     */
    public void checkpoint() {
        checkpointHook.run();
    }

    public boolean isCompleted(String unit) {
        return completedUnits.contains(unit);
    }

    public void markCompleted(String unit) {
        completedUnits.add(unit);
    }

    public Set<String> completedUnits() {
        return Collections.unmodifiableSet(completedUnits);
    }

    void nextAttempt() {
        attempt++;
    }
}
