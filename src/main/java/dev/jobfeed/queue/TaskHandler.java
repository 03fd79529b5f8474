package dev.jobfeed.queue;

import dev.jobfeed.model.TaskType;

/**
 * Executes one attempt of a task. Implementations hold no state between runs; everything an attempt
 * needs comes from the {@link TaskContext}.
 */
public interface TaskHandler {

    TaskType type();

    /**
     * Run one attempt.
     *
     * @return a short human-readable summary stored on the execution record
     * @throws dev.jobfeed.JobFeedException when the attempt fails; {@code isRetryable()} decides whether it is repeated
     */
    String handle(TaskContext context);
}
