package dev.jobfeed.queue;

import dev.jobfeed.JobFeedException;

public class TaskCancelledException extends JobFeedException {

    public TaskCancelledException(String taskName, long executionId) {
        super("Task " + taskName + " (execution " + executionId + ") was cancelled");
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
