package dev.jobfeed.scheduler;

import dev.jobfeed.JobFeedException;

/**
 * Raised when a schedule definition cannot be registered (malformed cron, blank or duplicate name).
 * Treated as a configuration bug: fatal at startup.
 */
public class InvalidScheduleException extends JobFeedException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
