package dev.jobfeed;

/**
 * Base class for failures raised by the ingestion pipeline.
 * The worker pool consults {@link #isRetryable()} to decide whether an attempt is repeated.
 */
public abstract class JobFeedException extends RuntimeException {

    protected JobFeedException(String message) {
        super(message);
    }

    protected JobFeedException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
