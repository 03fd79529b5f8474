package dev.jobfeed.source;

import dev.jobfeed.JobFeedException;
import lombok.Getter;

/**
 * Network, timeout or HTTP-level failure talking to a job source. Retried with backoff.
 */
@Getter
public class SourceUnavailableException extends JobFeedException {

    private final String source;

    public SourceUnavailableException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
