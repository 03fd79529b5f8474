package dev.jobfeed.source;

import dev.jobfeed.JobFeedException;
import lombok.Getter;

/**
 * A response was received but could not be understood. Not retried: the payload sample
 * is kept for diagnosis.
 */
@Getter
public class SourceFormatException extends JobFeedException {

    private static final int MAX_SAMPLE_LENGTH = 500;

    private final String source;
    private final String payloadSample;

    public SourceFormatException(String source, String message, String payload) {
        this(source, message, payload, null);
    }

    public SourceFormatException(String source, String message, String payload, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
        this.payloadSample = sample(payload);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

    static String sample(String payload) {
        if (payload == null) {
            return "";
        }
        return payload.length() > MAX_SAMPLE_LENGTH ? payload.substring(0, MAX_SAMPLE_LENGTH) + "..." : payload;
    }
}
