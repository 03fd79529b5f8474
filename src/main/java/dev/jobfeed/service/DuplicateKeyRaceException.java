package dev.jobfeed.service;

import dev.jobfeed.JobFeedException;

/**
 * A concurrent insert of the same (source, externalId) won twice in a row.
 */
public class DuplicateKeyRaceException extends JobFeedException {

    public DuplicateKeyRaceException(String source, String externalId, Throwable cause) {
        super("Upsert raced twice for " + source + "/" + externalId, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
