package dev.jobfeed.model;

/**
 * Outcome of merging one batch of candidates.
 */
public record UpsertResult(int inserted, int updated, int skipped) {

    public static final UpsertResult EMPTY = new UpsertResult(0, 0, 0);
}
