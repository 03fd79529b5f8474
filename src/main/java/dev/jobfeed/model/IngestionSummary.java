package dev.jobfeed.model;

import lombok.Builder;
import lombok.Data;

/**
 * Totals of one fetch-task attempt.
 */
@Data
@Builder
public class IngestionSummary {
    private int queries;
    private int pages;
    private int fetched;
    private int inserted;
    private int updated;
    private int skipped;
    private int formatFailures;
    private int unavailable;

    public void add(UpsertResult result) {
        inserted += result.inserted();
        updated += result.updated();
        skipped += result.skipped();
    }

    public String describe() {
        return String.format("queries=%d pages=%d fetched=%d inserted=%d updated=%d skipped=%d formatFailures=%d unavailable=%d",
                queries, pages, fetched, inserted, updated, skipped, formatFailures, unavailable);
    }
}
