package dev.jobfeed.model;

import java.util.List;

/**
 * One page of results. {@code nextPageToken} is null once the source has no more results.
 */
public record SourcePage(List<NormalizedJob> jobs, String nextPageToken) {

    public static SourcePage last(List<NormalizedJob> jobs) {
        return new SourcePage(jobs, null);
    }

    public boolean isLast() {
        return nextPageToken == null;
    }
}
