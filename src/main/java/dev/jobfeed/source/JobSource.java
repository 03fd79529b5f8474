package dev.jobfeed.source;

import dev.jobfeed.model.SearchQuery;
import dev.jobfeed.model.SourcePage;
import reactor.core.publisher.Mono;

/**
 * Interface for external job-listing providers.
 * Each provider implements this interface and is looked up by {@link #getName()}.
 */
public interface JobSource {

    /**
     * Name of this source as used in schedule configuration and stored postings (e.g. "jsearch").
     */
    String getName();

    /**
     * Fetch one page of results.
     *
     * @param query     keywords and location
     * @param pageToken continuation token from the previous page, null for the first page
     * @param pageSize  requested number of results, providers may cap it
     * @return the page; errors are {@link SourceUnavailableException} or {@link SourceFormatException}
     */
    Mono<SourcePage> fetchPage(SearchQuery query, String pageToken, int pageSize);

    /**
     * Check if this source is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
