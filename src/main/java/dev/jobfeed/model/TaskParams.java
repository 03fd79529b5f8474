package dev.jobfeed.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters handed to a task handler. Serialized as JSON on the execution record.
 *
 * @param sources       source names to query (fetch tasks)
 * @param keywords      search keywords (fetch tasks)
 * @param locations     locations combined with every keyword; empty means no location filter
 * @param pageSize      requested page size
 * @param maxPages      upper bound of pages fetched per (source, query)
 * @param retentionDays retention window for cleanup tasks
 */
@Builder(toBuilder = true)
public record TaskParams(
        List<String> sources,
        List<String> keywords,
        List<String> locations,
        Integer pageSize,
        Integer maxPages,
        Integer retentionDays) {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int DEFAULT_MAX_PAGES = 5;
    public static final int DEFAULT_RETENTION_DAYS = 30;

    public TaskParams {
        sources = sources == null ? List.of() : List.copyOf(sources);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public int effectivePageSize() {
        return pageSize != null && pageSize > 0 ? pageSize : DEFAULT_PAGE_SIZE;
    }

    public int effectiveMaxPages() {
        return maxPages != null && maxPages > 0 ? maxPages : DEFAULT_MAX_PAGES;
    }

    public int effectiveRetentionDays() {
        return retentionDays != null && retentionDays > 0 ? retentionDays : DEFAULT_RETENTION_DAYS;
    }

    /**
     * Every keyword combined with every location (or with no location when none are set).
     */
    public List<SearchQuery> queries() {
        List<SearchQuery> queries = new ArrayList<>();
        for (String keyword : keywords) {
            if (locations.isEmpty()) {
                queries.add(new SearchQuery(keyword, null));
            } else {
                for (String location : locations) {
                    queries.add(new SearchQuery(keyword, location));
                }
            }
        }
        return queries;
    }
}
