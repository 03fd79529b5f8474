package dev.jobfeed.service;

import dev.jobfeed.metrics.IngestionMetrics;
import dev.jobfeed.model.IngestionSummary;
import dev.jobfeed.model.SearchQuery;
import dev.jobfeed.model.SourcePage;
import dev.jobfeed.model.TaskParams;
import dev.jobfeed.model.TaskType;
import dev.jobfeed.model.UpsertResult;
import dev.jobfeed.queue.TaskContext;
import dev.jobfeed.queue.TaskHandler;
import dev.jobfeed.source.JobSource;
import dev.jobfeed.source.SourceFormatException;
import dev.jobfeed.source.SourceRegistry;
import dev.jobfeed.source.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches postings for every (source, query) unit of a task and upserts them page by page.
 * <p>
 * A malformed response aborts only its unit. Units whose source is unavailable are collected and,
 * once every other unit was processed, fail the attempt so the worker retries it; completed units are
 * remembered in the {@link TaskContext} and skipped by the retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobFetchTaskHandler implements TaskHandler {

    private static final String SEPARATOR = "========================================";

    private final SourceRegistry sourceRegistry;
    private final JobUpsertService upsertService;
    private final IngestionMetrics metrics;

    @Override
    public TaskType type() {
        return TaskType.FETCH_JOBS;
    }

    @Override
    public String handle(TaskContext context) {
        TaskParams params = context.getParams();
        List<JobSource> sources = resolveSources(params);
        List<SearchQuery> queries = params.queries();

        log.info(SEPARATOR);
        log.info("Fetch task {} (attempt {}): {} sources x {} queries, {} units already done",
                context.getTaskName(), context.getAttempt(), sources.size(), queries.size(),
                context.completedUnits().size());
        log.info(SEPARATOR);

        IngestionSummary summary = IngestionSummary.builder().queries(queries.size()).build();
        List<SourceUnavailableException> unavailable = new ArrayList<>();

        for (JobSource source : sources) {
            for (SearchQuery query : queries) {
                String unit = unitKey(source, query);
                if (context.isCompleted(unit)) {
                    continue;
                }
                context.checkpoint();
                try {
                    fetchUnit(source, query, params, summary);
                    context.markCompleted(unit);
                } catch (SourceFormatException e) {
                    // Retrying cannot fix a payload we do not understand
                    summary.setFormatFailures(summary.getFormatFailures() + 1);
                    context.markCompleted(unit);
                    log.error("{} - malformed response for '{}', skipping: {} | payload: {}",
                            source.getName(), query, e.getMessage(), e.getPayloadSample());
                } catch (SourceUnavailableException e) {
                    summary.setUnavailable(summary.getUnavailable() + 1);
                    unavailable.add(e);
                    log.warn("{} - unavailable for '{}': {}", source.getName(), query, e.getMessage());
                }
            }
        }

        metrics.updateLastRunStats(summary.getInserted(), summary.getUpdated());
        log.info("Fetch task {} attempt {} done: {}", context.getTaskName(), context.getAttempt(), summary.describe());

        if (!unavailable.isEmpty()) {
            SourceUnavailableException first = unavailable.get(0);
            throw new SourceUnavailableException(first.getSource(),
                    unavailable.size() + " fetch units unavailable, first: " + first.getMessage(), first);
        }
        return summary.describe();
    }

    /**
     * Page through one (source, query) pair, upserting each page as it arrives.
     */
    private void fetchUnit(JobSource source, SearchQuery query, TaskParams params, IngestionSummary summary) {
        String token = null;
        for (int page = 1; page <= params.effectiveMaxPages(); page++) {
            SourcePage result = source.fetchPage(query, token, params.effectivePageSize()).block();
            if (result == null || result.jobs().isEmpty()) {
                break;
            }
            summary.setPages(summary.getPages() + 1);
            summary.setFetched(summary.getFetched() + result.jobs().size());

            UpsertResult upserted = upsertService.upsert(result.jobs());
            summary.add(upserted);
            log.debug("{} - '{}' page {}: {} jobs, {} new, {} updated", source.getName(), query, page,
                    result.jobs().size(), upserted.inserted(), upserted.updated());

            if (result.isLast()) {
                break;
            }
            token = result.nextPageToken();
        }
    }

    private List<JobSource> resolveSources(TaskParams params) {
        List<String> names = params.sources().isEmpty() ? sourceRegistry.names() : params.sources();
        List<JobSource> resolved = new ArrayList<>();
        for (String name : names) {
            Optional<JobSource> source = sourceRegistry.find(name);
            if (source.isEmpty()) {
                log.warn("Unknown job source '{}', known sources: {}", name, sourceRegistry.names());
            } else if (!source.get().isEnabled()) {
                log.info("Source {} is disabled or has no API key, skipping", name);
            } else {
                resolved.add(source.get());
            }
        }
        return resolved;
    }

    private static String unitKey(JobSource source, SearchQuery query) {
        return source.getName() + "|" + query.keywords() + "|" + (query.hasLocation() ? query.location() : "");
    }
}
