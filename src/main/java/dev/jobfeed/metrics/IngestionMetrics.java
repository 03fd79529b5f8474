package dev.jobfeed.metrics;

import dev.jobfeed.model.TaskStatus;
import dev.jobfeed.model.UpsertResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for scheduling, task execution and ingestion.
 */
@Component
public class IngestionMetrics {

    private static final String TAG_SOURCE = "source";
    private static final String TAG_TASK = "task";
    private final MeterRegistry registry;

    // Counters
    private final Counter postingsInsertedCounter;
    private final Counter postingsUpdatedCounter;
    private final Counter postingsSkippedCounter;
    private final Counter postingsDeactivatedCounter;
    private final Counter upsertRacesCounter;

    // Timers (per source)
    private final ConcurrentHashMap<String, Timer> sourceTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger runningTasks = new AtomicInteger(0);
    private final AtomicInteger lastRunInserted = new AtomicInteger(0);
    private final AtomicInteger lastRunUpdated = new AtomicInteger(0);

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingsInsertedCounter = Counter.builder("job_feed_postings_inserted_total")
                .description("Job postings inserted by the upsert layer")
                .register(registry);

        this.postingsUpdatedCounter = Counter.builder("job_feed_postings_updated_total")
                .description("Existing job postings refreshed by the upsert layer")
                .register(registry);

        this.postingsSkippedCounter = Counter.builder("job_feed_postings_skipped_total")
                .description("Candidates rejected for missing identity or title")
                .register(registry);

        this.postingsDeactivatedCounter = Counter.builder("job_feed_postings_deactivated_total")
                .description("Postings soft-deleted by the stale cleanup")
                .register(registry);

        this.upsertRacesCounter = Counter.builder("job_feed_upsert_races_total")
                .description("Duplicate-key races resolved by retrying the upsert")
                .register(registry);

        Gauge.builder("job_feed_tasks_running", runningTasks, AtomicInteger::get)
                .description("Task executions currently running")
                .register(registry);

        Gauge.builder("job_feed_last_run_postings_inserted", lastRunInserted, AtomicInteger::get)
                .description("Postings inserted by the last fetch run")
                .register(registry);

        Gauge.builder("job_feed_last_run_postings_updated", lastRunUpdated, AtomicInteger::get)
                .description("Postings updated by the last fetch run")
                .register(registry);
    }

    /**
     * Get or create the fetch timer of a source.
     */
    public Timer getSourceTimer(String sourceName) {
        return sourceTimers.computeIfAbsent(sourceName, name ->
                Timer.builder("job_feed_source_fetch_duration")
                        .description("Time to fetch one page from a source")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    public void recordFetchLatency(String source, long latencyMs) {
        getSourceTimer(source).record(Duration.ofMillis(latencyMs));
    }

    public void recordUpsert(UpsertResult result) {
        postingsInsertedCounter.increment(result.inserted());
        postingsUpdatedCounter.increment(result.updated());
        postingsSkippedCounter.increment(result.skipped());
    }

    public void recordUpsertRace() {
        upsertRacesCounter.increment();
    }

    public void recordDeactivated(int count) {
        postingsDeactivatedCounter.increment(count);
    }

    public void incrementFetchFailures(String source, String kind) {
        Counter.builder("job_feed_fetch_failures_total")
                .tag(TAG_SOURCE, source)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementJobsFetched(String source, int count) {
        Counter.builder("job_feed_jobs_fetched_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment(count);
    }

    public void recordEnqueued(String taskName, boolean accepted) {
        Counter.builder("job_feed_tasks_enqueued_total")
                .tag(TAG_TASK, taskName)
                .tag("accepted", String.valueOf(accepted))
                .register(registry)
                .increment();
    }

    public void recordRetry(String taskName) {
        Counter.builder("job_feed_task_retries_total")
                .tag(TAG_TASK, taskName)
                .register(registry)
                .increment();
    }

    public void recordCompletion(String taskName, TaskStatus status) {
        Counter.builder("job_feed_tasks_completed_total")
                .tag(TAG_TASK, taskName)
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void taskStarted() {
        runningTasks.incrementAndGet();
    }

    public void taskFinished() {
        runningTasks.decrementAndGet();
    }

    public void updateLastRunStats(int inserted, int updated) {
        lastRunInserted.set(inserted);
        lastRunUpdated.set(updated);
    }
}
