package dev.jobfeed.service;

import dev.jobfeed.model.TaskType;
import dev.jobfeed.queue.TaskContext;
import dev.jobfeed.queue.TaskHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Soft-deletes postings that no fetch refreshed within the retention window.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleJobCleanupTaskHandler implements TaskHandler {

    private final JobUpsertService upsertService;
    private final Clock clock;

    @Override
    public TaskType type() {
        return TaskType.DEACTIVATE_STALE;
    }

    @Override
    public String handle(TaskContext context) {
        int retentionDays = context.getParams().effectiveRetentionDays();
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        context.checkpoint();

        int deactivated = upsertService.deactivateStale(cutoff);
        log.info("Cleanup task {}: {} postings older than {} days deactivated, {} still active",
                context.getTaskName(), deactivated, retentionDays, upsertService.getActivePostings());
        return "deactivated=" + deactivated + " retentionDays=" + retentionDays;
    }
}
