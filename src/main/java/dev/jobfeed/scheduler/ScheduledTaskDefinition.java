package dev.jobfeed.scheduler;

import dev.jobfeed.model.TaskParams;
import dev.jobfeed.model.TaskType;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * An immutable named recurring trigger.
 *
 * @param name       unique schedule name, also the task name used for locking
 * @param cron       the recurrence expression as configured
 * @param expression parsed form of {@code cron}
 * @param zone       zone the expression is evaluated in
 * @param taskType   operation triggered on each occurrence
 * @param params     parameters handed to the task
 */
public record ScheduledTaskDefinition(
        String name,
        String cron,
        CronExpression expression,
        ZoneId zone,
        TaskType taskType,
        TaskParams params) {

    /**
     * First occurrence strictly after {@code instant}, or null when the expression never fires again.
     */
    public Instant nextAfter(Instant instant) {
        ZonedDateTime next = expression.next(instant.atZone(zone));
        return next != null ? next.toInstant() : null;
    }
}
