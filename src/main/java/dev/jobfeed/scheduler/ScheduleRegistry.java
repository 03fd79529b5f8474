package dev.jobfeed.scheduler;

import dev.jobfeed.config.SchedulerConfig;
import dev.jobfeed.model.TaskParams;
import dev.jobfeed.model.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the schedule definitions. Schedules configured under {@code scheduler.schedules} are
 * registered at startup; an invalid definition aborts startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleRegistry {

    private final SchedulerConfig schedulerConfig;

    private final Map<String, ScheduledTaskDefinition> schedules = new LinkedHashMap<>();

    @PostConstruct
    void registerConfiguredSchedules() {
        for (SchedulerConfig.ScheduleProperties schedule : schedulerConfig.getSchedules()) {
            String zone = schedule.getZone() != null ? schedule.getZone() : schedulerConfig.getZone();
            registerSchedule(schedule.getName(), schedule.getCron(), zone, schedule.getTask(), schedule.toParams());
        }
        log.info("Registered {} schedules: {}", schedules.size(), schedules.keySet());
    }

    /**
     * Validate and register a schedule.
     *
     * @param recurrenceExpr six-field cron expression, seconds first
     * @throws InvalidScheduleException on a blank or duplicate name, a malformed expression or zone,
     *                                  an expression that never fires, or a fetch task without keywords
     */
    public synchronized ScheduledTaskDefinition registerSchedule(String name, String recurrenceExpr, String zone,
                                                                 TaskType taskType, TaskParams params) {
        if (name == null || name.isBlank()) {
            throw new InvalidScheduleException("Schedule name must not be blank");
        }
        if (schedules.containsKey(name)) {
            throw new InvalidScheduleException("Schedule '" + name + "' is already registered");
        }
        if (taskType == null) {
            throw new InvalidScheduleException("Schedule '" + name + "' has no task type");
        }

        CronExpression expression;
        try {
            expression = CronExpression.parse(recurrenceExpr);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Schedule '" + name + "' has an invalid cron expression '"
                    + recurrenceExpr + "': " + e.getMessage(), e);
        }

        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(zone != null ? zone : "UTC");
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Schedule '" + name + "' has an invalid zone '" + zone + "'", e);
        }

        TaskParams effectiveParams = params != null ? params : TaskParams.builder().build();
        if (taskType == TaskType.FETCH_JOBS && effectiveParams.keywords().isEmpty()) {
            throw new InvalidScheduleException("Schedule '" + name + "' fetches jobs but has no keywords");
        }

        ScheduledTaskDefinition definition = new ScheduledTaskDefinition(
                name, recurrenceExpr, expression, zoneId, taskType, effectiveParams);
        if (definition.nextAfter(Instant.now()) == null) {
            throw new InvalidScheduleException("Schedule '" + name + "' never fires: " + recurrenceExpr);
        }

        schedules.put(name, definition);
        log.debug("Schedule {} registered: '{}' {} -> {}", name, recurrenceExpr, zoneId, taskType);
        return definition;
    }

    public synchronized Optional<ScheduledTaskDefinition> find(String name) {
        return Optional.ofNullable(schedules.get(name));
    }

    public synchronized List<ScheduledTaskDefinition> all() {
        return new ArrayList<>(schedules.values());
    }
}
