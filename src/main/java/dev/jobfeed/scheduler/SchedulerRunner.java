package dev.jobfeed.scheduler;

import dev.jobfeed.config.SchedulerConfig;
import dev.jobfeed.entity.ScheduleState;
import dev.jobfeed.queue.TaskHandle;
import dev.jobfeed.queue.TaskQueue;
import dev.jobfeed.repository.ScheduleStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fires due schedules. Each schedule keeps a persisted cursor ({@link ScheduleState#getNextFireAt()});
 * a tick advances it with a compare-and-set update and only the winner enqueues, so repeated or
 * concurrent ticks enqueue an occurrence once.
 */
@Slf4j
@Component
public class SchedulerRunner {

    private final ScheduleRegistry scheduleRegistry;
    private final ScheduleStateRepository stateRepository;
    private final TaskQueue taskQueue;
    private final SchedulerConfig schedulerConfig;
    private final Clock clock;
    private final TransactionTemplate tx;

    public SchedulerRunner(ScheduleRegistry scheduleRegistry, ScheduleStateRepository stateRepository,
                           TaskQueue taskQueue, SchedulerConfig schedulerConfig,
                           PlatformTransactionManager txManager, Clock clock) {
        this.scheduleRegistry = scheduleRegistry;
        this.stateRepository = stateRepository;
        this.taskQueue = taskQueue;
        this.schedulerConfig = schedulerConfig;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Scheduled(fixedDelayString = "${scheduler.tick-interval-ms:5000}")
    public void scheduledTick() {
        if (!schedulerConfig.isEnabled()) {
            return;
        }
        tick(clock.instant());
    }

    /**
     * Enqueue every schedule whose next fire time is at or before {@code now} and advance its cursor.
     * A failure of one schedule is logged and does not affect the others.
     *
     * @return handles of the executions enqueued by this call
     */
    public List<TaskHandle> tick(Instant now) {
        List<TaskHandle> fired = new ArrayList<>();
        for (ScheduledTaskDefinition definition : scheduleRegistry.all()) {
            try {
                tickSchedule(definition, now).ifPresent(fired::add);
            } catch (RuntimeException e) {
                log.error("Schedule {} failed to tick at {}: {}", definition.name(), now, e.getMessage(), e);
            }
        }
        return fired;
    }

    private Optional<TaskHandle> tickSchedule(ScheduledTaskDefinition definition, Instant now) {
        ScheduleState state = loadState(definition, now);
        Instant due = state.getNextFireAt();
        if (due.isAfter(now)) {
            return Optional.empty();
        }

        // Most recent occurrence not after now; anything older was missed and is never replayed
        Instant occurrence = due;
        Instant following = definition.nextAfter(occurrence);
        while (following != null && !following.isAfter(now)) {
            occurrence = following;
            following = definition.nextAfter(occurrence);
        }
        if (following == null) {
            log.warn("Schedule {} has no occurrence after {}, leaving it idle", definition.name(), occurrence);
            return Optional.empty();
        }

        Duration lateness = Duration.between(occurrence, now);
        boolean missed = lateness.compareTo(schedulerConfig.getMisfireThreshold()) > 0;
        boolean fire = !missed || schedulerConfig.getCatchUp() == CatchUpPolicy.FIRE_ONCE;

        Instant nextFireAt = following;
        Instant firedAt = fire ? now : state.getLastFiredAt();
        Integer advanced = tx.execute(status ->
                stateRepository.advanceIf(definition.name(), due, nextFireAt, firedAt));
        if (advanced == null || advanced == 0) {
            log.debug("Schedule {} occurrence {} already handled by another tick", definition.name(), occurrence);
            return Optional.empty();
        }

        if (!fire) {
            log.warn("Schedule {} missed occurrence {} ({} late), skipped by catch-up policy; next at {}",
                    definition.name(), occurrence, lateness, nextFireAt);
            return Optional.empty();
        }
        if (missed) {
            log.info("Schedule {} catching up missed occurrence {} ({} late)", definition.name(), occurrence, lateness);
        }

        TaskHandle handle;
        try {
            handle = taskQueue.enqueue(definition, occurrence);
        } catch (RuntimeException e) {
            // Hand the occurrence back so the next tick retries it
            Instant lastFiredAt = state.getLastFiredAt();
            Integer restored = tx.execute(status ->
                    stateRepository.advanceIf(definition.name(), nextFireAt, due, lastFiredAt));
            log.warn("Schedule {} failed to enqueue occurrence {}, cursor {}", definition.name(), occurrence,
                    restored != null && restored > 0 ? "restored to " + due : "already moved by another tick");
            throw e;
        }
        log.info("Schedule {} fired for {} -> {}; next at {}", definition.name(), occurrence,
                handle.isAccepted() ? "execution " + handle.getExecutionId() : "rejected (" + handle.getRejectionReason() + ")",
                nextFireAt);
        return handle.isAccepted() ? Optional.of(handle) : Optional.empty();
    }

    /**
     * Load the cursor, creating it on first sight and recomputing it when the configured cron changed.
     * A new cursor starts at the first occurrence after {@code now - misfireThreshold}, so an occurrence
     * that is just due when the service starts still fires.
     */
    private ScheduleState loadState(ScheduledTaskDefinition definition, Instant now) {
        Optional<ScheduleState> existing = stateRepository.findById(definition.name());
        Instant start = definition.nextAfter(now.minus(schedulerConfig.getMisfireThreshold()));

        if (existing.isEmpty()) {
            ScheduleState created = ScheduleState.builder()
                    .name(definition.name())
                    .cron(definition.cron())
                    .nextFireAt(start)
                    .build();
            try {
                tx.executeWithoutResult(status -> stateRepository.saveAndFlush(created));
                log.info("Schedule {} initialised, first occurrence {}", definition.name(), start);
                return created;
            } catch (DataIntegrityViolationException e) {
                log.debug("Schedule state {} created concurrently", definition.name());
                return stateRepository.findById(definition.name()).orElseThrow(() -> e);
            }
        }

        ScheduleState state = existing.get();
        if (!definition.cron().equals(state.getCron())) {
            log.info("Schedule {} cron changed from '{}' to '{}', next occurrence {}",
                    definition.name(), state.getCron(), definition.cron(), start);
            tx.execute(status -> stateRepository.reset(definition.name(), definition.cron(), start));
            state.setCron(definition.cron());
            state.setNextFireAt(start);
        }
        return state;
    }
}
