package dev.jobfeed;

import dev.jobfeed.model.TaskStatus;
import dev.jobfeed.queue.TaskHandle;
import dev.jobfeed.queue.TaskQueue;
import dev.jobfeed.scheduler.ScheduleRegistry;
import dev.jobfeed.scheduler.ScheduledTaskDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs one schedule's task immediately, through the regular queue so it still takes the task lock
 * and leaves an execution record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OneShotRunner {

  private static final String SEPARATOR = "========================================";

  private final ScheduleRegistry scheduleRegistry;
  private final TaskQueue taskQueue;
  private final Clock clock;

  @Value("${job-feed.one-shot-timeout:PT2H}")
  private Duration timeout;

  @Value("${job-feed.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Executes the task of the named schedule and waits for it.
   *
   * @return process exit status, 0 when the execution succeeded
   */
  public int execute(String scheduleName) {
    log.info(SEPARATOR);
    log.info("Job Feed one-shot run: {}", scheduleName);
    log.info(SEPARATOR);

    Optional<ScheduledTaskDefinition> definition = scheduleRegistry.find(scheduleName);
    if (definition.isEmpty()) {
      log.error("Unknown schedule '{}', configured: {}", scheduleName,
          scheduleRegistry.all().stream().map(ScheduledTaskDefinition::name).toList());
      return 1;
    }

    TaskHandle handle = taskQueue.enqueue(definition.get(), clock.instant());
    if (!handle.isAccepted()) {
      log.error("{} not started: {}", scheduleName, handle.getRejectionReason());
      return 1;
    }

    TaskStatus status;
    try {
      status = handle.await(timeout);
    } catch (TimeoutException e) {
      log.error("{} did not finish within {}, requesting cancellation", scheduleName, timeout);
      handle.cancel();
      return 1;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for {}", scheduleName);
      return 1;
    }

    log.info(SEPARATOR);
    log.info("Job Feed one-shot run finished: {} -> {}", handle, status);
    log.info(SEPARATOR);

    handleMetricsWait();
    return status == TaskStatus.SUCCEEDED ? 0 : 1;
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
