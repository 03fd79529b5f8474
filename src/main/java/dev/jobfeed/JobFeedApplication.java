package dev.jobfeed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Runs as a long-lived service firing the configured schedules, or with {@code --run=<schedule>}
 * executes one schedule's task synchronously and exits with 0 on success, 1 on failure.
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@RequiredArgsConstructor
public class JobFeedApplication implements CommandLineRunner {

  static final String RUN_OPTION = "--run=";

  private final OneShotRunner oneShotRunner;
  private final ExitManager exitManager;

  public static void main(String[] args) {
    SpringApplication.run(JobFeedApplication.class, args);
  }

  @Override
  public void run(String... args) {
    String schedule = oneShotSchedule(args);
    if (schedule == null) {
      log.info("Job Feed started in service mode, schedules fire from the scheduler thread");
      return;
    }

    try {
      int status = oneShotRunner.execute(schedule);
      exitManager.exit(status);
    } catch (Exception e) {
      log.error("One-shot run of {} failed: {}", schedule, e.getMessage(), e);
      exitManager.exit(1);
    }
  }

  static String oneShotSchedule(String... args) {
    if (args == null) {
      return null;
    }
    for (String arg : args) {
      if (arg != null && arg.startsWith(RUN_OPTION) && arg.length() > RUN_OPTION.length()) {
        return arg.substring(RUN_OPTION.length());
      }
    }
    return null;
  }
}
