package dev.jobfeed;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Ends the process after a one-shot run, closing the Spring context first so the worker pool
 * and datasource shut down cleanly. Does nothing under a test runner.
 */
@Component
@RequiredArgsConstructor
public class ExitManager {

  private final ApplicationContext context;

  public void exit(int status) {
    if (!isTest()) {
      System.exit(SpringApplication.exit(context, () -> status));
    }
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
