package dev.jobfeed.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Worker pool, retry and locking settings.
 * Loaded from application.yml under 'worker' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "worker")
public class WorkerConfig {

    private int poolSize = 4;

    private int maxRetries = 3;
    private Duration backoffBase = Duration.ofSeconds(2);
    private Duration backoffCap = Duration.ofMinutes(5);
    private double jitterRatio = 0.2;

    /**
     * Lease of the per-task lock. Renewed at every handler checkpoint; a crashed worker's lock frees itself after this.
     * Must exceed {@link #backoffCap} and the longest stretch between checkpoints.
     */
    private Duration lockLease = Duration.ofMinutes(10);
}
