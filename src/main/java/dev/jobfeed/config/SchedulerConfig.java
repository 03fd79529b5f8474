package dev.jobfeed.config;

import dev.jobfeed.model.TaskParams;
import dev.jobfeed.model.TaskType;
import dev.jobfeed.scheduler.CatchUpPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler settings and the static schedule definitions.
 * Loaded from application.yml under 'scheduler' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerConfig {

    private boolean enabled = true;
    private String zone = "UTC";

    /**
     * Occurrences older than this when first seen count as missed and follow {@link #catchUp}.
     */
    private Duration misfireThreshold = Duration.ofMinutes(1);
    private CatchUpPolicy catchUp = CatchUpPolicy.FIRE_ONCE;

    private List<ScheduleProperties> schedules = new ArrayList<>();

    @Data
    public static class ScheduleProperties {
        private String name;
        private String cron;
        private String zone;
        private TaskType task = TaskType.FETCH_JOBS;
        private List<String> sources = new ArrayList<>();
        private List<String> keywords = new ArrayList<>();
        private List<String> locations = new ArrayList<>();
        private Integer pageSize;
        private Integer maxPages;
        private Integer retentionDays;

        public TaskParams toParams() {
            return TaskParams.builder()
                    .sources(sources)
                    .keywords(keywords)
                    .locations(locations)
                    .pageSize(pageSize)
                    .maxPages(maxPages)
                    .retentionDays(retentionDays)
                    .build();
        }
    }
}
