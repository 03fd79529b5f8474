package dev.jobfeed.source;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up job sources by name.
 */
@Slf4j
@Component
public class SourceRegistry {

    private final Map<String, JobSource> sources;

    public SourceRegistry(List<JobSource> jobSources) {
        this.sources = jobSources.stream()
                .collect(Collectors.toMap(s -> s.getName().toLowerCase(Locale.ROOT), Function.identity()));
        log.info("Job sources registered: {}", sources.keySet());
    }

    public Optional<JobSource> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sources.get(name.toLowerCase(Locale.ROOT)));
    }

    public List<String> names() {
        return sources.keySet().stream().sorted().toList();
    }
}
