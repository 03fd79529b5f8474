package dev.jobfeed.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.jobfeed.config.SourcesConfig;
import dev.jobfeed.metrics.IngestionMetrics;
import dev.jobfeed.model.NormalizedJob;
import dev.jobfeed.model.SearchQuery;
import dev.jobfeed.model.SourcePage;
import dev.jobfeed.source.SalaryRange;
import dev.jobfeed.source.SourceFormatException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Google Jobs results through SerpApi. Pagination uses the opaque {@code next_page_token}.
 */
@Slf4j
@Component
public class SerpApiGoogleJobsSource extends AbstractJobSource {

    static final String DEFAULT_BASE_URL = "https://serpapi.com";

    private static final String NO_RESULTS = "hasn't returned any results";

    public SerpApiGoogleJobsSource(WebClient.Builder webClientBuilder, IngestionMetrics metrics,
                                   ObjectMapper objectMapper, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, objectMapper, sourcesConfig.getSerpapi());
    }

    @Override
    public String getName() {
        return "serpapi";
    }

    @Override
    protected URI pageUri(SearchQuery query, String pageToken, int pageSize) {
        String baseUrl = isBlank(settings.getBaseUrl()) ? DEFAULT_BASE_URL : settings.getBaseUrl();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/search.json")
                .queryParam("engine", "google_jobs")
                .queryParam("q", query.keywords())
                .queryParam("hl", "en")
                .queryParam("api_key", settings.getApiKey());
        if (query.hasLocation()) {
            builder.queryParam("location", query.location());
        }
        if (!isBlank(pageToken)) {
            builder.queryParam("next_page_token", pageToken);
        }
        return builder.build().encode().toUri();
    }

    @Override
    protected SourcePage parsePage(String body, SearchQuery query, String pageToken, int pageSize) {
        SerpApiResponse response = readJson(body, SerpApiResponse.class);

        if (response.getError() != null) {
            if (response.getError().contains(NO_RESULTS)) {
                return SourcePage.last(List.of());
            }
            throw new SourceFormatException(getName(), "error response: " + response.getError(), body);
        }
        if (response.getJobsResults() == null) {
            throw new SourceFormatException(getName(), "response has no 'jobs_results' array", body);
        }

        List<NormalizedJob> jobs = response.getJobsResults().stream()
                .filter(job -> !isBlank(job.getJobId()) && !isBlank(job.getTitle()))
                .limit(pageSize)
                .map(this::mapToJob)
                .toList();

        String next = response.getSerpapiPagination() != null
                ? response.getSerpapiPagination().getNextPageToken()
                : null;
        if (jobs.isEmpty() || isBlank(next)) {
            return SourcePage.last(jobs);
        }
        return new SourcePage(jobs, next);
    }

    private NormalizedJob mapToJob(SerpApiJob job) {
        DetectedExtensions ext = job.getDetectedExtensions() != null ? job.getDetectedExtensions() : new DetectedExtensions();
        SalaryRange salary = SalaryRange.parse(ext.getSalary());
        String applyUrl = job.getApplyOptions() != null && !job.getApplyOptions().isEmpty()
                ? job.getApplyOptions().get(0).getLink()
                : job.getShareLink();

        return baseJob()
                .externalId(job.getJobId())
                .title(job.getTitle())
                .company(job.getCompanyName())
                .location(job.getLocation())
                .description(stripHtml(job.getDescription()))
                .applyUrl(applyUrl)
                .employmentType(employmentType(ext.getScheduleType(), job))
                .salaryMin(salary.min())
                .salaryMax(salary.max())
                .salaryCurrency(salary.currency())
                .salaryText(ext.getSalary())
                .build();
    }

    /**
     * Schedule type when Google detected one, otherwise a guess from the title.
     */
    static String employmentType(String scheduleType, SerpApiJob job) {
        String hint = !isBlank(scheduleType) ? scheduleType : job.getTitle();
        String lower = hint == null ? "" : hint.toLowerCase(Locale.ROOT);
        if (lower.contains("part")) return "Part-time";
        if (lower.contains("contract")) return "Contract";
        if (lower.contains("intern")) return "Internship";
        if (lower.contains("full") || isBlank(scheduleType)) return "Full-time";
        return scheduleType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class SerpApiResponse {
        private String error;
        private List<SerpApiJob> jobsResults;
        private Pagination serpapiPagination;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class Pagination {
        private String nextPageToken;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class SerpApiJob {
        private String jobId;
        private String title;
        private String companyName;
        private String location;
        private String description;
        private String shareLink;
        private DetectedExtensions detectedExtensions;
        private List<ApplyOption> applyOptions;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class DetectedExtensions {
        private String salary;
        private String scheduleType;
        private String postedAt;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ApplyOption {
        private String title;
        private String link;
    }
}
