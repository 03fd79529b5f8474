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
import dev.jobfeed.source.SourceFormatException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * JSearch on RapidAPI (aggregates LinkedIn, Indeed, ZipRecruiter and Google for Jobs).
 * Pages are numbered; the continuation token is the next page number.
 */
@Slf4j
@Component
public class JSearchSource extends AbstractJobSource {

    static final String DEFAULT_BASE_URL = "https://jsearch.p.rapidapi.com";

    public JSearchSource(WebClient.Builder webClientBuilder, IngestionMetrics metrics,
                         ObjectMapper objectMapper, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, objectMapper, sourcesConfig.getJsearch());
    }

    @Override
    public String getName() {
        return "jsearch";
    }

    private String baseUrl() {
        return isBlank(settings.getBaseUrl()) ? DEFAULT_BASE_URL : settings.getBaseUrl();
    }

    @Override
    protected void addHeaders(HttpHeaders headers) {
        headers.set("X-RapidAPI-Key", settings.getApiKey());
        headers.set("X-RapidAPI-Host", URI.create(baseUrl()).getHost());
    }

    @Override
    protected URI pageUri(SearchQuery query, String pageToken, int pageSize) {
        String q = query.hasLocation() ? query.keywords() + " in " + query.location() : query.keywords();
        return UriComponentsBuilder.fromUriString(baseUrl())
                .path("/search")
                .queryParam("query", q)
                .queryParam("page", pageNumber(pageToken))
                .queryParam("num_pages", 1)
                .build()
                .encode()
                .toUri();
    }

    @Override
    protected SourcePage parsePage(String body, SearchQuery query, String pageToken, int pageSize) {
        JSearchResponse response = readJson(body, JSearchResponse.class);
        if (response.getData() == null) {
            throw new SourceFormatException(getName(), "response has no 'data' array (status=" + response.getStatus() + ")", body);
        }

        List<NormalizedJob> jobs = response.getData().stream()
                .filter(job -> !isBlank(job.getJobId()) && !isBlank(job.getJobTitle()))
                .limit(pageSize)
                .map(this::mapToJob)
                .toList();

        if (response.getData().isEmpty()) {
            return SourcePage.last(jobs);
        }
        return new SourcePage(jobs, String.valueOf(pageNumber(pageToken) + 1));
    }

    private int pageNumber(String pageToken) {
        if (isBlank(pageToken)) {
            return 1;
        }
        try {
            return Integer.parseInt(pageToken);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid JSearch page token: " + pageToken, e);
        }
    }

    private NormalizedJob mapToJob(JSearchJob job) {
        String location = Boolean.TRUE.equals(job.getJobIsRemote())
                ? joinNonBlank(", ", "Remote", job.getJobCountry())
                : joinNonBlank(", ", job.getJobCity(), job.getJobState(), job.getJobCountry());

        Long salaryMin = toLong(job.getJobMinSalary());
        Long salaryMax = toLong(job.getJobMaxSalary());

        return baseJob()
                .externalId(job.getJobId())
                .title(job.getJobTitle())
                .company(job.getEmployerName())
                .location(location)
                .description(stripHtml(job.getJobDescription()))
                .applyUrl(job.getJobApplyLink())
                .employmentType(job.getJobEmploymentType())
                .salaryMin(salaryMin)
                .salaryMax(salaryMax)
                .salaryCurrency(job.getJobSalaryCurrency())
                .salaryText(salaryText(salaryMin, salaryMax, job.getJobSalaryCurrency(), job.getJobSalaryPeriod()))
                .postedAt(parseInstant(job.getJobPostedAtDatetimeUtc()))
                .build();
    }

    /**
     * Render the structured salary fields as display text, e.g. "USD 90000-120000 per YEAR".
     * Returns null when the posting carries no amount.
     */
    static String salaryText(Long min, Long max, String currency, String period) {
        if (min == null && max == null) {
            return null;
        }
        String amount;
        if (min != null && max != null && !min.equals(max)) {
            amount = min + "-" + max;
        } else if (min != null) {
            amount = max == null ? "from " + min : String.valueOf(min);
        } else {
            amount = "up to " + max;
        }
        String text = isBlank(currency) ? amount : currency.trim() + " " + amount;
        return isBlank(period) ? text : text + " per " + period.trim();
    }

    private static Long toLong(Double value) {
        return value == null ? null : Math.round(value);
    }

    private Instant parseInstant(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("{} - unparseable posting date '{}'", getName(), value);
            return null;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JSearchResponse {
        private String status;
        private List<JSearchJob> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class JSearchJob {
        private String jobId;
        private String jobTitle;
        private String employerName;
        private String jobDescription;
        private String jobCity;
        private String jobState;
        private String jobCountry;
        private Boolean jobIsRemote;
        private String jobEmploymentType;
        private Double jobMinSalary;
        private Double jobMaxSalary;
        private String jobSalaryCurrency;
        private String jobSalaryPeriod;
        private String jobApplyLink;
        private String jobPostedAtDatetimeUtc;
    }
}
