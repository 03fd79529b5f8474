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
import dev.jobfeed.util.HashUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Careerjet public search API. Careerjet has no stable job id, so the id is the hash of the job URL.
 */
@Slf4j
@Component
public class CareerjetSource extends AbstractJobSource {

    static final String DEFAULT_BASE_URL = "http://public.api.careerjet.net";

    // Careerjet rejects larger pages
    private static final int MAX_PAGE_SIZE = 99;

    public CareerjetSource(WebClient.Builder webClientBuilder, IngestionMetrics metrics,
                           ObjectMapper objectMapper, SourcesConfig sourcesConfig) {
        super(webClientBuilder, metrics, objectMapper, sourcesConfig.getCareerjet());
    }

    @Override
    public String getName() {
        return "careerjet";
    }

    /**
     * The affiliate id is optional for the public API.
     */
    @Override
    protected boolean requiresApiKey() {
        return false;
    }

    @Override
    protected URI pageUri(SearchQuery query, String pageToken, int pageSize) {
        String baseUrl = isBlank(settings.getBaseUrl()) ? DEFAULT_BASE_URL : settings.getBaseUrl();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/search")
                .queryParam("locale_code", settings.getLocale())
                .queryParam("keywords", query.keywords())
                .queryParam("page", pageNumber(pageToken))
                .queryParam("pagesize", Math.min(pageSize, MAX_PAGE_SIZE))
                .queryParam("sort", "date");
        if (query.hasLocation()) {
            builder.queryParam("location", query.location());
        }
        if (settings.hasApiKey()) {
            builder.queryParam("affid", settings.getApiKey());
        }
        return builder.build().encode().toUri();
    }

    @Override
    protected SourcePage parsePage(String body, SearchQuery query, String pageToken, int pageSize) {
        CareerjetResponse response = readJson(body, CareerjetResponse.class);

        if ("LOCATIONS".equals(response.getType())) {
            // Ambiguous location, Careerjet answers with suggestions instead of jobs
            log.warn("{} - ambiguous location '{}' for '{}', no jobs returned",
                    getName(), query.location(), query.keywords());
            return SourcePage.last(List.of());
        }
        if (!"JOBS".equals(response.getType()) || response.getJobs() == null) {
            throw new SourceFormatException(getName(),
                    "unexpected response type '" + response.getType() + "'"
                            + (response.getError() != null ? ": " + response.getError() : ""), body);
        }

        List<NormalizedJob> jobs = response.getJobs().stream()
                .filter(job -> !isBlank(job.getUrl()) && !isBlank(job.getTitle()))
                .map(this::mapToJob)
                .toList();

        int page = pageNumber(pageToken);
        boolean hasMore = response.getPages() != null && page < response.getPages() && !response.getJobs().isEmpty();
        return new SourcePage(jobs, hasMore ? String.valueOf(page + 1) : null);
    }

    private int pageNumber(String pageToken) {
        if (isBlank(pageToken)) {
            return 1;
        }
        try {
            return Integer.parseInt(pageToken);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid Careerjet page token: " + pageToken, e);
        }
    }

    private NormalizedJob mapToJob(CareerjetJob job) {
        Long min = parseAmount(job.getSalaryMin());
        Long max = parseAmount(job.getSalaryMax());
        String currency = job.getSalaryCurrencyCode();
        if (min == null && max == null && !isBlank(job.getSalary())) {
            SalaryRange range = SalaryRange.parse(job.getSalary());
            min = range.min();
            max = range.max();
            currency = currency != null ? currency : range.currency();
        }

        return baseJob()
                .externalId(HashUtils.sha256Hex(job.getUrl()))
                .title(job.getTitle())
                .company(job.getCompany())
                .location(job.getLocations())
                .description(stripHtml(job.getDescription()))
                .applyUrl(job.getUrl())
                .salaryMin(min)
                .salaryMax(max)
                .salaryCurrency(currency)
                .salaryText(isBlank(job.getSalary()) ? null : job.getSalary())
                .postedAt(parseDate(job.getDate()))
                .build();
    }

    private static Long parseAmount(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return Math.round(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Instant parseDate(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("{} - unparseable posting date '{}'", getName(), value);
            return null;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CareerjetResponse {
        private String type;
        private String error;
        private Integer hits;
        private Integer pages;
        private List<CareerjetJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class CareerjetJob {
        private String title;
        private String company;
        private String locations;
        private String description;
        private String url;
        private String site;
        private String date;
        private String salary;
        private String salaryMin;
        private String salaryMax;
        private String salaryCurrencyCode;
    }
}
