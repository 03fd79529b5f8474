package dev.jobfeed.source.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobfeed.JobFeedException;
import dev.jobfeed.config.SourcesConfig;
import dev.jobfeed.metrics.IngestionMetrics;
import dev.jobfeed.model.NormalizedJob;
import dev.jobfeed.model.SearchQuery;
import dev.jobfeed.model.SourcePage;
import dev.jobfeed.source.JobSource;
import dev.jobfeed.source.SourceFormatException;
import dev.jobfeed.source.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

@Slf4j
public abstract class AbstractJobSource implements JobSource {

    protected final WebClient webClient;
    protected final IngestionMetrics metrics;
    protected final ObjectMapper objectMapper;
    protected final SourcesConfig.Provider settings;

    protected AbstractJobSource(WebClient.Builder webClientBuilder, IngestionMetrics metrics,
                                ObjectMapper objectMapper, SourcesConfig.Provider settings) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", "job-feed/1.0 (+https://github.com/job-feed)")
                .defaultHeader("Accept", "application/json, text/plain, */*")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    /**
     * Build the request URI of one page.
     */
    protected abstract URI pageUri(SearchQuery query, String pageToken, int pageSize);

    /**
     * Translate a successfully received body into a page. Throws {@link SourceFormatException}
     * when the body cannot be understood.
     */
    protected abstract SourcePage parsePage(String body, SearchQuery query, String pageToken, int pageSize);

    /**
     * Whether the provider refuses requests without an API key.
     */
    protected boolean requiresApiKey() {
        return true;
    }

    /**
     * Hook for provider specific headers such as API keys.
     */
    protected void addHeaders(HttpHeaders headers) {
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled() && (!requiresApiKey() || settings.hasApiKey());
    }

    @Override
    public Mono<SourcePage> fetchPage(SearchQuery query, String pageToken, int pageSize) {
        URI uri = pageUri(query, pageToken, pageSize);
        log.debug("{} - fetching '{}' page {}", getName(), query, pageToken == null ? "first" : pageToken);

        return timedGet(uri)
                .map(body -> parsePage(body, query, pageToken, pageSize))
                .doOnNext(page -> metrics.incrementJobsFetched(getName(), page.jobs().size()))
                .doOnError(SourceFormatException.class,
                        e -> metrics.incrementFetchFailures(getName(), "format"))
                .doOnError(SourceUnavailableException.class,
                        e -> metrics.incrementFetchFailures(getName(), "unavailable"));
    }

    /**
     * Execute a rate-limited, timed GET request. HTTP 429 is retried with backoff; every other
     * transport failure surfaces as {@link SourceUnavailableException}.
     */
    @SuppressWarnings("null")
    protected Mono<String> timedGet(URI uri) {
        Duration delay = settings.getRequestDelay() != null ? settings.getRequestDelay() : Duration.ZERO;

        return Mono.delay(delay)
                .then(Mono.defer(() -> {
                    long start = System.currentTimeMillis();
                    return webClient.get()
                            .uri(uri)
                            .headers(this::addHeaders)
                            .retrieve()
                            .bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .timeout(settings.getTimeout())
                            .doOnTerminate(() -> {
                                long latency = System.currentTimeMillis() - start;
                                metrics.recordFetchLatency(getName(), latency);
                            });
                }))
                .retryWhen(Retry.backoff(settings.getRateLimitRetries(), settings.getRateLimitBackoff())
                        .filter(AbstractJobSource::isRateLimited)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(e -> !(e instanceof JobFeedException), this::toUnavailable);
    }

    private static boolean isRateLimited(Throwable e) {
        return e instanceof WebClientResponseException.TooManyRequests;
    }

    private SourceUnavailableException toUnavailable(Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            return new SourceUnavailableException(getName(), "HTTP " + wcre.getStatusCode().value(), e);
        }
        if (e instanceof WebClientRequestException) {
            return new SourceUnavailableException(getName(), "request failed: " + e.getMessage(), e);
        }
        if (e instanceof TimeoutException) {
            return new SourceUnavailableException(getName(), "timed out after " + settings.getTimeout(), e);
        }
        return new SourceUnavailableException(getName(), "fetch failed: " + e, e);
    }

    /**
     * Parse a JSON body, mapping parse failures to {@link SourceFormatException}.
     */
    protected <T> T readJson(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw new SourceFormatException(getName(), "empty response body", body);
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new SourceFormatException(getName(), "unparseable payload: " + e.getOriginalMessage(), body, e);
        }
    }

    /**
     * Strip HTML tags from text.
     */
    protected String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    /**
     * Build a NormalizedJob with common defaults.
     */
    protected NormalizedJob.NormalizedJobBuilder baseJob() {
        return NormalizedJob.builder()
                .source(getName());
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    protected static String joinNonBlank(String separator, String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (isBlank(part)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(part.trim());
        }
        return sb.toString();
    }
}
