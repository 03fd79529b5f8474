package dev.jobfeed.service;

import dev.jobfeed.entity.JobPosting;
import dev.jobfeed.metrics.IngestionMetrics;
import dev.jobfeed.model.NormalizedJob;
import dev.jobfeed.model.UpsertResult;
import dev.jobfeed.repository.JobPostingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JobUpsertServiceTest {

    @Autowired
    private JobUpsertService upsertService;

    @Autowired
    private JobPostingRepository jobPostingRepository;

    @Autowired
    private IngestionMetrics metrics;

    @Autowired
    private PlatformTransactionManager txManager;

    @BeforeEach
    void setUp() {
        jobPostingRepository.deleteAll();
    }

    private JobUpsertService upsertServiceAt(String instant) {
        return new JobUpsertService(jobPostingRepository, metrics, txManager,
                Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
    }

    private NormalizedJob createJob(String source, String externalId, Long salaryMin, String description) {
        return NormalizedJob.builder()
                .source(source)
                .externalId(externalId)
                .title("Software Engineer")
                .company("Acme")
                .location("Nairobi, Kenya")
                .description(description)
                .applyUrl("https://acme.example/jobs/" + externalId)
                .employmentType("Full-time")
                .salaryMin(salaryMin)
                .salaryCurrency("KES")
                .build();
    }

    @Nested
    @DisplayName("Deduplication")
    class DeduplicationTests {

        @Test
        @DisplayName("Should store one record when the same posting is fetched twice")
        void shouldStoreOneRecordAcrossRuns() {
            UpsertResult first = upsertService.upsert(List.of(createJob("jsearch", "j-1", 100L, "v1")));
            UpsertResult second = upsertService.upsert(List.of(createJob("jsearch", "j-1", 100L, "v1")));

            assertThat(first.inserted()).isEqualTo(1);
            assertThat(second.inserted()).isZero();
            assertThat(second.updated()).isEqualTo(1);
            assertThat(jobPostingRepository.countBySourceAndExternalId("jsearch", "j-1")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should treat the same external id from different sources as different postings")
        void shouldKeySourcesSeparately() {
            upsertService.upsert(List.of(
                    createJob("jsearch", "shared", null, "a"),
                    createJob("serpapi", "shared", null, "b")));

            assertThat(jobPostingRepository.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should skip candidates without identity or title")
        void shouldSkipIncompleteCandidates() {
            NormalizedJob noId = createJob("jsearch", null, null, "x");
            NormalizedJob noTitle = createJob("jsearch", "j-2", null, "x");
            noTitle.setTitle(" ");

            UpsertResult result = upsertService.upsert(List.of(noId, noTitle, createJob("jsearch", "j-3", null, "x")));

            assertThat(result).isEqualTo(new UpsertResult(1, 0, 2));
            assertThat(jobPostingRepository.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should return an empty result for no candidates")
        void shouldHandleEmptyInput() {
            assertThat(upsertService.upsert(List.of())).isEqualTo(UpsertResult.EMPTY);
            assertThat(upsertService.upsert(null)).isEqualTo(UpsertResult.EMPTY);
        }
    }

    @Nested
    @DisplayName("Updates")
    class UpdateTests {

        @Test
        @DisplayName("Should refresh mutable fields and keep id and creation time")
        void shouldUpdateMutableFields() {
            upsertService.upsert(List.of(createJob("careerjet", "c-1", 50_000L, "old description")));
            JobPosting original = jobPostingRepository.findBySourceAndExternalId("careerjet", "c-1").orElseThrow();

            upsertService.upsert(List.of(createJob("careerjet", "c-1", 65_000L, "new description")));
            JobPosting updated = jobPostingRepository.findBySourceAndExternalId("careerjet", "c-1").orElseThrow();

            assertThat(updated.getId()).isEqualTo(original.getId());
            assertThat(updated.getCreatedAt()).isEqualTo(original.getCreatedAt());
            assertThat(updated.getSalaryMin()).isEqualTo(65_000L);
            assertThat(updated.getDescription()).isEqualTo("new description");
            assertThat(updated.getFetchedAt()).isAfterOrEqualTo(original.getFetchedAt());
        }

        @Test
        @DisplayName("Should stamp creation, update and fetch times from the service clock")
        void shouldStampTimesFromClock() {
            Instant firstFetch = Instant.parse("2024-06-01T02:00:00Z");
            Instant secondFetch = Instant.parse("2024-06-01T08:00:00Z");

            upsertServiceAt("2024-06-01T02:00:00Z").upsert(List.of(createJob("jsearch", "clocked", 1L, "a")));
            JobPosting inserted = jobPostingRepository.findBySourceAndExternalId("jsearch", "clocked").orElseThrow();
            assertThat(inserted.getCreatedAt()).isEqualTo(firstFetch);
            assertThat(inserted.getUpdatedAt()).isEqualTo(firstFetch);
            assertThat(inserted.getFetchedAt()).isEqualTo(firstFetch);

            upsertServiceAt("2024-06-01T08:00:00Z").upsert(List.of(createJob("jsearch", "clocked", 2L, "b")));
            JobPosting updated = jobPostingRepository.findBySourceAndExternalId("jsearch", "clocked").orElseThrow();
            assertThat(updated.getCreatedAt()).isEqualTo(firstFetch);
            assertThat(updated.getUpdatedAt()).isEqualTo(secondFetch);
            assertThat(updated.getFetchedAt()).isEqualTo(secondFetch);
        }

        @Test
        @DisplayName("Should reactivate a posting that shows up again")
        void shouldReactivateReturningPosting() {
            upsertService.upsert(List.of(createJob("jsearch", "back", null, "x")));
            JobPosting posting = jobPostingRepository.findBySourceAndExternalId("jsearch", "back").orElseThrow();
            posting.setActive(false);
            jobPostingRepository.save(posting);

            upsertService.upsert(List.of(createJob("jsearch", "back", null, "x")));

            assertThat(jobPostingRepository.findBySourceAndExternalId("jsearch", "back").orElseThrow().isActive()).isTrue();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should leave exactly one record holding a committed write when workers upsert concurrently")
        void shouldNotDuplicateUnderConcurrentUpserts() throws Exception {
            int workers = 6;
            ExecutorService pool = Executors.newFixedThreadPool(workers);
            CountDownLatch start = new CountDownLatch(1);
            Map<Long, Future<UpsertResult>> futures = new LinkedHashMap<>();
            try {
                for (int i = 0; i < workers; i++) {
                    long salary = 1000L * (i + 1);
                    futures.put(salary, pool.submit(() -> {
                        start.await();
                        return upsertService.upsert(List.of(createJob("jsearch", "hot", salary, "d" + salary)));
                    }));
                }
                start.countDown();

                int inserted = 0;
                int updated = 0;
                int raced = 0;
                Set<Long> committed = new HashSet<>();
                for (Map.Entry<Long, Future<UpsertResult>> entry : futures.entrySet()) {
                    try {
                        UpsertResult result = entry.getValue().get(30, TimeUnit.SECONDS);
                        inserted += result.inserted();
                        updated += result.updated();
                        committed.add(entry.getKey());
                    } catch (ExecutionException e) {
                        // A retryable race is acceptable, the worker retries the attempt
                        assertThat(e.getCause()).isInstanceOf(DuplicateKeyRaceException.class);
                        raced++;
                    }
                }

                assertThat(inserted).isEqualTo(1);
                assertThat(updated + raced).isEqualTo(workers - 1);
                assertThat(jobPostingRepository.countBySourceAndExternalId("jsearch", "hot")).isEqualTo(1);

                JobPosting stored = jobPostingRepository.findBySourceAndExternalId("jsearch", "hot").orElseThrow();
                assertThat(stored.getSalaryMin()).isIn(committed);
                assertThat(stored.getDescription()).isEqualTo("d" + stored.getSalaryMin());
                assertThat(stored.getUpdatedAt()).isNotNull();
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should keep the later write when a second worker upserts after the first commits")
        void shouldApplyLaterWriteInCommitOrder() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch firstCommitted = new CountDownLatch(1);
            try {
                Future<UpsertResult> first = pool.submit(() -> {
                    try {
                        return upsertService.upsert(List.of(createJob("serpapi", "ordered", 40_000L, "first write")));
                    } finally {
                        firstCommitted.countDown();
                    }
                });
                Future<UpsertResult> second = pool.submit(() -> {
                    firstCommitted.await();
                    return upsertService.upsert(List.of(createJob("serpapi", "ordered", 55_000L, "second write")));
                });

                assertThat(first.get(30, TimeUnit.SECONDS).inserted()).isEqualTo(1);
                JobPosting afterFirst = jobPostingRepository.findBySourceAndExternalId("serpapi", "ordered").orElseThrow();
                assertThat(second.get(30, TimeUnit.SECONDS).updated()).isEqualTo(1);

                JobPosting stored = jobPostingRepository.findBySourceAndExternalId("serpapi", "ordered").orElseThrow();
                assertThat(stored.getId()).isEqualTo(afterFirst.getId());
                assertThat(stored.getCreatedAt()).isEqualTo(afterFirst.getCreatedAt());
                assertThat(stored.getSalaryMin()).isEqualTo(55_000L);
                assertThat(stored.getDescription()).isEqualTo("second write");
                assertThat(jobPostingRepository.countBySourceAndExternalId("serpapi", "ordered")).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Stale cleanup")
    class StaleCleanupTests {

        @Test
        @DisplayName("Should deactivate postings not refreshed within the window and keep the rows")
        void shouldDeactivateOnlyStalePostings() {
            upsertService.upsert(List.of(createJob("jsearch", "old", null, "x"), createJob("jsearch", "fresh", null, "x")));
            Instant now = Instant.now();
            setFetchedAt("old", now.minus(Duration.ofDays(31)));
            setFetchedAt("fresh", now.minus(Duration.ofDays(1)));

            int deactivated = upsertService.deactivateStale(now.minus(Duration.ofDays(30)));

            assertThat(deactivated).isEqualTo(1);
            assertThat(jobPostingRepository.findBySourceAndExternalId("jsearch", "old").orElseThrow().isActive()).isFalse();
            assertThat(jobPostingRepository.findBySourceAndExternalId("jsearch", "fresh").orElseThrow().isActive()).isTrue();
            assertThat(jobPostingRepository.count()).isEqualTo(2);
            assertThat(upsertService.getActivePostings()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not count already inactive postings again")
        void shouldBeIdempotent() {
            upsertService.upsert(List.of(createJob("jsearch", "old", null, "x")));
            setFetchedAt("old", Instant.now().minus(Duration.ofDays(40)));
            Instant cutoff = Instant.now().minus(Duration.ofDays(30));

            assertThat(upsertService.deactivateStale(cutoff)).isEqualTo(1);
            assertThat(upsertService.deactivateStale(cutoff)).isZero();
        }

        private void setFetchedAt(String externalId, Instant fetchedAt) {
            JobPosting posting = jobPostingRepository.findBySourceAndExternalId("jsearch", externalId).orElseThrow();
            posting.setFetchedAt(fetchedAt);
            jobPostingRepository.save(posting);
        }
    }
}
