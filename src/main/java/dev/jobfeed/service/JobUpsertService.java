package dev.jobfeed.service;

import dev.jobfeed.entity.JobPosting;
import dev.jobfeed.metrics.IngestionMetrics;
import dev.jobfeed.model.NormalizedJob;
import dev.jobfeed.model.UpsertResult;
import dev.jobfeed.repository.JobPostingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Merges fetched postings into storage, keyed by (source, externalId).
 * Each candidate is merged in its own transaction under a row lock, so concurrent workers
 * fetching overlapping queries never insert duplicates or lose an update.
 */
@Slf4j
@Service
public class JobUpsertService {

    private enum Outcome { INSERTED, UPDATED }

    private final JobPostingRepository jobPostingRepository;
    private final IngestionMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate tx;

    public JobUpsertService(JobPostingRepository jobPostingRepository, IngestionMetrics metrics,
                            PlatformTransactionManager txManager, Clock clock) {
        this.jobPostingRepository = jobPostingRepository;
        this.metrics = metrics;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Insert new postings and refresh existing ones.
     *
     * @param candidates postings from a source adapter, possibly repeating earlier fetches
     * @return counts of inserted, updated and skipped candidates
     */
    public UpsertResult upsert(List<NormalizedJob> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return UpsertResult.EMPTY;
        }

        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        for (NormalizedJob candidate : candidates) {
            if (!hasIdentity(candidate)) {
                log.debug("Skipping candidate without identity or title: {}", candidate);
                skipped++;
                continue;
            }
            if (upsertOne(candidate) == Outcome.INSERTED) {
                inserted++;
            } else {
                updated++;
            }
        }

        UpsertResult result = new UpsertResult(inserted, updated, skipped);
        metrics.recordUpsert(result);
        log.debug("Upsert: {} candidates, {} inserted, {} updated, {} skipped",
                candidates.size(), inserted, updated, skipped);
        return result;
    }

    /**
     * Mark postings that were not refreshed since {@code olderThan} as inactive. Rows are kept so that
     * swipes and applications referencing them stay valid.
     *
     * @return number of postings deactivated
     */
    public int deactivateStale(Instant olderThan) {
        Integer count = tx.execute(status ->
                jobPostingRepository.deactivateFetchedBefore(olderThan, clock.instant()));
        int deactivated = count != null ? count : 0;
        metrics.recordDeactivated(deactivated);
        log.info("Deactivated {} postings not refreshed since {}", deactivated, olderThan);
        return deactivated;
    }

    public long getActivePostings() {
        return jobPostingRepository.countByActiveTrue();
    }

    private Outcome upsertOne(NormalizedJob candidate) {
        try {
            return tx.execute(status -> merge(candidate));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException race) {
            // Another worker inserted the same identity between our lookup and insert. Depending on the
            // store this shows up as a unique violation or as a conflict with the uncommitted row.
            metrics.recordUpsertRace();
            log.debug("Duplicate key race on {}, retrying once", candidate.identityKey());
            try {
                return tx.execute(status -> merge(candidate));
            } catch (DataIntegrityViolationException | ConcurrencyFailureException again) {
                throw new DuplicateKeyRaceException(candidate.getSource(), candidate.getExternalId(), again);
            }
        }
    }

    private Outcome merge(NormalizedJob candidate) {
        Instant now = clock.instant();
        Optional<JobPosting> existing =
                jobPostingRepository.findForUpdate(candidate.getSource(), candidate.getExternalId());

        if (existing.isPresent()) {
            JobPosting posting = existing.get();
            applyMutableFields(posting, candidate);
            posting.setActive(true);
            posting.setFetchedAt(now);
            posting.setUpdatedAt(now);
            return Outcome.UPDATED;
        }

        JobPosting posting = JobPosting.builder()
                .source(candidate.getSource())
                .externalId(candidate.getExternalId())
                .title(truncate(candidate.getTitle(), 500))
                .company(truncate(candidate.getCompany(), 300))
                .location(truncate(candidate.getLocation(), 300))
                .postedAt(candidate.getPostedAt())
                .active(true)
                .fetchedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        applyMutableFields(posting, candidate);
        jobPostingRepository.saveAndFlush(posting);
        return Outcome.INSERTED;
    }

    private static void applyMutableFields(JobPosting posting, NormalizedJob candidate) {
        posting.setSalaryMin(candidate.getSalaryMin());
        posting.setSalaryMax(candidate.getSalaryMax());
        posting.setSalaryCurrency(truncate(candidate.getSalaryCurrency(), 10));
        posting.setSalaryText(truncate(candidate.getSalaryText(), 200));
        posting.setEmploymentType(truncate(candidate.getEmploymentType(), 50));
        posting.setDescription(candidate.getDescription());
        posting.setApplyUrl(truncate(candidate.getApplyUrl(), 2048));
    }

    private static boolean hasIdentity(NormalizedJob candidate) {
        return candidate != null
                && notBlank(candidate.getSource())
                && notBlank(candidate.getExternalId())
                && notBlank(candidate.getTitle());
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
