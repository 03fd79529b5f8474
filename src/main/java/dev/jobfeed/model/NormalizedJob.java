package dev.jobfeed.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A job posting as returned by a source adapter, before it is merged into storage.
 */
@Data
@Builder
public class NormalizedJob {
    private String source;      // adapter name (jsearch, careerjet, ...)
    private String externalId;  // provider id, stable across fetches
    private String title;
    private String company;
    private String location;
    private String description;
    private String applyUrl;
    private String employmentType;

    // Salary range, either bound may be missing
    private Long salaryMin;
    private Long salaryMax;
    private String salaryCurrency;
    private String salaryText;

    private Instant postedAt;

    /**
     * Identity used for deduplication.
     */
    public String identityKey() {
        return source + "::" + externalId;
    }
}
