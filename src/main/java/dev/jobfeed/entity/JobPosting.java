package dev.jobfeed.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored job posting. Identity is (source, externalId); rows are soft-deleted through {@code active}.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_postings",
        uniqueConstraints = @UniqueConstraint(name = "uk_job_postings_source_external_id",
                columnNames = {"source", "external_id"}),
        indexes = {
                @Index(name = "idx_job_postings_fetched_at", columnList = "fetched_at"),
                @Index(name = "idx_job_postings_active", columnList = "active")
        })
public class JobPosting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String source;

    @Column(name = "external_id", nullable = false, length = 512)
    private String externalId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(length = 300)
    private String company;

    @Column(length = 300)
    private String location;

    @Column(name = "salary_min")
    private Long salaryMin;

    @Column(name = "salary_max")
    private Long salaryMax;

    @Column(name = "salary_currency", length = 10)
    private String salaryCurrency;

    @Column(name = "salary_text", length = 200)
    private String salaryText;

    @Column(name = "employment_type", length = 50)
    private String employmentType;

    @Column(columnDefinition = "text")
    private String description;

    @Column(name = "apply_url", length = 2048)
    private String applyUrl;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** Fallback for rows saved outside the upsert path, which stamps all three from its clock. */
    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (fetchedAt == null) fetchedAt = now;
    }
}
