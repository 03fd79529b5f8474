package dev.jobfeed.entity;

import dev.jobfeed.model.TaskStatus;
import dev.jobfeed.model.TaskType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One enqueued run of a task. (taskName, scheduledFor) is unique so an occurrence is enqueued once.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "task_executions",
        uniqueConstraints = @UniqueConstraint(name = "uk_task_executions_occurrence",
                columnNames = {"task_name", "scheduled_for"}),
        indexes = @Index(name = "idx_task_executions_status", columnList = "status"))
public class TaskExecutionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_name", nullable = false, length = 100)
    private String taskName;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 30)
    private TaskType taskType;

    @Column(name = "params_json", nullable = false, columnDefinition = "text")
    private String paramsJson;

    @Column(name = "scheduled_for", nullable = false)
    private Instant scheduledFor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "worker_id", length = 200)
    private String workerId;

    /**
     * Owner token of the task lock taken at enqueue. A mismatch with the lock row means the execution was abandoned.
     */
    @Column(name = "lock_token", length = 100)
    private String lockToken;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "result_summary", length = 1000)
    private String resultSummary;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PrePersist
    void prePersist() {
        if (enqueuedAt == null) enqueuedAt = Instant.now();
        if (status == null) status = TaskStatus.PENDING;
    }
}
