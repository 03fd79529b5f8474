package dev.jobfeed.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Lease-based mutex keyed by task name. Free when {@code ownerId} is null or the lease has expired.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "task_locks")
public class TaskLock {

    @Id
    @Column(length = 100)
    private String name;

    @Column(name = "owner_id", length = 100)
    private String ownerId;

    @Column(name = "locked_until")
    private Instant lockedUntil;
}
