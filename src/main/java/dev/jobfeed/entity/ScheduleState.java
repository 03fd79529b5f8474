package dev.jobfeed.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted cursor of one schedule so that restarts neither repeat nor lose occurrences.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "schedule_state")
public class ScheduleState {

    @Id
    @Column(length = 100)
    private String name;

    @Column(nullable = false, length = 120)
    private String cron;

    @Column(name = "next_fire_at", nullable = false)
    private Instant nextFireAt;

    @Column(name = "last_fired_at")
    private Instant lastFiredAt;
}
