package dev.jobfeed.repository;

import dev.jobfeed.entity.ScheduleState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface ScheduleStateRepository extends JpaRepository<ScheduleState, String> {

    /**
     * Compare-and-set advance of a schedule cursor. Returns 0 when another caller already moved it.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ScheduleState s
               SET s.nextFireAt = :nextFireAt,
                   s.lastFiredAt = :firedAt
             WHERE s.name = :name
               AND s.nextFireAt = :expected
            """)
    int advanceIf(@Param("name") String name,
                  @Param("expected") Instant expected,
                  @Param("nextFireAt") Instant nextFireAt,
                  @Param("firedAt") Instant firedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduleState s SET s.cron = :cron, s.nextFireAt = :nextFireAt WHERE s.name = :name")
    int reset(@Param("name") String name, @Param("cron") String cron, @Param("nextFireAt") Instant nextFireAt);
}
