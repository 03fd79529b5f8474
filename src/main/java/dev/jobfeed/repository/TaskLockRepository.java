package dev.jobfeed.repository;

import dev.jobfeed.entity.TaskLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface TaskLockRepository extends JpaRepository<TaskLock, String> {

    /**
     * Plain insert of a free lock row. Fails with a constraint violation when the row already exists,
     * unlike {@code save()} which would merge over a held lock.
     */
    @Modifying
    @Query(value = "INSERT INTO task_locks (name) VALUES (:name)", nativeQuery = true)
    int insertFree(@Param("name") String name);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE TaskLock l
               SET l.ownerId = :ownerId,
                   l.lockedUntil = :lockedUntil
             WHERE l.name = :name
               AND (l.ownerId IS NULL OR l.lockedUntil IS NULL OR l.lockedUntil < :now)
            """)
    int acquireIfFree(@Param("name") String name,
                      @Param("ownerId") String ownerId,
                      @Param("lockedUntil") Instant lockedUntil,
                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TaskLock l SET l.lockedUntil = :lockedUntil WHERE l.name = :name AND l.ownerId = :ownerId")
    int renewIfOwned(@Param("name") String name,
                     @Param("ownerId") String ownerId,
                     @Param("lockedUntil") Instant lockedUntil);

    /**
     * Hand a lock from {@code staleOwnerId} to {@code ownerId} regardless of the remaining lease.
     * Matches nothing when the lock changed hands since the caller looked.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE TaskLock l
               SET l.ownerId = :ownerId,
                   l.lockedUntil = :lockedUntil
             WHERE l.name = :name
               AND l.ownerId = :staleOwnerId
            """)
    int takeOverFrom(@Param("name") String name,
                     @Param("staleOwnerId") String staleOwnerId,
                     @Param("ownerId") String ownerId,
                     @Param("lockedUntil") Instant lockedUntil);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TaskLock l SET l.ownerId = NULL, l.lockedUntil = NULL WHERE l.name = :name AND l.ownerId = :ownerId")
    int releaseIfOwned(@Param("name") String name, @Param("ownerId") String ownerId);
}
