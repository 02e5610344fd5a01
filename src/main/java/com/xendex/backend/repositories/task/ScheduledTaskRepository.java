package com.xendex.backend.repositories.task;

import com.xendex.backend.enums.TaskStatus;
import com.xendex.backend.models.task.ScheduledTask;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface ScheduledTaskRepository extends JpaRepository<ScheduledTask, Long> {

    @Query("""
            SELECT t.id FROM ScheduledTask t
            WHERE t.status = :status
              AND t.runAt <= :now
            ORDER BY t.runAt ASC
            """)
    List<Long> findDueTaskIds(@Param("status") TaskStatus status,
                              @Param("now") OffsetDateTime now,
                              Pageable pageable);

    /**
     * Moves a single task from PENDING to RUNNING. Returns 0 when another worker got there first.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.status = :running, t.lockedAt = :now, t.attempts = t.attempts + 1
            WHERE t.id = :id AND t.status = :pending
            """)
    int claim(@Param("id") Long id,
              @Param("now") OffsetDateTime now,
              @Param("pending") TaskStatus pending,
              @Param("running") TaskStatus running);

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.status = :pending, t.lockedAt = NULL, t.runAt = :now
            WHERE t.status = :running AND t.lockedAt < :leaseExpiredBefore
              AND t.attempts < t.maxAttempts
            """)
    int requeueExpiredLeases(@Param("leaseExpiredBefore") OffsetDateTime leaseExpiredBefore,
                             @Param("now") OffsetDateTime now,
                             @Param("pending") TaskStatus pending,
                             @Param("running") TaskStatus running);

    /**
     * Fails RUNNING tasks whose lease expired on their last allowed attempt.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE ScheduledTask t
            SET t.status = :failed, t.lockedAt = NULL, t.completedAt = :now, t.lastError = :error
            WHERE t.status = :running AND t.lockedAt < :leaseExpiredBefore
              AND t.attempts >= t.maxAttempts
            """)
    int failExhaustedLeases(@Param("leaseExpiredBefore") OffsetDateTime leaseExpiredBefore,
                            @Param("now") OffsetDateTime now,
                            @Param("error") String error,
                            @Param("running") TaskStatus running,
                            @Param("failed") TaskStatus failed);

    @Modifying
    @Query("DELETE FROM ScheduledTask t WHERE t.status IN :statuses AND t.completedAt < :before")
    int deleteFinishedBefore(@Param("statuses") Collection<TaskStatus> statuses,
                             @Param("before") OffsetDateTime before);
}
