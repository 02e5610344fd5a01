package com.xendex.backend.scheduler;

import com.xendex.backend.enums.TaskStatus;
import com.xendex.backend.models.task.ScheduledTask;
import com.xendex.backend.repositories.task.ScheduledTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Short transactions that move a scheduled task through its lifecycle. Kept apart from the
 * worker so each write commits on its own, independent of what the handler did.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskStateService {

    static final String LEASE_EXHAUSTED = "lease expired on final attempt";

    private final ScheduledTaskRepository taskRepository;
    private final Clock clock;

    @Transactional
    public boolean claim(Long taskId) {
        return taskRepository.claim(taskId, now(), TaskStatus.PENDING, TaskStatus.RUNNING) == 1;
    }

    @Transactional(readOnly = true)
    public Optional<ScheduledTask> find(Long taskId) {
        return taskRepository.findById(taskId);
    }

    @Transactional
    public void recordOutcome(Long taskId, TaskOutcome outcome) {
        taskRepository.findById(taskId).ifPresent(task -> {
            switch (outcome.kind()) {
                case COMPLETED -> finish(task, TaskStatus.COMPLETED, outcome.reason());
                case ABORTED -> finish(task, TaskStatus.ABORTED, outcome.reason());
                case DEFERRED -> {
                    task.setStatus(TaskStatus.PENDING);
                    task.setLockedAt(null);
                    task.setRunAt(now().plus(outcome.deferBy()));
                    task.setOutcomeReason(outcome.reason());
                    // deferral is not a failed attempt
                    task.setAttempts(Math.max(0, task.getAttempts() - 1));
                }
            }
            taskRepository.save(task);
        });
    }

    /**
     * Re-queues the task after {@code retryDelay}, or marks it FAILED when no attempts remain.
     * Returns true if another attempt was scheduled.
     */
    @Transactional
    public boolean recordFailure(Long taskId, String error, Duration retryDelay) {
        Optional<ScheduledTask> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            return false;
        }
        ScheduledTask task = found.get();
        task.setLastError(error);
        task.setLockedAt(null);

        boolean retry = task.hasAttemptsLeft();
        if (retry) {
            task.setStatus(TaskStatus.PENDING);
            task.setRunAt(now().plus(retryDelay));
        } else {
            task.setStatus(TaskStatus.FAILED);
            task.setCompletedAt(now());
        }
        taskRepository.save(task);
        return retry;
    }

    /**
     * Re-queues RUNNING tasks whose lease expired. A task already on its last attempt is marked
     * FAILED instead, so a task that keeps killing its worker stops coming back.
     */
    @Transactional
    public int requeueExpiredLeases(Duration leaseTimeout) {
        OffsetDateTime now = now();
        OffsetDateTime expiredBefore = now.minus(leaseTimeout);
        int failed = taskRepository.failExhaustedLeases(expiredBefore, now, LEASE_EXHAUSTED,
                TaskStatus.RUNNING, TaskStatus.FAILED);
        if (failed > 0) {
            log.error("Failed {} tasks whose lease expired on their final attempt", failed);
        }
        return taskRepository.requeueExpiredLeases(expiredBefore, now, TaskStatus.PENDING, TaskStatus.RUNNING);
    }

    private void finish(ScheduledTask task, TaskStatus status, String reason) {
        task.setStatus(status);
        task.setOutcomeReason(reason);
        task.setCompletedAt(now());
        task.setLockedAt(null);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
