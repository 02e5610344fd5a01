package com.xendex.backend.scheduler;

import com.xendex.backend.config.TaskSchedulerProperties;
import com.xendex.backend.enums.TaskStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.models.task.ScheduledTask;
import com.xendex.backend.models.task.TaskPayload;
import com.xendex.backend.repositories.task.ScheduledTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Stores tasks in {@code scheduled_tasks}. Scheduling joins the caller's transaction, so a task
 * only becomes visible to workers once the state change that produced it has committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PersistentTaskScheduler implements DelayedTaskScheduler {

    private final ScheduledTaskRepository taskRepository;
    private final TaskSchedulerProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public Long schedule(TaskType type, TaskPayload payload, Duration delay) {
        Duration safeDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        return scheduleAt(type, payload, OffsetDateTime.now(clock).plus(safeDelay));
    }

    @Override
    @Transactional
    public Long scheduleAt(TaskType type, TaskPayload payload, OffsetDateTime runAt) {
        ScheduledTask task = ScheduledTask.builder()
                .taskType(type)
                .payload(payload)
                .status(TaskStatus.PENDING)
                .runAt(runAt)
                .maxAttempts(properties.maxAttempts())
                .build();

        task = taskRepository.save(task);
        log.info("Scheduled {} task {} for {} (lead={}, sequence={}, touch={})",
                type, task.getId(), runAt, payload.getLeadId(), payload.getSequenceId(), payload.getTouchNumber());
        return task.getId();
    }
}
