package com.xendex.backend.scheduler;

import com.xendex.backend.enums.TaskType;
import com.xendex.backend.models.task.TaskPayload;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Durable "run this later" facility. Delivery is at-least-once: a task may run more than once,
 * so every {@link TaskHandler} re-checks state before acting. There is no cancel operation;
 * handlers decide on wake whether the work is still wanted.
 */
public interface DelayedTaskScheduler {

    Long schedule(TaskType type, TaskPayload payload, Duration delay);

    Long scheduleAt(TaskType type, TaskPayload payload, OffsetDateTime runAt);
}
