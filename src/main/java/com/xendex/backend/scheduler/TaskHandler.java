package com.xendex.backend.scheduler;

import com.xendex.backend.enums.TaskType;
import com.xendex.backend.models.task.ScheduledTask;

/**
 * Executes one type of scheduled task. Implementations must be idempotent; throwing signals a
 * transient failure and the task is retried with backoff.
 */
public interface TaskHandler {

    TaskType getTaskType();

    TaskOutcome handle(ScheduledTask task);
}
