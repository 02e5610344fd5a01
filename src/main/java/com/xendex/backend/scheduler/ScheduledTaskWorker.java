package com.xendex.backend.scheduler;

import com.xendex.backend.config.TaskSchedulerProperties;
import com.xendex.backend.enums.TaskStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.models.task.ScheduledTask;
import com.xendex.backend.repositories.task.ScheduledTaskRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Pulls due tasks from {@code scheduled_tasks} and runs them on the worker pool.
 *
 * <p>A task is claimed with a conditional update before it is handed to a thread, so two
 * pollers never run the same delivery. A worker that dies mid-task leaves the row RUNNING;
 * the lease sweep puts it back to PENDING and it is delivered again.
 */
@Component
@Slf4j
public class ScheduledTaskWorker {

    private final ScheduledTaskRepository taskRepository;
    private final TaskStateService taskStateService;
    private final RetryPolicy retryPolicy;
    private final TaskSchedulerProperties properties;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);

    public ScheduledTaskWorker(ScheduledTaskRepository taskRepository,
                               TaskStateService taskStateService,
                               RetryPolicy retryPolicy,
                               TaskSchedulerProperties properties,
                               @Qualifier("sequenceTaskExecutor") Executor executor,
                               List<TaskHandler> taskHandlers,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.taskRepository = taskRepository;
        this.taskStateService = taskStateService;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        for (TaskHandler handler : taskHandlers) {
            TaskHandler previous = handlers.put(handler.getTaskType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for task type " + handler.getTaskType());
            }
        }
    }

    /**
     * Claim due tasks and dispatch them to the worker pool
     */
    @Scheduled(fixedDelayString = "${xendex.tasks.poll-interval-ms:5000}")
    public void pollDueTasks() {
        try {
            List<Long> dueIds = taskRepository.findDueTaskIds(
                    TaskStatus.PENDING, OffsetDateTime.now(clock), PageRequest.of(0, properties.batchSize()));

            if (dueIds.isEmpty()) {
                log.debug("No due sequence tasks");
                return;
            }

            int dispatched = 0;
            for (Long taskId : dueIds) {
                if (taskStateService.claim(taskId)) {
                    executor.execute(() -> runTask(taskId));
                    dispatched++;
                }
            }
            log.debug("Dispatched {} of {} due sequence tasks", dispatched, dueIds.size());

        } catch (Exception e) {
            log.error("Error polling sequence tasks: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one claimed task and records the result. Never throws.
     */
    void runTask(Long taskId) {
        Optional<ScheduledTask> found = taskStateService.find(taskId);
        if (found.isEmpty()) {
            log.warn("Claimed task {} disappeared before it ran", taskId);
            return;
        }
        ScheduledTask task = found.get();
        TaskHandler handler = handlers.get(task.getTaskType());
        if (handler == null) {
            log.error("No handler registered for task type {} (task {})", task.getTaskType(), taskId);
            taskStateService.recordFailure(taskId, "No handler for " + task.getTaskType(), Duration.ZERO);
            return;
        }

        try {
            TaskOutcome outcome = handler.handle(task);
            taskStateService.recordOutcome(taskId, outcome);
            countExecution(task.getTaskType(), outcome.kind().name());

            if (outcome.isAborted()) {
                log.info("Task {} ({}) aborted: {}", taskId, task.getTaskType(), outcome.reason());
            } else {
                log.debug("Task {} ({}) finished: {}", taskId, task.getTaskType(), outcome.kind());
            }
        } catch (Exception e) {
            Duration retryDelay = retryPolicy.delayBeforeRetry(task.getAttempts());
            boolean retrying = taskStateService.recordFailure(taskId, e.getMessage(), retryDelay);

            if (retrying) {
                log.warn("Task {} ({}) failed on attempt {}, retrying in {}: {}",
                        taskId, task.getTaskType(), task.getAttempts(), retryDelay, e.getMessage());
                Counter.builder("sequence.tasks.retried")
                        .description("Task attempts that failed and were re-queued")
                        .tag("type", task.getTaskType().name())
                        .register(meterRegistry)
                        .increment();
            } else {
                log.error("Task {} ({}) failed permanently after {} attempts: {}",
                        taskId, task.getTaskType(), task.getAttempts(), e.getMessage(), e);
                countExecution(task.getTaskType(), "FAILED");
            }
        }
    }

    /**
     * Put tasks whose worker vanished back in the queue
     */
    @Scheduled(fixedDelayString = "${xendex.tasks.lease-sweep-interval-ms:60000}")
    public void recoverExpiredLeases() {
        try {
            int requeued = taskStateService.requeueExpiredLeases(properties.leaseTimeout());
            if (requeued > 0) {
                log.warn("Re-queued {} sequence tasks whose lease expired", requeued);
            }
        } catch (Exception e) {
            log.error("Error recovering expired task leases: {}", e.getMessage(), e);
        }
    }

    /**
     * Cleanup old finished tasks daily at 3 AM
     */
    @Scheduled(cron = "0 0 3 * * *")
    @Transactional
    public void cleanupFinishedTasks() {
        try {
            OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(properties.retention());
            int deleted = taskRepository.deleteFinishedBefore(
                    List.of(TaskStatus.COMPLETED, TaskStatus.ABORTED), cutoff);
            log.info("Task cleanup completed. Deleted {} finished tasks older than {}", deleted, cutoff);
        } catch (Exception e) {
            log.error("Error during task cleanup: {}", e.getMessage(), e);
        }
    }

    private void countExecution(TaskType type, String outcome) {
        Counter.builder("sequence.tasks.executed")
                .description("Scheduled sequence tasks by outcome")
                .tag("type", type.name())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
