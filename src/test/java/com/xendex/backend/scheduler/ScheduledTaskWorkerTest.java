package com.xendex.backend.scheduler;

import com.xendex.backend.config.TaskSchedulerProperties;
import com.xendex.backend.enums.TaskStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.exceptions.CollaboratorException;
import com.xendex.backend.models.task.ScheduledTask;
import com.xendex.backend.models.task.TaskPayload;
import com.xendex.backend.repositories.task.ScheduledTaskRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledTaskWorkerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private ScheduledTaskRepository taskRepository;

    @Mock
    private TaskStateService taskStateService;

    @Mock
    private RetryPolicy retryPolicy;

    @Mock
    private TaskHandler followUpHandler;

    private SimpleMeterRegistry meterRegistry;
    private ScheduledTaskWorker worker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        TaskSchedulerProperties properties = new TaskSchedulerProperties(50, Duration.ofMinutes(15), 5,
                Duration.ofSeconds(30), Duration.ofHours(1), Duration.ofDays(30),
                new TaskSchedulerProperties.Worker(1, 1, 10));

        when(followUpHandler.getTaskType()).thenReturn(TaskType.FOLLOW_UP);
        worker = new ScheduledTaskWorker(taskRepository, taskStateService, retryPolicy, properties,
                Runnable::run, List.of(followUpHandler), meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void pollDueTasks_ShouldOnlyRunTasksThisPollerClaimed() {
        // given
        ScheduledTask task = task(1L);
        when(taskRepository.findDueTaskIds(eq(TaskStatus.PENDING), any(OffsetDateTime.class), any(Pageable.class)))
                .thenReturn(List.of(1L, 2L));
        when(taskStateService.claim(1L)).thenReturn(true);
        when(taskStateService.claim(2L)).thenReturn(false);
        when(taskStateService.find(1L)).thenReturn(Optional.of(task));
        when(followUpHandler.handle(task)).thenReturn(TaskOutcome.completed());

        // when
        worker.pollDueTasks();

        // then
        verify(followUpHandler).handle(task);
        verify(taskStateService, never()).find(2L);
        verify(taskStateService).recordOutcome(1L, TaskOutcome.completed());
        assertThat(meterRegistry.counter("sequence.tasks.executed", "type", "FOLLOW_UP", "outcome", "COMPLETED")
                .count()).isEqualTo(1.0);
    }

    @Test
    void runTask_HandlerThrows_ShouldRecordFailureWithBackoff() {
        // given
        ScheduledTask task = task(1L);
        task.setAttempts(2);
        when(taskStateService.find(1L)).thenReturn(Optional.of(task));
        when(followUpHandler.handle(task)).thenThrow(new CollaboratorException("Resend 503"));
        when(retryPolicy.delayBeforeRetry(2)).thenReturn(Duration.ofMinutes(1));
        when(taskStateService.recordFailure(1L, "Resend 503", Duration.ofMinutes(1))).thenReturn(true);

        // when
        worker.runTask(1L);

        // then
        verify(taskStateService, never()).recordOutcome(anyLong(), any());
        assertThat(meterRegistry.counter("sequence.tasks.retried", "type", "FOLLOW_UP").count()).isEqualTo(1.0);
    }

    @Test
    void runTask_AbortedOutcome_ShouldBeRecordedNotRetried() {
        // given
        ScheduledTask task = task(1L);
        TaskOutcome aborted = TaskOutcome.aborted("replied");
        when(taskStateService.find(1L)).thenReturn(Optional.of(task));
        when(followUpHandler.handle(task)).thenReturn(aborted);

        // when
        worker.runTask(1L);

        // then
        verify(taskStateService).recordOutcome(1L, aborted);
        verify(taskStateService, never()).recordFailure(anyLong(), any(), any());
    }

    @Test
    void runTask_NoHandlerForType_ShouldFailTask() {
        // given
        ScheduledTask task = task(1L);
        task.setTaskType(TaskType.DRAFTING_PASS);
        when(taskStateService.find(1L)).thenReturn(Optional.of(task));

        // when
        worker.runTask(1L);

        // then
        verify(taskStateService).recordFailure(1L, "No handler for DRAFTING_PASS", Duration.ZERO);
    }

    @Test
    void constructor_TwoHandlersForSameType_ShouldFail() {
        // given
        TaskHandler duplicate = mock(TaskHandler.class);
        when(duplicate.getTaskType()).thenReturn(TaskType.FOLLOW_UP);
        TaskSchedulerProperties properties = new TaskSchedulerProperties(50, Duration.ofMinutes(15), 5,
                Duration.ofSeconds(30), Duration.ofHours(1), Duration.ofDays(30),
                new TaskSchedulerProperties.Worker(1, 1, 10));

        // when / then
        assertThatThrownBy(() -> new ScheduledTaskWorker(taskRepository, taskStateService, retryPolicy, properties,
                Runnable::run, List.of(followUpHandler, duplicate), meterRegistry, Clock.systemUTC()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recoverExpiredLeases_ShouldUseConfiguredLeaseTimeout() {
        // given
        when(taskStateService.requeueExpiredLeases(Duration.ofMinutes(15))).thenReturn(2);

        // when
        worker.recoverExpiredLeases();

        // then
        verify(taskStateService).requeueExpiredLeases(Duration.ofMinutes(15));
    }

    private ScheduledTask task(Long id) {
        return ScheduledTask.builder()
                .id(id)
                .taskType(TaskType.FOLLOW_UP)
                .payload(TaskPayload.forTouch(10L, 1L, null, 1, OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)))
                .status(TaskStatus.RUNNING)
                .runAt(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC))
                .attempts(1)
                .build();
    }
}
