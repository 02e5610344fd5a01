package com.xendex.backend.scheduler;

import com.xendex.backend.enums.TaskStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.models.task.ScheduledTask;
import com.xendex.backend.repositories.task.ScheduledTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskStateServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private ScheduledTaskRepository taskRepository;

    private TaskStateService taskStateService;
    private ScheduledTask task;

    @BeforeEach
    void setUp() {
        taskStateService = new TaskStateService(taskRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        task = ScheduledTask.builder()
                .id(1L)
                .taskType(TaskType.FOLLOW_UP)
                .status(TaskStatus.RUNNING)
                .runAt(NOW_UTC.minusMinutes(1))
                .lockedAt(NOW_UTC)
                .attempts(2)
                .maxAttempts(3)
                .build();
    }

    @Test
    void claim_RowAlreadyTaken_ShouldReturnFalse() {
        // given
        when(taskRepository.claim(1L, NOW_UTC, TaskStatus.PENDING, TaskStatus.RUNNING)).thenReturn(0);

        // when / then
        assertThat(taskStateService.claim(1L)).isFalse();
    }

    @Test
    void recordOutcome_Deferred_ShouldRequeueWithoutSpendingAnAttempt() {
        // given
        when(taskRepository.findById(1L)).thenReturn(Optional.of(task));

        // when
        taskStateService.recordOutcome(1L, TaskOutcome.deferred(Duration.ofHours(1), "sequence_paused"));

        // then
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.getRunAt()).isEqualTo(NOW_UTC.plusHours(1));
        assertThat(task.getAttempts()).isEqualTo(1);
        assertThat(task.getLockedAt()).isNull();
    }

    @Test
    void recordOutcome_Aborted_ShouldKeepReason() {
        // given
        when(taskRepository.findById(1L)).thenReturn(Optional.of(task));

        // when
        taskStateService.recordOutcome(1L, TaskOutcome.aborted("replied"));

        // then
        assertThat(task.getStatus()).isEqualTo(TaskStatus.ABORTED);
        assertThat(task.getOutcomeReason()).isEqualTo("replied");
        assertThat(task.getCompletedAt()).isEqualTo(NOW_UTC);
    }

    @Test
    void recordFailure_AttemptsLeft_ShouldRequeueAfterDelay() {
        // given
        when(taskRepository.findById(1L)).thenReturn(Optional.of(task));

        // when
        boolean retrying = taskStateService.recordFailure(1L, "timeout", Duration.ofSeconds(30));

        // then
        assertThat(retrying).isTrue();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.getRunAt()).isEqualTo(NOW_UTC.plusSeconds(30));
        assertThat(task.getLastError()).isEqualTo("timeout");
    }

    @Test
    void recordFailure_AttemptsExhausted_ShouldMarkFailed() {
        // given
        task.setAttempts(3);
        when(taskRepository.findById(1L)).thenReturn(Optional.of(task));

        // when
        boolean retrying = taskStateService.recordFailure(1L, "timeout", Duration.ofSeconds(30));

        // then
        assertThat(retrying).isFalse();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void requeueExpiredLeases_ShouldFailExhaustedTasksAndRequeueTheRest() {
        // given
        OffsetDateTime expiredBefore = NOW_UTC.minusMinutes(15);
        when(taskRepository.failExhaustedLeases(expiredBefore, NOW_UTC, TaskStateService.LEASE_EXHAUSTED,
                TaskStatus.RUNNING, TaskStatus.FAILED)).thenReturn(1);
        when(taskRepository.requeueExpiredLeases(expiredBefore, NOW_UTC, TaskStatus.PENDING, TaskStatus.RUNNING))
                .thenReturn(2);

        // when
        int requeued = taskStateService.requeueExpiredLeases(Duration.ofMinutes(15));

        // then
        assertThat(requeued).isEqualTo(2);
        InOrder inOrder = inOrder(taskRepository);
        inOrder.verify(taskRepository).failExhaustedLeases(expiredBefore, NOW_UTC,
                TaskStateService.LEASE_EXHAUSTED, TaskStatus.RUNNING, TaskStatus.FAILED);
        inOrder.verify(taskRepository).requeueExpiredLeases(expiredBefore, NOW_UTC,
                TaskStatus.PENDING, TaskStatus.RUNNING);
    }
}
