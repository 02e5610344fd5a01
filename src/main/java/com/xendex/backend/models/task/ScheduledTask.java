package com.xendex.backend.models.task;

import com.xendex.backend.enums.TaskStatus;
import com.xendex.backend.enums.TaskType;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "scheduled_tasks", indexes = {
        @Index(name = "idx_tasks_status_run_at", columnList = "status, run_at"),
        @Index(name = "idx_tasks_status_locked_at", columnList = "status, locked_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 30)
    private TaskType taskType;

    @Embedded
    @Builder.Default
    private TaskPayload payload = new TaskPayload();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Column(name = "run_at", nullable = false)
    private OffsetDateTime runAt;

    @Min(0)
    @Column(nullable = false)
    @Builder.Default
    private Integer attempts = 0;

    @Min(1)
    @Column(name = "max_attempts", nullable = false)
    @Builder.Default
    private Integer maxAttempts = 5;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "outcome_reason", length = 255)
    private String outcomeReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }
}
