package com.xendex.backend.models.task;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Typed arguments of a scheduled task. Which fields are set depends on the task type.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPayload {

    @Column(name = "lead_id")
    private Long leadId;

    @Column(name = "sequence_id")
    private Long sequenceId;

    @Column(name = "draft_id")
    private Long draftId;

    /** The touch that was just sent. */
    @Column(name = "touch_number")
    private Integer touchNumber;

    /** Send time of that touch; replies at or after it cancel the task. */
    @Column(name = "reference_time")
    private OffsetDateTime referenceTime;

    public static TaskPayload forSequence(Long sequenceId) {
        return TaskPayload.builder().sequenceId(sequenceId).build();
    }

    public static TaskPayload forTouch(Long leadId, Long sequenceId, Long draftId,
                                       int touchNumber, OffsetDateTime sentAt) {
        return TaskPayload.builder()
                .leadId(leadId)
                .sequenceId(sequenceId)
                .draftId(draftId)
                .touchNumber(touchNumber)
                .referenceTime(sentAt)
                .build();
    }
}
