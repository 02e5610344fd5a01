package com.xendex.backend.models;

import com.xendex.backend.enums.EventType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;

/**
 * Append-only fact about a lead's email interaction. Rows are never updated or deleted;
 * the replied events here are the source of truth for reply checks.
 */
@Entity
@Immutable
@Table(name = "email_events", indexes = {
        @Index(name = "idx_events_lead_type_time", columnList = "lead_id, event_type, occurred_at"),
        @Index(name = "idx_events_draft", columnList = "draft_id"),
        @Index(name = "idx_events_message", columnList = "message_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@ToString
public class LeadEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lead_id", nullable = false, updatable = false)
    private Long leadId;

    @Column(name = "sequence_id", updatable = false)
    private Long sequenceId;

    @Column(name = "draft_id", updatable = false)
    private Long draftId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 30)
    private EventType eventType;

    @Column(name = "touch_number", updatable = false)
    private Integer touchNumber;

    @Column(name = "message_id", updatable = false)
    private String messageId;

    @Column(updatable = false, length = 500)
    private String subject;

    @Column(updatable = false, columnDefinition = "TEXT")
    @ToString.Exclude
    private String body;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private OffsetDateTime occurredAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;
}
