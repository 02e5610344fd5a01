package com.xendex.backend.models.sequence;

import com.xendex.backend.enums.DraftStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Generated message content for one touch of one lead in one sequence.
 *
 * <p>{@code activeKey} is set while the draft is not rejected and cleared on rejection, so the
 * unique constraint on it allows at most one live draft per lead, sequence and touch.
 */
@Entity
@Table(name = "drafts",
        uniqueConstraints = @UniqueConstraint(name = "uk_drafts_active_key", columnNames = "active_key"),
        indexes = @Index(name = "idx_drafts_lead_sequence_touch", columnList = "lead_id, sequence_id, touch_number"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Draft {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lead_id", nullable = false)
    private Long leadId;

    @Column(name = "sequence_id", nullable = false)
    private Long sequenceId;

    @Min(1)
    @Column(name = "touch_number", nullable = false)
    private Integer touchNumber;

    @Column(name = "active_key", length = 100)
    private String activeKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "subject_options", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> subjectOptions = new ArrayList<>();

    @Column(name = "selected_subject", length = 500)
    private String selectedSubject;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String body;

    @Column(length = 50)
    private String angle;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DraftStatus status = DraftStatus.PENDING;

    @Column(name = "fallback_used", nullable = false)
    @Builder.Default
    private boolean fallbackUsed = false;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public static String activeKeyFor(Long leadId, Long sequenceId, int touchNumber) {
        return leadId + ":" + sequenceId + ":" + touchNumber;
    }

    public boolean isPending() {
        return status == DraftStatus.PENDING;
    }

    public boolean isRejected() {
        return status == DraftStatus.REJECTED;
    }

    public void approve(String subject, String approver, OffsetDateTime at) {
        this.status = DraftStatus.APPROVED;
        this.selectedSubject = subject != null && !subject.isBlank() ? subject : defaultSubject();
        this.approvedBy = approver;
        this.approvedAt = at;
    }

    public void reject(String reason) {
        this.status = DraftStatus.REJECTED;
        this.rejectionReason = reason;
        this.activeKey = null;
    }

    /**
     * Subject line the email goes out with.
     */
    public String effectiveSubject() {
        return selectedSubject != null ? selectedSubject : defaultSubject();
    }

    private String defaultSubject() {
        return subjectOptions == null || subjectOptions.isEmpty() ? "Quick question" : subjectOptions.get(0);
    }
}
