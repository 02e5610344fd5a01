package com.xendex.backend.models.sequence;

import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.exceptions.InvalidStateTransitionException;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * A lead's progress through one sequence. {@code currentTouch} only ever increases and
 * STOPPED is terminal, so the state-changing methods below are the only writers.
 */
@Entity
@Table(name = "sequence_memberships",
        uniqueConstraints = @UniqueConstraint(name = "uk_membership_sequence_lead",
                columnNames = {"sequence_id", "lead_id"}),
        indexes = @Index(name = "idx_membership_lead_status", columnList = "lead_id, status"))
public class SequenceMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "sequence_id", nullable = false)
    private Long sequenceId;

    @NotNull
    @Column(name = "lead_id", nullable = false)
    private Long leadId;

    @Min(0)
    @Column(name = "current_touch", nullable = false)
    private Integer currentTouch = 0;

    @Column(name = "next_touch_at")
    private OffsetDateTime nextTouchAt;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MembershipStatus status = MembershipStatus.PENDING;

    @Column(name = "stopped_reason", length = 100)
    private String stoppedReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    // Constructors
    protected SequenceMembership() {}

    public SequenceMembership(Long sequenceId, Long leadId) {
        this.sequenceId = sequenceId;
        this.leadId = leadId;
    }

    public static SequenceMembership pending(Long sequenceId, Long leadId) {
        return new SequenceMembership(sequenceId, leadId);
    }

    /**
     * Membership for a lead whose first email went out before enrollment; picks up at touch 2.
     */
    public static SequenceMembership readyAfterFirstTouch(Long sequenceId, Long leadId) {
        SequenceMembership membership = new SequenceMembership(sequenceId, leadId);
        membership.status = MembershipStatus.READY;
        membership.currentTouch = 1;
        return membership;
    }

    // Getters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getSequenceId() {
        return sequenceId;
    }

    public Long getLeadId() {
        return leadId;
    }

    public Integer getCurrentTouch() {
        return currentTouch;
    }

    public OffsetDateTime getNextTouchAt() {
        return nextTouchAt;
    }

    public MembershipStatus getStatus() {
        return status;
    }

    public String getStoppedReason() {
        return stoppedReason;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    // State transitions
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isStopped() {
        return status == MembershipStatus.STOPPED;
    }

    /**
     * Records that {@code touch} has been sent. Lower values are ignored.
     */
    public void advanceTo(int touch) {
        if (touch > currentTouch) {
            this.currentTouch = touch;
        }
    }

    /**
     * Whether a send of {@code touch} is not reflected here yet. Touch 1 moves a pending
     * membership to active; later touches raise {@code currentTouch}.
     */
    public boolean awaitsProgressionFor(int touch) {
        if (isTerminal()) {
            return false;
        }
        return touch == 1 ? status == MembershipStatus.PENDING : currentTouch < touch;
    }

    public void activate() {
        requireNotTerminal(MembershipStatus.ACTIVE);
        this.status = MembershipStatus.ACTIVE;
    }

    public void markReady() {
        requireNotTerminal(MembershipStatus.READY);
        this.status = MembershipStatus.READY;
    }

    public void scheduleNextTouch(OffsetDateTime at) {
        this.nextTouchAt = at;
    }

    public void complete() {
        if (isStopped()) {
            throw new InvalidStateTransitionException("Cannot complete stopped membership " + id);
        }
        this.status = MembershipStatus.COMPLETED;
        this.nextTouchAt = null;
    }

    /**
     * Stops the membership for good. Returns false when it was already finished.
     */
    public boolean stop(String reason) {
        if (isTerminal()) {
            return false;
        }
        this.status = MembershipStatus.STOPPED;
        this.stoppedReason = reason;
        this.nextTouchAt = null;
        return true;
    }

    private void requireNotTerminal(MembershipStatus target) {
        if (isTerminal()) {
            throw new InvalidStateTransitionException(
                    "Membership " + id + " is " + status + " and cannot move to " + target);
        }
    }

    @Override
    public String toString() {
        return "SequenceMembership{" +
                "id=" + id +
                ", sequenceId=" + sequenceId +
                ", leadId=" + leadId +
                ", currentTouch=" + currentTouch +
                ", status=" + status +
                ", nextTouchAt=" + nextTouchAt +
                '}';
    }
}
