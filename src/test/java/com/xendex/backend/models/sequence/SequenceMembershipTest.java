package com.xendex.backend.models.sequence;

import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.exceptions.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequenceMembershipTest {

    @Test
    void pending_ShouldStartAtTouchZero() {
        SequenceMembership membership = SequenceMembership.pending(1L, 2L);

        assertThat(membership.getStatus()).isEqualTo(MembershipStatus.PENDING);
        assertThat(membership.getCurrentTouch()).isZero();
    }

    @Test
    void readyAfterFirstTouch_ShouldPickUpAtTouchOne() {
        SequenceMembership membership = SequenceMembership.readyAfterFirstTouch(1L, 2L);

        assertThat(membership.getStatus()).isEqualTo(MembershipStatus.READY);
        assertThat(membership.getCurrentTouch()).isEqualTo(1);
    }

    @Test
    void advanceTo_LowerTouch_ShouldKeepCurrentTouch() {
        SequenceMembership membership = SequenceMembership.pending(1L, 2L);
        membership.advanceTo(3);

        membership.advanceTo(2);

        assertThat(membership.getCurrentTouch()).isEqualTo(3);
    }

    @Test
    void stop_ShouldClearNextTouchAndKeepReason() {
        SequenceMembership membership = SequenceMembership.pending(1L, 2L);
        membership.activate();
        membership.scheduleNextTouch(OffsetDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));

        boolean stopped = membership.stop("replied");

        assertThat(stopped).isTrue();
        assertThat(membership.getStatus()).isEqualTo(MembershipStatus.STOPPED);
        assertThat(membership.getStoppedReason()).isEqualTo("replied");
        assertThat(membership.getNextTouchAt()).isNull();
    }

    @Test
    void stop_AlreadyStopped_ShouldKeepFirstReason() {
        SequenceMembership membership = SequenceMembership.pending(1L, 2L);
        membership.stop("replied");

        boolean stoppedAgain = membership.stop("bounced");

        assertThat(stoppedAgain).isFalse();
        assertThat(membership.getStoppedReason()).isEqualTo("replied");
    }

    @Test
    void activate_StoppedMembership_ShouldThrow() {
        SequenceMembership membership = SequenceMembership.pending(1L, 2L);
        membership.stop("replied");

        assertThatThrownBy(membership::activate).isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(membership::markReady).isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(membership::complete).isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void complete_ActiveMembership_ShouldBeTerminal() {
        SequenceMembership membership = SequenceMembership.pending(1L, 2L);
        membership.activate();

        membership.complete();

        assertThat(membership.isTerminal()).isTrue();
        assertThat(membership.stop("replied")).isFalse();
    }
}
