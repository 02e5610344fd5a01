package com.xendex.backend.services.sequence;

import com.xendex.backend.dto.sequence.request.CreateSequenceRequest;
import com.xendex.backend.dto.sequence.request.UpdateSequenceRequest;
import com.xendex.backend.enums.DraftStatus;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.enums.SequenceStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.exceptions.SequenceConflictException;
import com.xendex.backend.integrations.content.ContentGenerator;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.models.sequence.SequenceDefinition;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.repositories.LeadIntelligenceRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.DraftRepository;
import com.xendex.backend.repositories.sequence.SequenceDefinitionRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.scheduler.DelayedTaskScheduler;
import com.xendex.backend.services.content.StrategyEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

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
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SequenceAdminServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-05T09:00:00Z");

    @Mock
    private SequenceDefinitionRepository sequenceRepository;

    @Mock
    private SequenceMembershipRepository membershipRepository;

    @Mock
    private DraftRepository draftRepository;

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private LeadIntelligenceRepository intelligenceRepository;

    @Mock
    private SequenceProgressionService progressionService;

    @Mock
    private DelayedTaskScheduler taskScheduler;

    @Mock
    private DraftStore draftStore;

    @Mock
    private StrategyEngine strategyEngine;

    @Mock
    private ContentGenerator contentGenerator;

    private SequenceAdminService adminService;
    private SequenceDefinition sequence;

    @BeforeEach
    void setUp() {
        adminService = new SequenceAdminService(sequenceRepository, membershipRepository, draftRepository,
                leadRepository, intelligenceRepository, progressionService, taskScheduler, draftStore,
                strategyEngine, contentGenerator, Clock.fixed(NOW, ZoneOffset.UTC));

        sequence = SequenceDefinition.builder()
                .id(1L)
                .name("Q1 outreach")
                .touches(3)
                .touchDelays(List.of(3, 5))
                .status(SequenceStatus.DRAFT)
                .build();
    }

    @Test
    void create_ShouldStartInDraftStatus() {
        // given
        CreateSequenceRequest request = new CreateSequenceRequest();
        request.setName("  Q2 outreach ");
        request.setTouches(4);
        when(sequenceRepository.save(any(SequenceDefinition.class))).thenAnswer(inv -> inv.getArgument(0));

        // when
        SequenceDefinition created = adminService.create(request);

        // then
        assertThat(created.getName()).isEqualTo("Q2 outreach");
        assertThat(created.getStatus()).isEqualTo(SequenceStatus.DRAFT);
        assertThat(created.getTouchDelays()).containsExactly(3, 5);
        assertThat(created.isSystem()).isFalse();
    }

    @Test
    void list_DefaultFilter_ShouldHideSystemSequences() {
        // given
        SequenceDefinition system = SequenceDefinition.builder().id(2L).externalId("DEFAULT-FOLLOWUP")
                .name("Default Follow-up").build();
        when(sequenceRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(sequence, system));

        // when / then
        assertThat(adminService.list(null, null)).containsExactly(sequence);
        assertThat(adminService.list(null, "system")).containsExactly(system);
        assertThat(adminService.list(null, "all")).hasSize(2);
        assertThatThrownBy(() -> adminService.list(null, "archived")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void update_TouchesAfterSending_ShouldConflict() {
        // given
        UpdateSequenceRequest request = new UpdateSequenceRequest();
        request.setTouches(5);
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));
        when(membershipRepository.anyTouchSent(1L)).thenReturn(true);

        // when / then
        assertThatThrownBy(() -> adminService.update(1L, request))
                .isInstanceOf(SequenceConflictException.class)
                .extracting("code").isEqualTo("TOUCHES_LOCKED");
        verify(sequenceRepository, never()).save(any());
    }

    @Test
    void update_RenameSystemSequence_ShouldConflict() {
        // given
        sequence.setExternalId("DEFAULT-FOLLOWUP");
        UpdateSequenceRequest request = new UpdateSequenceRequest();
        request.setName("Renamed");
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));

        // when / then
        assertThatThrownBy(() -> adminService.update(1L, request))
                .isInstanceOf(SequenceConflictException.class)
                .extracting("code").isEqualTo("SYSTEM_SEQUENCE");
    }

    @Test
    void start_ShouldActivatePendingAndChainReadyMembers() {
        // given
        OffsetDateTime lastContacted = OffsetDateTime.parse("2025-03-03T09:00:00Z");
        SequenceMembership pending = SequenceMembership.pending(1L, 10L);
        SequenceMembership ready = SequenceMembership.readyAfterFirstTouch(1L, 11L);
        Lead contacted = Lead.builder().id(11L).status(LeadStatus.CONTACTED).lastContactedAt(lastContacted).build();

        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));
        when(membershipRepository.findBySequenceIdAndStatusIn(1L,
                List.of(MembershipStatus.PENDING, MembershipStatus.READY))).thenReturn(List.of(pending, ready));
        when(leadRepository.findById(11L)).thenReturn(Optional.of(contacted));

        // when
        StartResult result = adminService.start(1L);

        // then
        assertThat(sequence.getStatus()).isEqualTo(SequenceStatus.ACTIVE);
        assertThat(result.activated()).isEqualTo(2);
        assertThat(result.followUpsScheduled()).isEqualTo(1);
        assertThat(pending.getStatus()).isEqualTo(MembershipStatus.ACTIVE);
        assertThat(contacted.getStatus()).isEqualTo(LeadStatus.SEQUENCING);
        verify(progressionService).scheduleFollowUp(ready, sequence, 1, lastContacted);
        verify(taskScheduler).schedule(eq(TaskType.DRAFTING_PASS), any(), eq(Duration.ZERO));
    }

    @Test
    void start_CompletedSequence_ShouldConflict() {
        // given
        sequence.setStatus(SequenceStatus.COMPLETED);
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));

        // when / then
        assertThatThrownBy(() -> adminService.start(1L)).isInstanceOf(SequenceConflictException.class);
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void pause_DraftSequence_ShouldConflict() {
        // given
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));

        // when / then
        assertThatThrownBy(() -> adminService.pause(1L))
                .isInstanceOf(SequenceConflictException.class)
                .extracting("code").isEqualTo("NOT_ACTIVE");
    }

    @Test
    void delete_ActiveSequence_ShouldConflict() {
        // given
        sequence.setStatus(SequenceStatus.ACTIVE);
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));

        // when / then
        assertThatThrownBy(() -> adminService.delete(1L))
                .isInstanceOf(SequenceConflictException.class)
                .extracting("code").isEqualTo("SEQUENCE_ACTIVE");
        verify(sequenceRepository, never()).delete(any());
    }

    @Test
    void delete_PausedWithoutActiveMembers_ShouldRemovePendingDraftsAndMembers() {
        // given
        sequence.setStatus(SequenceStatus.PAUSED);
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));
        when(membershipRepository.existsBySequenceIdAndStatus(1L, MembershipStatus.ACTIVE)).thenReturn(false);

        // when
        adminService.delete(1L);

        // then
        verify(draftRepository).deleteBySequenceIdAndStatus(1L, DraftStatus.PENDING);
        verify(membershipRepository).deleteBySequenceId(1L);
        verify(sequenceRepository).delete(sequence);
    }

    @Test
    void triggerFollowUp_BeyondTouchLimit_ShouldConflict() {
        // given
        SequenceMembership membership = SequenceMembership.pending(1L, 10L);
        membership.advanceTo(3);
        membership.activate();
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));
        when(membershipRepository.findBySequenceIdAndLeadId(1L, 10L)).thenReturn(Optional.of(membership));

        // when / then
        assertThatThrownBy(() -> adminService.triggerFollowUp(1L, 10L))
                .isInstanceOf(SequenceConflictException.class)
                .extracting("code").isEqualTo("MAX_TOUCHES_EXCEEDED");
        verifyNoInteractions(contentGenerator);
    }

    @Test
    void triggerFollowUp_DraftAlreadyExists_ShouldReturnIt() {
        // given
        SequenceMembership membership = SequenceMembership.readyAfterFirstTouch(1L, 10L);
        Draft existing = Draft.builder().id(600L).leadId(10L).sequenceId(1L).touchNumber(2).build();
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));
        when(membershipRepository.findBySequenceIdAndLeadId(1L, 10L)).thenReturn(Optional.of(membership));
        when(draftStore.findActive(10L, 1L, 2)).thenReturn(Optional.of(existing));

        // when
        Draft draft = adminService.triggerFollowUp(1L, 10L);

        // then
        assertThat(draft).isSameAs(existing);
        verify(draftStore, never()).createIfAbsent(any(), any(), anyInt(), any(), any(), any());
    }

    @Test
    void triggerFollowUp_StoppedMembership_ShouldConflict() {
        // given
        SequenceMembership membership = SequenceMembership.readyAfterFirstTouch(1L, 10L);
        membership.stop("replied");
        when(sequenceRepository.findById(1L)).thenReturn(Optional.of(sequence));
        when(membershipRepository.findBySequenceIdAndLeadId(1L, 10L)).thenReturn(Optional.of(membership));

        // when / then
        assertThatThrownBy(() -> adminService.triggerFollowUp(1L, 10L))
                .isInstanceOf(SequenceConflictException.class)
                .extracting("code").isEqualTo("MEMBERSHIP_FINISHED");
    }
}
