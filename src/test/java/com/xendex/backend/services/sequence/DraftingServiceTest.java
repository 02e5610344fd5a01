package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.CallToAction;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.SequenceStatus;
import com.xendex.backend.enums.StrategyAngle;
import com.xendex.backend.exceptions.CollaboratorException;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.integrations.content.ContentGenerator;
import com.xendex.backend.integrations.content.GenerationResult;
import com.xendex.backend.integrations.content.Strategy;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadIntelligence;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.models.sequence.SequenceDefinition;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.repositories.LeadIntelligenceRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceDefinitionRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.services.content.StrategyEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DraftingServiceTest {

    @Mock
    private SequenceDefinitionRepository sequenceRepository;

    @Mock
    private SequenceMembershipRepository membershipRepository;

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private LeadIntelligenceRepository intelligenceRepository;

    @Mock
    private DraftStore draftStore;

    @Mock
    private StrategyEngine strategyEngine;

    @Mock
    private ContentGenerator contentGenerator;

    @Mock
    private SequenceEnrollmentService enrollmentService;

    @Mock
    private DefaultSequenceProvider defaultSequenceProvider;

    @InjectMocks
    private DraftingService draftingService;

    private Lead ana;
    private Lead ben;
    private GenerationResult content;

    @BeforeEach
    void setUp() {
        ana = Lead.builder().id(10L).firstName("Ana").status(LeadStatus.QUALIFIED).build();
        ben = Lead.builder().id(11L).firstName("Ben").status(LeadStatus.QUALIFIED).build();
        content = GenerationResult.generated(List.of("Quick idea"), "Hi, ...");

        lenient().when(strategyEngine.select(any()))
                .thenReturn(new Strategy(StrategyAngle.VALUE_INSIGHT, CallToAction.REPLY, "professional", null));
    }

    @Test
    void runDraftingPass_RerunAfterPartialFailure_ShouldOnlyDraftRemainingLeads() {
        // given
        List<SequenceMembership> awaiting = List.of(SequenceMembership.pending(1L, 10L),
                SequenceMembership.pending(1L, 11L));
        when(sequenceRepository.existsById(1L)).thenReturn(true);
        when(membershipRepository.findAwaitingTouch(eq(1L), any(), eq(1))).thenReturn(awaiting);
        when(leadRepository.findById(10L)).thenReturn(Optional.of(ana));
        when(leadRepository.findById(11L)).thenReturn(Optional.of(ben));
        when(intelligenceRepository.findByLeadId(anyLong()))
                .thenReturn(Optional.of(LeadIntelligence.builder().industry("Retail").build()));
        when(draftStore.existsActive(10L, 1L, 1)).thenReturn(false, true);
        when(draftStore.existsActive(11L, 1L, 1)).thenReturn(false, false);
        when(contentGenerator.generate(any()))
                .thenReturn(content)
                .thenThrow(new CollaboratorException("model unavailable"))
                .thenReturn(content);
        when(draftStore.createIfAbsent(anyLong(), eq(1L), eq(1), eq(content), eq("value_insight"), eq(null)))
                .thenReturn(new DraftStore.Creation(Draft.builder().id(1L).build(), true));

        // when
        DraftingPassResult first = draftingService.runDraftingPass(1L);
        DraftingPassResult second = draftingService.runDraftingPass(1L);

        // then
        assertThat(first.created()).isEqualTo(1);
        assertThat(first.failed()).isEqualTo(1);
        assertThat(second.created()).isEqualTo(1);
        assertThat(second.skippedExisting()).isEqualTo(1);
        assertThat(second.failed()).isZero();
        verify(draftStore, times(1)).createIfAbsent(eq(10L), anyLong(), anyInt(), any(), any(), any());
        verify(draftStore, times(1)).createIfAbsent(eq(11L), anyLong(), anyInt(), any(), any(), any());
    }

    @Test
    void runDraftingPass_ConcurrentInsert_ShouldCountAsExisting() {
        // given
        when(sequenceRepository.existsById(1L)).thenReturn(true);
        when(membershipRepository.findAwaitingTouch(eq(1L), any(), eq(1)))
                .thenReturn(List.of(SequenceMembership.pending(1L, 10L)));
        when(leadRepository.findById(10L)).thenReturn(Optional.of(ana));
        when(intelligenceRepository.findByLeadId(10L))
                .thenReturn(Optional.of(LeadIntelligence.builder().industry("Retail").build()));
        when(contentGenerator.generate(any())).thenReturn(content);
        when(draftStore.createIfAbsent(anyLong(), anyLong(), anyInt(), any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("uk_drafts_active_key"));

        // when
        DraftingPassResult result = draftingService.runDraftingPass(1L);

        // then
        assertThat(result.skippedExisting()).isEqualTo(1);
        assertThat(result.failed()).isZero();
    }

    @Test
    void runDraftingPass_LeadWithoutResearchOrClosed_ShouldBeSkipped() {
        // given
        ben.setStatus(LeadStatus.REPLIED);
        when(sequenceRepository.existsById(1L)).thenReturn(true);
        when(membershipRepository.findAwaitingTouch(eq(1L), any(), eq(1)))
                .thenReturn(List.of(SequenceMembership.pending(1L, 10L), SequenceMembership.pending(1L, 11L)));
        when(leadRepository.findById(10L)).thenReturn(Optional.of(ana));
        when(leadRepository.findById(11L)).thenReturn(Optional.of(ben));
        when(intelligenceRepository.findByLeadId(10L)).thenReturn(Optional.empty());

        // when
        DraftingPassResult result = draftingService.runDraftingPass(1L);

        // then
        assertThat(result.skippedNoResearch()).isEqualTo(1);
        assertThat(result.skippedClosed()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(2);
        verify(contentGenerator, never()).generate(any());
    }

    @Test
    void runDraftingPass_UnknownSequence_ShouldThrowNotFound() {
        // given
        when(sequenceRepository.existsById(9L)).thenReturn(false);

        // when / then
        assertThatThrownBy(() -> draftingService.runDraftingPass(9L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void generateForLeads_WithoutSequence_ShouldUseDefaultSequence() {
        // given
        SequenceDefinition defaultSequence = SequenceDefinition.builder()
                .id(3L).externalId("DEFAULT-FOLLOWUP").name("Default Follow-up").status(SequenceStatus.ACTIVE).build();
        when(defaultSequenceProvider.getOrCreate()).thenReturn(defaultSequence);
        when(enrollmentService.enroll(3L, List.of(10L))).thenReturn(new EnrollmentResult(1, 0, List.of()));
        when(membershipRepository.findBySequenceIdAndLeadId(3L, 10L))
                .thenReturn(Optional.of(SequenceMembership.pending(3L, 10L)));
        when(leadRepository.findById(10L)).thenReturn(Optional.of(ana));
        when(intelligenceRepository.findByLeadId(10L))
                .thenReturn(Optional.of(LeadIntelligence.builder().industry("Retail").build()));
        when(contentGenerator.generate(any())).thenReturn(content);
        when(draftStore.createIfAbsent(10L, 3L, 1, content, "value_insight", null))
                .thenReturn(new DraftStore.Creation(Draft.builder().id(5L).build(), true));

        // when
        DraftingService.BatchResult result = draftingService.generateForLeads(List.of(10L), null);

        // then
        assertThat(result.sequenceId()).isEqualTo(3L);
        assertThat(result.enrollment().added()).isEqualTo(1);
        assertThat(result.drafting().created()).isEqualTo(1);
    }
}
