package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.integrations.content.ContentGenerator;
import com.xendex.backend.integrations.content.GenerationResult;
import com.xendex.backend.integrations.content.ResearchContext;
import com.xendex.backend.integrations.content.Strategy;
import com.xendex.backend.integrations.content.TouchContext;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadIntelligence;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.repositories.LeadIntelligenceRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceDefinitionRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.services.content.StrategyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Generates touch-1 drafts for enrolled leads.
 *
 * <p>Each draft commits on its own, and leads that already have a live touch-1 draft are skipped,
 * so re-running the pass after a partial failure only does the remaining work.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DraftingService {

    private static final EnumSet<MembershipStatus> DRAFTABLE = EnumSet.of(MembershipStatus.PENDING, MembershipStatus.ACTIVE);

    enum Outcome {
        CREATED,
        EXISTS,
        NO_RESEARCH,
        CLOSED
    }

    private final SequenceDefinitionRepository sequenceRepository;
    private final SequenceMembershipRepository membershipRepository;
    private final LeadRepository leadRepository;
    private final LeadIntelligenceRepository intelligenceRepository;
    private final DraftStore draftStore;
    private final StrategyEngine strategyEngine;
    private final ContentGenerator contentGenerator;
    private final SequenceEnrollmentService enrollmentService;
    private final DefaultSequenceProvider defaultSequenceProvider;

    public record BatchResult(Long sequenceId, EnrollmentResult enrollment, DraftingPassResult drafting) {
    }

    public DraftingPassResult runDraftingPass(Long sequenceId) {
        if (!sequenceRepository.existsById(sequenceId)) {
            throw ResourceNotFoundException.of("Sequence", sequenceId);
        }
        List<SequenceMembership> memberships = membershipRepository.findAwaitingTouch(sequenceId, DRAFTABLE, 1);
        log.info("Drafting pass for sequence {}: {} memberships awaiting touch 1", sequenceId, memberships.size());
        return draftAll(memberships);
    }

    /**
     * Enrolls the leads (into the system follow-up sequence when none is given) and drafts their
     * first touch right away.
     */
    public BatchResult generateForLeads(List<Long> leadIds, Long sequenceId) {
        Long targetId = sequenceId != null ? sequenceId : defaultSequenceProvider.getOrCreate().getId();
        EnrollmentResult enrollment = enrollmentService.enroll(targetId, leadIds);
        DraftingPassResult drafting = draftForLeads(targetId, leadIds);
        return new BatchResult(targetId, enrollment, drafting);
    }

    /**
     * Drafts touch 1 for specific leads already enrolled in {@code sequenceId}.
     */
    public DraftingPassResult draftForLeads(Long sequenceId, List<Long> leadIds) {
        List<SequenceMembership> memberships = leadIds.stream()
                .map(leadId -> membershipRepository.findBySequenceIdAndLeadId(sequenceId, leadId))
                .flatMap(Optional::stream)
                .filter(m -> DRAFTABLE.contains(m.getStatus()) && m.getCurrentTouch() < 1)
                .toList();
        return draftAll(memberships);
    }

    private DraftingPassResult draftAll(List<SequenceMembership> memberships) {
        int created = 0;
        int existing = 0;
        int noResearch = 0;
        int closed = 0;
        int failed = 0;

        for (SequenceMembership membership : memberships) {
            try {
                switch (draftFirstTouch(membership)) {
                    case CREATED -> created++;
                    case EXISTS -> existing++;
                    case NO_RESEARCH -> noResearch++;
                    case CLOSED -> closed++;
                }
            } catch (DataIntegrityViolationException e) {
                log.debug("Touch-1 draft for lead {} created concurrently", membership.getLeadId());
                existing++;
            } catch (RuntimeException e) {
                log.error("Failed to draft touch 1 for lead {} in sequence {}: {}",
                        membership.getLeadId(), membership.getSequenceId(), e.getMessage(), e);
                failed++;
            }
        }

        DraftingPassResult result = new DraftingPassResult(created, existing, noResearch, closed, failed);
        log.info("Drafting finished: {} created, {} skipped, {} failed", created, result.skipped(), failed);
        return result;
    }

    Outcome draftFirstTouch(SequenceMembership membership) {
        Long leadId = membership.getLeadId();
        Long sequenceId = membership.getSequenceId();

        Optional<Lead> lead = leadRepository.findById(leadId);
        if (lead.isEmpty() || lead.get().getStatus().isClosedForOutreach()) {
            log.debug("Lead {} is closed for outreach, no draft", leadId);
            return Outcome.CLOSED;
        }
        if (draftStore.existsActive(leadId, sequenceId, 1)) {
            return Outcome.EXISTS;
        }
        Optional<LeadIntelligence> intelligence = intelligenceRepository.findByLeadId(leadId);
        if (intelligence.isEmpty()) {
            log.info("Lead {} has no research data yet, skipping draft", leadId);
            return Outcome.NO_RESEARCH;
        }

        ResearchContext research = ResearchContext.from(intelligence.get());
        Strategy strategy = strategyEngine.select(research);
        GenerationResult content = contentGenerator.generate(TouchContext.of(lead.get(), research, strategy, 1));

        DraftStore.Creation creation = draftStore.createIfAbsent(leadId, sequenceId, 1, content,
                strategy.angle().getKey(), null);
        return creation.created() ? Outcome.CREATED : Outcome.EXISTS;
    }
}
