package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.StrategyAngle;
import com.xendex.backend.exceptions.InvalidStateTransitionException;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.exceptions.SequenceConflictException;
import com.xendex.backend.integrations.content.ContentGenerator;
import com.xendex.backend.integrations.content.GenerationResult;
import com.xendex.backend.integrations.content.ResearchContext;
import com.xendex.backend.integrations.content.Strategy;
import com.xendex.backend.integrations.content.TouchContext;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadIntelligence;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.repositories.LeadIntelligenceRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.services.EventLogService;
import com.xendex.backend.services.content.StrategyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Human review of drafts: approve (which sends and schedules), reject, edit, regenerate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DraftApprovalService {

    private final DraftStore draftStore;
    private final EventLogService eventLogService;
    private final LeadRepository leadRepository;
    private final LeadIntelligenceRepository intelligenceRepository;
    private final SequenceMembershipRepository membershipRepository;
    private final TouchDispatchService dispatchService;
    private final SequenceProgressionService progressionService;
    private final StrategyEngine strategyEngine;
    private final ContentGenerator contentGenerator;

    /**
     * Approve, send, then run the scheduling step for the touch. A failed send leaves the draft
     * approved with nothing scheduled; approving again retries the send.
     */
    public ApprovalResult approve(Long draftId, String selectedSubject, String approvedBy) {
        Draft draft = draftStore.get(draftId);
        if (eventLogService.isDraftSent(draftId)) {
            return alreadySent(draft);
        }
        requireLeadReachable(draft);

        draft = draftStore.approve(draftId, selectedSubject, approvedBy);
        DispatchResult dispatch = dispatchService.dispatch(draft);

        return switch (dispatch.status()) {
            case ALREADY_SENT -> alreadySent(draft);
            case FAILED -> {
                log.warn("Draft {} approved but not sent: {}", draftId, dispatch.error());
                yield new ApprovalResult(draftId, ApprovalResult.Status.SEND_FAILED, null, dispatch.error(), null);
            }
            case SENT -> {
                SequenceProgressionService.Step step = progressionService.onTouchSent(draft, dispatch.sentAt());
                yield new ApprovalResult(draftId, ApprovalResult.Status.SENT, dispatch.messageId(), null, step);
            }
        };
    }

    /**
     * Approves each draft in turn. One draft failing does not stop the rest.
     */
    public BulkApprovalResult bulkApprove(List<Long> draftIds, String approvedBy) {
        List<ApprovalResult> results = new ArrayList<>();
        int approved = 0;
        for (Long draftId : draftIds) {
            ApprovalResult result;
            try {
                result = approve(draftId, null, approvedBy);
            } catch (ResourceNotFoundException | InvalidStateTransitionException e) {
                log.info("Bulk approval skipped draft {}: {}", draftId, e.getMessage());
                result = new ApprovalResult(draftId, ApprovalResult.Status.REJECTED_BY_STATE, null, e.getMessage(), null);
            }
            if (result.isSent()) {
                approved++;
            }
            results.add(result);
        }
        log.info("Bulk approval by {}: {} of {} drafts sent", approvedBy, approved, draftIds.size());
        return new BulkApprovalResult(approved, draftIds.size() - approved, results);
    }

    public Draft reject(Long draftId, String reason) {
        requireNotSent(draftId);
        return draftStore.reject(draftId, reason);
    }

    public Draft updateContent(Long draftId, List<String> subjectOptions, String selectedSubject, String body) {
        return draftStore.updateContent(draftId, subjectOptions, selectedSubject, body);
    }

    /**
     * Re-runs generation for the same lead and touch, optionally forcing an angle.
     */
    public Draft regenerate(Long draftId, StrategyAngle angleOverride) {
        Draft draft = draftStore.get(draftId);
        requireNotSent(draftId);

        Lead lead = leadRepository.findById(draft.getLeadId())
                .orElseThrow(() -> ResourceNotFoundException.of("Lead", draft.getLeadId()));
        LeadIntelligence intelligence = intelligenceRepository.findByLeadId(lead.getId())
                .orElseThrow(() -> new IllegalArgumentException("Lead " + lead.getId() + " has no research data"));

        ResearchContext research = ResearchContext.from(intelligence);
        Strategy strategy = strategyEngine.select(research, angleOverride);
        GenerationResult content = contentGenerator.generate(
                TouchContext.of(lead, research, strategy, draft.getTouchNumber()));

        log.info("Regenerated draft {} with angle {}", draftId, strategy.angle().getKey());
        return draftStore.replaceContent(draftId, content, strategy.angle().getKey());
    }

    /**
     * A repeat approval of a sent draft finishes the scheduling step if it never committed.
     */
    private ApprovalResult alreadySent(Draft draft) {
        SequenceProgressionService.Step resumed = eventLogService.findSentAt(draft.getId())
                .flatMap(sentAt -> progressionService.resumeAfterSend(draft, sentAt))
                .orElse(null);
        return new ApprovalResult(draft.getId(), ApprovalResult.Status.ALREADY_SENT, null, null, resumed);
    }

    private void requireNotSent(Long draftId) {
        if (eventLogService.isDraftSent(draftId)) {
            throw new SequenceConflictException("DRAFT_ALREADY_SENT", "Draft " + draftId + " has already been sent");
        }
    }

    private void requireLeadReachable(Draft draft) {
        Lead lead = leadRepository.findById(draft.getLeadId())
                .orElseThrow(() -> ResourceNotFoundException.of("Lead", draft.getLeadId()));
        if (lead.getStatus().isClosedForOutreach()) {
            throw new InvalidStateTransitionException("Lead " + lead.getId() + " is " + lead.getStatus()
                    + ", draft " + draft.getId() + " cannot be sent");
        }
        membershipRepository.findBySequenceIdAndLeadId(draft.getSequenceId(), draft.getLeadId())
                .filter(m -> m.isTerminal())
                .ifPresent(m -> {
                    throw new InvalidStateTransitionException("Membership for lead " + lead.getId()
                            + " is " + m.getStatus() + ", draft " + draft.getId() + " cannot be sent");
                });
    }
}
