package com.xendex.backend.services.sequence;

import com.xendex.backend.config.SequenceProperties;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.exceptions.CollaboratorException;
import com.xendex.backend.integrations.content.ContentGenerator;
import com.xendex.backend.integrations.content.GenerationResult;
import com.xendex.backend.integrations.content.ResearchContext;
import com.xendex.backend.integrations.content.Strategy;
import com.xendex.backend.integrations.content.TouchContext;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadIntelligence;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.models.sequence.SequenceDefinition;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.models.task.ScheduledTask;
import com.xendex.backend.models.task.TaskPayload;
import com.xendex.backend.repositories.LeadIntelligenceRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceDefinitionRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.scheduler.TaskHandler;
import com.xendex.backend.scheduler.TaskOutcome;
import com.xendex.backend.services.EventLogService;
import com.xendex.backend.services.content.StrategyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Produces and sends touch {@code n + 1} once the delay after touch {@code n} has passed.
 *
 * <p>Delivered at least once and possibly racing an incoming reply, so every run re-checks
 * membership status, the event log and the touch limit before doing anything, and reuses an
 * existing draft for the touch instead of generating a second one. Cancellation is only ever
 * this check on wake.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FollowUpTaskHandler implements TaskHandler {

    static final String AUTO_APPROVER = "system:follow-up";

    private final SequenceMembershipRepository membershipRepository;
    private final SequenceDefinitionRepository sequenceRepository;
    private final LeadRepository leadRepository;
    private final LeadIntelligenceRepository intelligenceRepository;
    private final EventLogService eventLogService;
    private final DraftStore draftStore;
    private final StrategyEngine strategyEngine;
    private final ContentGenerator contentGenerator;
    private final TouchDispatchService dispatchService;
    private final SequenceProgressionService progressionService;
    private final SequenceProperties sequenceProperties;

    @Override
    public TaskType getTaskType() {
        return TaskType.FOLLOW_UP;
    }

    @Override
    public TaskOutcome handle(ScheduledTask task) {
        TaskPayload payload = task.getPayload();
        Long leadId = payload.getLeadId();
        Long sequenceId = payload.getSequenceId();
        int nextTouch = payload.getTouchNumber() + 1;

        Optional<SequenceMembership> membership = membershipRepository.findBySequenceIdAndLeadId(sequenceId, leadId);
        if (membership.isEmpty()) {
            return TaskOutcome.aborted("membership_missing");
        }
        if (membership.get().isTerminal()) {
            log.info("Follow-up for lead {} skipped, membership is {}", leadId, membership.get().getStatus());
            return TaskOutcome.aborted("membership_" + membership.get().getStatus().name().toLowerCase());
        }

        if (eventLogService.hasReplySince(leadId, payload.getReferenceTime())) {
            log.info("Lead {} replied since touch {}, follow-up cancelled", leadId, payload.getTouchNumber());
            return TaskOutcome.aborted("replied");
        }

        Optional<SequenceDefinition> found = sequenceRepository.findById(sequenceId);
        if (found.isEmpty()) {
            return TaskOutcome.aborted("sequence_missing");
        }
        SequenceDefinition sequence = found.get();
        if (sequence.getStatus().isPaused()) {
            log.debug("Sequence {} paused, deferring follow-up for lead {}", sequenceId, leadId);
            return TaskOutcome.deferred(sequenceProperties.pausedRecheck(), "sequence_paused");
        }
        if (!sequence.isActive()) {
            return TaskOutcome.aborted("sequence_" + sequence.getStatus().name().toLowerCase());
        }
        if (nextTouch > sequence.getTouches()) {
            log.info("Sequence {} exhausted for lead {} at touch {}", sequenceId, leadId, payload.getTouchNumber());
            return TaskOutcome.aborted("touch_limit_reached");
        }

        Optional<Lead> lead = leadRepository.findById(leadId);
        if (lead.isEmpty()) {
            return TaskOutcome.aborted("lead_missing");
        }
        if (lead.get().getStatus().isClosedForOutreach()) {
            return TaskOutcome.aborted("lead_" + lead.get().getStatus().name().toLowerCase());
        }

        Optional<Draft> draft = draftStore.findActive(leadId, sequenceId, nextTouch);
        if (draft.isEmpty()) {
            Optional<LeadIntelligence> intelligence = intelligenceRepository.findByLeadId(leadId);
            if (intelligence.isEmpty()) {
                log.warn("Lead {} has no research data, cannot produce touch {}", leadId, nextTouch);
                return TaskOutcome.aborted("no_research");
            }
            try {
                draft = Optional.of(generateApproved(lead.get(), intelligence.get(), sequenceId, nextTouch));
            } catch (DataIntegrityViolationException e) {
                log.warn("Concurrent draft creation for lead {} touch {}: {}", leadId, nextTouch, e.getMessage());
                draft = draftStore.findActive(leadId, sequenceId, nextTouch);
                if (draft.isEmpty()) {
                    throw new CollaboratorException("Draft for lead " + leadId + " touch " + nextTouch
                            + " collided but cannot be found", e);
                }
            }
        }

        Draft toSend = draft.get();
        if (eventLogService.isDraftSent(toSend.getId())) {
            return resumeAfterEarlierSend(toSend);
        }
        if (toSend.isPending()) {
            toSend = draftStore.approve(toSend.getId(), null, AUTO_APPROVER);
        }

        DispatchResult dispatch = dispatchService.dispatch(toSend);
        switch (dispatch.status()) {
            case ALREADY_SENT:
                return resumeAfterEarlierSend(toSend);
            case FAILED:
                if (dispatch.retryable()) {
                    throw new CollaboratorException("Send of touch " + nextTouch + " to lead " + leadId
                            + " failed: " + dispatch.error());
                }
                return TaskOutcome.aborted("send_rejected_" + dispatch.error());
            default:
                break;
        }

        SequenceProgressionService.Step step = progressionService.onTouchSent(toSend, dispatch.sentAt());
        return TaskOutcome.completed("touch " + nextTouch + " sent, " + step.name().toLowerCase());
    }

    /**
     * The touch went out on an earlier delivery. Progression is re-run when it did not commit
     * after that send; otherwise the redelivery is a duplicate.
     */
    private TaskOutcome resumeAfterEarlierSend(Draft sent) {
        Optional<SequenceProgressionService.Step> resumed = eventLogService.findSentAt(sent.getId())
                .flatMap(sentAt -> progressionService.resumeAfterSend(sent, sentAt));
        if (resumed.isEmpty()) {
            log.warn("Touch {} for lead {} already sent (draft {}), redelivery aborted",
                    sent.getTouchNumber(), sent.getLeadId(), sent.getId());
            return TaskOutcome.aborted("already_sent");
        }
        return TaskOutcome.completed("touch " + sent.getTouchNumber() + " already sent, "
                + resumed.get().name().toLowerCase());
    }

    private Draft generateApproved(Lead lead, LeadIntelligence intelligence, Long sequenceId, int touchNumber) {
        ResearchContext research = ResearchContext.from(intelligence);
        Strategy strategy = strategyEngine.select(research);
        GenerationResult content = contentGenerator.generate(TouchContext.of(lead, research, strategy, touchNumber));

        return draftStore.createIfAbsent(lead.getId(), sequenceId, touchNumber, content,
                strategy.angle().getKey(), AUTO_APPROVER).draft();
    }
}
