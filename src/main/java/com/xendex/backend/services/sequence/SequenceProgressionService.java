package com.xendex.backend.services.sequence;

import com.xendex.backend.config.SequenceProperties;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.models.sequence.SequenceDefinition;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.models.task.TaskPayload;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceDefinitionRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.scheduler.DelayedTaskScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Decides what happens after a touch has been sent: confirm touch 1, schedule the next
 * follow-up, or finish the sequence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SequenceProgressionService {

    public enum Step {
        CONFIRMATION_SCHEDULED,
        FOLLOW_UP_SCHEDULED,
        COMPLETED,
        SKIPPED
    }

    private final LeadRepository leadRepository;
    private final SequenceDefinitionRepository sequenceRepository;
    private final SequenceMembershipRepository membershipRepository;
    private final DelayedTaskScheduler taskScheduler;
    private final SequenceProperties sequenceProperties;
    private final Clock clock;

    @Transactional
    public Step onTouchSent(Draft draft, OffsetDateTime sentAt) {
        Lead lead = leadRepository.findById(draft.getLeadId())
                .orElseThrow(() -> ResourceNotFoundException.of("Lead", draft.getLeadId()));
        SequenceDefinition sequence = sequenceRepository.findById(draft.getSequenceId())
                .orElseThrow(() -> ResourceNotFoundException.of("Sequence", draft.getSequenceId()));

        lead.setLastContactedAt(sentAt);
        leadRepository.save(lead);

        Optional<SequenceMembership> found =
                membershipRepository.findBySequenceIdAndLeadId(sequence.getId(), lead.getId());
        if (found.isEmpty()) {
            log.warn("Touch {} sent to lead {} outside any membership of sequence {}",
                    draft.getTouchNumber(), lead.getId(), sequence.getId());
            return Step.SKIPPED;
        }

        SequenceMembership membership = found.get();
        if (membership.isTerminal()) {
            // check-then-act gap: a reply or stop landed while the send was in flight
            log.warn("Touch {} sent to lead {} but membership {} is already {}, nothing scheduled",
                    draft.getTouchNumber(), lead.getId(), membership.getId(), membership.getStatus());
            return Step.SKIPPED;
        }

        int touch = draft.getTouchNumber();
        if (touch == 1) {
            return afterFirstTouch(lead, membership, draft, sentAt);
        }
        return afterFollowUp(lead, sequence, membership, Math.min(touch, sequence.getTouches()), sentAt);
    }

    /**
     * Runs {@link #onTouchSent} again for a draft that was sent on an earlier attempt whose
     * progression never committed. Empty when the membership already reflects the touch or
     * is finished.
     */
    @Transactional
    public Optional<Step> resumeAfterSend(Draft draft, OffsetDateTime sentAt) {
        Optional<SequenceMembership> membership =
                membershipRepository.findBySequenceIdAndLeadId(draft.getSequenceId(), draft.getLeadId());
        if (membership.isEmpty() || !membership.get().awaitsProgressionFor(draft.getTouchNumber())) {
            return Optional.empty();
        }
        log.warn("Touch {} to lead {} was sent at {} but never progressed, resuming",
                draft.getTouchNumber(), draft.getLeadId(), sentAt);
        return Optional.of(onTouchSent(draft, sentAt));
    }

    /**
     * Schedules the follow-up that will produce {@code sentTouch + 1} and stamps the membership
     * with when it is due.
     */
    @Transactional
    public OffsetDateTime scheduleFollowUp(SequenceMembership membership, SequenceDefinition sequence,
                                           int sentTouch, OffsetDateTime referenceTime) {
        int delayUnits = sequence.delayAfterTouch(sentTouch, sequenceProperties.defaultTouchDelay());
        Duration delay = sequenceProperties.touchDelay(delayUnits);
        OffsetDateTime runAt = OffsetDateTime.now(clock).plus(delay);

        membership.scheduleNextTouch(runAt);
        membershipRepository.save(membership);

        taskScheduler.scheduleAt(TaskType.FOLLOW_UP,
                TaskPayload.forTouch(membership.getLeadId(), sequence.getId(), null, sentTouch, referenceTime),
                runAt);
        return runAt;
    }

    private Step afterFirstTouch(Lead lead, SequenceMembership membership, Draft draft, OffsetDateTime sentAt) {
        if (!lead.getStatus().isClosedForOutreach()) {
            lead.transitionTo(LeadStatus.IN_PROGRESS, now());
            leadRepository.save(lead);
        }
        membership.activate();
        membershipRepository.save(membership);

        taskScheduler.schedule(TaskType.CONFIRM_TOUCH_ONE,
                TaskPayload.forTouch(lead.getId(), membership.getSequenceId(), draft.getId(), 1, sentAt),
                sequenceProperties.confirmationGrace());

        log.info("Touch 1 sent to lead {}, confirmation in {}", lead.getId(), sequenceProperties.confirmationGrace());
        return Step.CONFIRMATION_SCHEDULED;
    }

    private Step afterFollowUp(Lead lead, SequenceDefinition sequence, SequenceMembership membership,
                               int touch, OffsetDateTime sentAt) {
        membership.advanceTo(touch);
        membership.activate();

        if (sequence.isLastTouch(touch)) {
            membership.complete();
            membershipRepository.save(membership);
            if (!lead.getStatus().isClosedForOutreach()) {
                lead.transitionTo(LeadStatus.COMPLETED, now());
                leadRepository.save(lead);
            }
            log.info("Lead {} completed sequence {} at touch {}", lead.getId(), sequence.getId(), touch);
            return Step.COMPLETED;
        }

        if (!lead.getStatus().isClosedForOutreach()) {
            lead.transitionTo(LeadStatus.SEQUENCING, now());
            leadRepository.save(lead);
        }
        OffsetDateTime runAt = scheduleFollowUp(membership, sequence, touch, sentAt);
        log.info("Touch {} sent to lead {}, touch {} due at {}", touch, lead.getId(), touch + 1, runAt);
        return Step.FOLLOW_UP_SCHEDULED;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
