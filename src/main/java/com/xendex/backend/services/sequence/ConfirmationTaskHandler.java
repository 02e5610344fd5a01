package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.models.task.ScheduledTask;
import com.xendex.backend.models.task.TaskPayload;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.scheduler.TaskHandler;
import com.xendex.backend.scheduler.TaskOutcome;
import com.xendex.backend.services.EventLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Fires once after the grace period following touch 1. Without a reply in the meantime the lead
 * becomes "contacted" and the membership is ready for follow-ups.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfirmationTaskHandler implements TaskHandler {

    private final SequenceMembershipRepository membershipRepository;
    private final LeadRepository leadRepository;
    private final EventLogService eventLogService;
    private final Clock clock;

    @Override
    public TaskType getTaskType() {
        return TaskType.CONFIRM_TOUCH_ONE;
    }

    @Override
    @Transactional
    public TaskOutcome handle(ScheduledTask task) {
        TaskPayload payload = task.getPayload();
        Long leadId = payload.getLeadId();

        if (eventLogService.hasReplySince(leadId, payload.getReferenceTime())) {
            log.info("Lead {} replied after touch 1, skipping confirmation", leadId);
            return TaskOutcome.aborted("replied");
        }

        Optional<SequenceMembership> found =
                membershipRepository.findBySequenceIdAndLeadId(payload.getSequenceId(), leadId);
        if (found.isEmpty()) {
            return TaskOutcome.aborted("membership_missing");
        }
        SequenceMembership membership = found.get();
        if (membership.isTerminal()) {
            return TaskOutcome.aborted("membership_" + membership.getStatus().name().toLowerCase());
        }
        if (membership.getCurrentTouch() > 1) {
            // redelivered after follow-ups already started
            return TaskOutcome.aborted("already_advanced");
        }

        Optional<Lead> lead = leadRepository.findById(leadId);
        if (lead.isPresent() && lead.get().getStatus() == LeadStatus.IN_PROGRESS) {
            lead.get().transitionTo(LeadStatus.CONTACTED, OffsetDateTime.now(clock));
            leadRepository.save(lead.get());
        }

        membership.advanceTo(1);
        membership.markReady();
        membershipRepository.save(membership);

        log.info("Lead {} confirmed as contacted in sequence {}", leadId, payload.getSequenceId());
        return TaskOutcome.completed();
    }
}
