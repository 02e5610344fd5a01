package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.models.Lead;
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

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Adds leads to a sequence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SequenceEnrollmentService {

    private final SequenceDefinitionRepository sequenceRepository;
    private final SequenceMembershipRepository membershipRepository;
    private final LeadRepository leadRepository;
    private final DelayedTaskScheduler taskScheduler;

    /**
     * Qualified leads start pending. Contacted leads already had their first email, so they join
     * ready at touch 1. Leads already in the sequence are reported as skipped, never as errors.
     * Enrolling into an active sequence queues a drafting pass.
     */
    @Transactional
    public EnrollmentResult enroll(Long sequenceId, List<Long> leadIds) {
        SequenceDefinition sequence = sequenceRepository.findById(sequenceId)
                .orElseThrow(() -> ResourceNotFoundException.of("Sequence", sequenceId));

        int added = 0;
        List<EnrollmentResult.SkippedLead> skipped = new ArrayList<>();
        Set<Long> seen = new HashSet<>();

        for (Long leadId : leadIds) {
            if (!seen.add(leadId)) {
                skipped.add(new EnrollmentResult.SkippedLead(leadId, "already_enrolled"));
                continue;
            }
            Lead lead = leadRepository.findById(leadId).orElse(null);
            if (lead == null) {
                skipped.add(new EnrollmentResult.SkippedLead(leadId, "lead_not_found"));
                continue;
            }
            if (membershipRepository.existsBySequenceIdAndLeadId(sequenceId, leadId)) {
                skipped.add(new EnrollmentResult.SkippedLead(leadId, "already_enrolled"));
                continue;
            }

            SequenceMembership membership;
            if (lead.getStatus() == LeadStatus.QUALIFIED) {
                membership = SequenceMembership.pending(sequenceId, leadId);
            } else if (lead.getStatus() == LeadStatus.CONTACTED) {
                membership = SequenceMembership.readyAfterFirstTouch(sequenceId, leadId);
            } else {
                skipped.add(new EnrollmentResult.SkippedLead(leadId,
                        "not_eligible_" + lead.getStatus().name().toLowerCase()));
                continue;
            }

            membershipRepository.save(membership);
            added++;
            log.debug("Enrolled lead {} into sequence {} as {}", leadId, sequenceId, membership.getStatus());
        }

        if (added > 0 && sequence.isActive()) {
            taskScheduler.schedule(TaskType.DRAFTING_PASS, TaskPayload.forSequence(sequenceId), Duration.ZERO);
        }

        log.info("Enrollment into sequence {}: {} added, {} skipped", sequenceId, added, skipped.size());
        return new EnrollmentResult(added, skipped.size(), skipped);
    }
}
