package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.EventType;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadEvent;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.services.EventLogService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * The one place that reacts to a reply: records it and stops every in-flight membership of
 * the lead across all sequences. Follow-up tasks already scheduled are not touched; they see
 * the stopped membership or the replied event when they wake.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplyHandlingService {

    public static final String STOP_REASON = "replied";

    private final LeadRepository leadRepository;
    private final SequenceMembershipRepository membershipRepository;
    private final EventLogService eventLogService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public ReplyResult recordReply(ReplySignal signal) {
        if (eventLogService.isRecorded(signal.messageId(), EventType.REPLIED)) {
            log.debug("Reply {} for lead {} already recorded", signal.messageId(), signal.leadId());
            return ReplyResult.duplicate(signal.leadId());
        }

        Lead lead = leadRepository.findById(signal.leadId())
                .orElseThrow(() -> ResourceNotFoundException.of("Lead", signal.leadId()));
        OffsetDateTime now = OffsetDateTime.now(clock);

        LeadEvent event = eventLogService.append(LeadEvent.builder()
                .leadId(lead.getId())
                .eventType(EventType.REPLIED)
                .messageId(signal.messageId())
                .subject(signal.subject())
                .body(signal.body())
                .occurredAt(signal.occurredAt() != null ? signal.occurredAt() : now)
                .build());

        if (lead.getStatus().canRecordReply()) {
            lead.transitionTo(LeadStatus.REPLIED, now);
            leadRepository.save(lead);
        }

        List<SequenceMembership> inFlight =
                membershipRepository.findByLeadIdAndStatusIn(lead.getId(), MembershipStatus.IN_FLIGHT);
        int stopped = 0;
        for (SequenceMembership membership : inFlight) {
            if (membership.stop(STOP_REASON)) {
                stopped++;
            }
        }
        membershipRepository.saveAll(inFlight);

        Counter.builder("sequence.replies.recorded")
                .description("Replies recorded")
                .tag("source", signal.source() != null ? signal.source() : "unknown")
                .register(meterRegistry)
                .increment();

        log.info("Reply recorded for lead {} via {}, stopped {} memberships",
                lead.getId(), signal.source(), stopped);
        return new ReplyResult(lead.getId(), event.getId(), stopped, false);
    }
}
