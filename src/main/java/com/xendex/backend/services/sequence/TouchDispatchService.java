package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.EventType;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.integrations.email.EmailSender;
import com.xendex.backend.integrations.email.SendResult;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadEvent;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.services.EventLogService;
import com.xendex.backend.services.SuppressionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Sends an approved draft and records the sent event.
 *
 * <p>A draft that already has a sent event is never sent again. The send itself is not retried
 * here; callers decide whether a failure is worth another attempt.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TouchDispatchService {

    private final LeadRepository leadRepository;
    private final EmailSender emailSender;
    private final SuppressionService suppressionService;
    private final EventLogService eventLogService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DispatchResult dispatch(Draft draft) {
        if (eventLogService.isDraftSent(draft.getId())) {
            log.warn("Draft {} (lead {}, touch {}) already has a sent event, not sending again",
                    draft.getId(), draft.getLeadId(), draft.getTouchNumber());
            Counter.builder("sequence.duplicate_send.detected")
                    .description("Send attempts stopped because the draft was already sent")
                    .register(meterRegistry)
                    .increment();
            return DispatchResult.alreadySent();
        }

        Lead lead = leadRepository.findById(draft.getLeadId())
                .orElseThrow(() -> ResourceNotFoundException.of("Lead", draft.getLeadId()));

        if (!lead.hasEmail()) {
            log.warn("Lead {} has no email address, draft {} not sent", lead.getId(), draft.getId());
            return DispatchResult.permanentFailure("lead_has_no_email");
        }
        if (suppressionService.isSuppressed(lead.getEmail())) {
            log.warn("Lead {} address is suppressed, draft {} not sent", lead.getId(), draft.getId());
            return DispatchResult.permanentFailure("suppressed");
        }

        String subject = draft.effectiveSubject();
        SendResult result = emailSender.send(lead.getEmail(), subject, draft.getBody());
        if (!result.success()) {
            log.error("Send failed for draft {} (lead {}, touch {}): {}",
                    draft.getId(), lead.getId(), draft.getTouchNumber(), result.errorMessage());
            return DispatchResult.transientFailure(result.errorMessage());
        }

        OffsetDateTime sentAt = OffsetDateTime.now(clock);
        eventLogService.append(LeadEvent.builder()
                .leadId(lead.getId())
                .sequenceId(draft.getSequenceId())
                .draftId(draft.getId())
                .eventType(EventType.SENT)
                .touchNumber(draft.getTouchNumber())
                .messageId(result.messageId())
                .subject(subject)
                .body(draft.getBody())
                .occurredAt(sentAt)
                .build());

        Counter.builder("sequence.touches.sent")
                .description("Sequence touches sent")
                .tag("touch", String.valueOf(draft.getTouchNumber()))
                .register(meterRegistry)
                .increment();

        log.info("Sent touch {} to lead {} (draft {}, message {})",
                draft.getTouchNumber(), lead.getId(), draft.getId(), result.messageId());
        return DispatchResult.sent(sentAt, result.messageId());
    }
}
