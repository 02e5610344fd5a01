package com.xendex.backend.services;

import com.xendex.backend.dto.webhook.IngestionResult;
import com.xendex.backend.dto.webhook.ResendWebhookEvent;
import com.xendex.backend.enums.EventType;
import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadEvent;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.repositories.LeadEventRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.services.sequence.ReplyHandlingService;
import com.xendex.backend.services.sequence.ReplyResult;
import com.xendex.backend.services.sequence.ReplySignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Turns email provider webhooks into events. Replies go to {@link ReplyHandlingService};
 * bounces and spam complaints also suppress the address and stop the lead's memberships.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailEventIngestionService {

    private final LeadRepository leadRepository;
    private final LeadEventRepository eventRepository;
    private final SequenceMembershipRepository membershipRepository;
    private final EventLogService eventLogService;
    private final SuppressionService suppressionService;
    private final ReplyHandlingService replyHandlingService;
    private final Clock clock;

    @Transactional
    public IngestionResult ingest(ResendWebhookEvent webhook) {
        Optional<EventType> mapped = EventType.fromProviderType(webhook.getType());
        if (mapped.isEmpty()) {
            log.debug("Ignoring unsupported webhook type {}", webhook.getType());
            return IngestionResult.ignored("unsupported_type");
        }
        EventType type = mapped.get();
        if (type == EventType.SENT) {
            // sent events are written when the send call returns
            return IngestionResult.ignored("sent_recorded_locally");
        }

        ResendWebhookEvent.EventData data = webhook.getData();
        if (data == null) {
            return IngestionResult.ignored("missing_data");
        }

        if (type == EventType.REPLIED) {
            return ingestReply(webhook, data);
        }

        if (eventLogService.isRecorded(data.getEmailId(), type)) {
            return new IngestionResult("duplicate", null, type.name());
        }

        Optional<LeadEvent> sent = Optional.ofNullable(data.getEmailId())
                .flatMap(id -> eventRepository.findFirstByMessageIdAndEventType(id, EventType.SENT));
        Optional<Lead> lead = sent.flatMap(event -> leadRepository.findById(event.getLeadId()))
                .or(() -> firstRecipient(data).flatMap(leadRepository::findFirstByEmailIgnoreCase));
        if (lead.isEmpty()) {
            log.info("Webhook {} for message {} matches no lead", type, data.getEmailId());
            return IngestionResult.ignored("lead_not_found");
        }

        eventLogService.append(LeadEvent.builder()
                .leadId(lead.get().getId())
                .sequenceId(sent.map(LeadEvent::getSequenceId).orElse(null))
                .draftId(sent.map(LeadEvent::getDraftId).orElse(null))
                .touchNumber(sent.map(LeadEvent::getTouchNumber).orElse(null))
                .eventType(type)
                .messageId(data.getEmailId())
                .subject(data.getSubject())
                .occurredAt(webhook.getCreatedAt() != null ? webhook.getCreatedAt() : OffsetDateTime.now(clock))
                .build());

        if (type.suppressesAddress()) {
            String reason = type.name().toLowerCase();
            suppressionService.suppress(lead.get().getEmail(), reason);
            stopInFlight(lead.get().getId(), reason);
        }

        return new IngestionResult("recorded", lead.get().getId(), type.name());
    }

    private IngestionResult ingestReply(ResendWebhookEvent webhook, ResendWebhookEvent.EventData data) {
        Optional<Lead> lead = Optional.ofNullable(data.getFrom())
                .map(EmailEventIngestionService::extractAddress)
                .flatMap(leadRepository::findFirstByEmailIgnoreCase);
        if (lead.isEmpty()) {
            log.info("Reply from {} matches no lead", data.getFrom());
            return IngestionResult.ignored("lead_not_found");
        }

        ReplyResult result = replyHandlingService.recordReply(new ReplySignal(lead.get().getId(),
                data.getEmailId(), data.getSubject(), data.getText(), webhook.getCreatedAt(), "webhook"));
        return new IngestionResult(result.duplicate() ? "duplicate" : "recorded", lead.get().getId(),
                EventType.REPLIED.name());
    }

    private void stopInFlight(Long leadId, String reason) {
        List<SequenceMembership> inFlight = membershipRepository.findByLeadIdAndStatusIn(leadId, MembershipStatus.IN_FLIGHT);
        inFlight.forEach(membership -> membership.stop(reason));
        membershipRepository.saveAll(inFlight);
        if (!inFlight.isEmpty()) {
            log.info("Stopped {} memberships of lead {} ({})", inFlight.size(), leadId, reason);
        }
    }

    private static Optional<String> firstRecipient(ResendWebhookEvent.EventData data) {
        if (data.getTo() == null || data.getTo().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(extractAddress(data.getTo().get(0)));
    }

    /**
     * "Jane Doe &lt;jane@acme.com&gt;" to "jane@acme.com".
     */
    static String extractAddress(String value) {
        int open = value.indexOf('<');
        int close = value.indexOf('>');
        if (open >= 0 && close > open) {
            return value.substring(open + 1, close).trim();
        }
        return value.trim();
    }
}
