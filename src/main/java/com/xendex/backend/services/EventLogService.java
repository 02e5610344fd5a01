package com.xendex.backend.services;

import com.xendex.backend.enums.EventType;
import com.xendex.backend.models.LeadEvent;
import com.xendex.backend.repositories.LeadEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only access to the email event log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLogService {

    private final LeadEventRepository eventRepository;

    @Transactional
    public LeadEvent append(LeadEvent event) {
        LeadEvent saved = eventRepository.save(event);
        log.debug("Appended {} event {} for lead {}", saved.getEventType(), saved.getId(), saved.getLeadId());
        return saved;
    }

    /**
     * Whether the lead replied at or after {@code since}.
     */
    @Transactional(readOnly = true)
    public boolean hasReplySince(Long leadId, OffsetDateTime since) {
        return eventRepository.existsByLeadIdAndTypeSince(leadId, EventType.REPLIED, since);
    }

    @Transactional(readOnly = true)
    public boolean isDraftSent(Long draftId) {
        return eventRepository.existsByDraftIdAndEventType(draftId, EventType.SENT);
    }

    /**
     * When the draft was sent, if it was.
     */
    @Transactional(readOnly = true)
    public Optional<OffsetDateTime> findSentAt(Long draftId) {
        return eventRepository.findFirstByDraftIdAndEventTypeOrderByOccurredAtAsc(draftId, EventType.SENT)
                .map(LeadEvent::getOccurredAt);
    }

    @Transactional(readOnly = true)
    public boolean isRecorded(String messageId, EventType type) {
        return messageId != null && eventRepository.existsByMessageIdAndEventType(messageId, type);
    }

    @Transactional(readOnly = true)
    public List<LeadEvent> timeline(Long leadId) {
        return eventRepository.findByLeadIdOrderByOccurredAtAsc(leadId);
    }
}
