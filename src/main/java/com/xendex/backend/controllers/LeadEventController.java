package com.xendex.backend.controllers;

import com.xendex.backend.dto.LeadEventDto;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.services.EventLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/leads")
@RequiredArgsConstructor
public class LeadEventController {

    private final EventLogService eventLogService;
    private final LeadRepository leadRepository;

    @GetMapping("/{leadId}/events")
    public ResponseEntity<List<LeadEventDto>> getTimeline(@PathVariable Long leadId) {
        if (!leadRepository.existsById(leadId)) {
            throw ResourceNotFoundException.of("Lead", leadId);
        }
        List<LeadEventDto> events = eventLogService.timeline(leadId).stream()
                .map(event -> LeadEventDto.builder()
                        .id(event.getId())
                        .eventType(event.getEventType())
                        .sequenceId(event.getSequenceId())
                        .draftId(event.getDraftId())
                        .touchNumber(event.getTouchNumber())
                        .messageId(event.getMessageId())
                        .subject(event.getSubject())
                        .occurredAt(event.getOccurredAt())
                        .build())
                .toList();
        return ResponseEntity.ok(events);
    }
}
