package com.xendex.backend.controllers;

import com.xendex.backend.dto.draft.DraftDto;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.services.EventLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DraftMapper {

    private final EventLogService eventLogService;

    public DraftDto toDto(Draft draft) {
        return DraftDto.builder()
                .id(draft.getId())
                .leadId(draft.getLeadId())
                .sequenceId(draft.getSequenceId())
                .touchNumber(draft.getTouchNumber())
                .subjectOptions(draft.getSubjectOptions())
                .selectedSubject(draft.getSelectedSubject())
                .body(draft.getBody())
                .angle(draft.getAngle())
                .status(draft.getStatus())
                .fallbackUsed(draft.isFallbackUsed())
                .sent(draft.getId() != null && eventLogService.isDraftSent(draft.getId()))
                .approvedBy(draft.getApprovedBy())
                .approvedAt(draft.getApprovedAt())
                .rejectionReason(draft.getRejectionReason())
                .createdAt(draft.getCreatedAt())
                .build();
    }
}
