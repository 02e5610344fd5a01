package com.xendex.backend.dto;

import com.xendex.backend.enums.EventType;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class LeadEventDto {
    private Long id;
    private EventType eventType;
    private Long sequenceId;
    private Long draftId;
    private Integer touchNumber;
    private String messageId;
    private String subject;
    private OffsetDateTime occurredAt;
}
