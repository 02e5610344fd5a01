package com.xendex.backend.dto.draft;

import com.xendex.backend.enums.DraftStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
public class DraftDto {
    private Long id;
    private Long leadId;
    private Long sequenceId;
    private Integer touchNumber;
    private List<String> subjectOptions;
    private String selectedSubject;
    private String body;
    private String angle;
    private DraftStatus status;
    private Boolean fallbackUsed;
    private Boolean sent;
    private String approvedBy;
    private OffsetDateTime approvedAt;
    private String rejectionReason;
    private OffsetDateTime createdAt;
}
