package com.xendex.backend.dto.sequence;

import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.MembershipStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class MembershipDto {
    private Long id;
    private Long leadId;
    private String leadEmail;
    private String leadName;
    private String companyName;
    private LeadStatus leadStatus;
    private Integer currentTouch;
    private OffsetDateTime nextTouchAt;
    private MembershipStatus status;
    private String stoppedReason;
}
