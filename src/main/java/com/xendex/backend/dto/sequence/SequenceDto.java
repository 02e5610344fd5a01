package com.xendex.backend.dto.sequence;

import com.xendex.backend.enums.SequenceStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class SequenceDto {
    private Long id;
    private String externalId;
    private String name;
    private String description;
    private Integer touches;
    private List<Integer> touchDelays;
    private SequenceStatus status;
    private Boolean system;
    private Long memberCount;
    private Map<String, Long> memberCounts;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
