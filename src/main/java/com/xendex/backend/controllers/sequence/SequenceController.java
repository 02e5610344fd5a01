package com.xendex.backend.controllers.sequence;

import com.xendex.backend.controllers.DraftMapper;
import com.xendex.backend.dto.draft.DraftDto;
import com.xendex.backend.dto.sequence.MembershipDto;
import com.xendex.backend.dto.sequence.SequenceDto;
import com.xendex.backend.dto.sequence.request.CreateSequenceRequest;
import com.xendex.backend.dto.sequence.request.EnrollLeadsRequest;
import com.xendex.backend.dto.sequence.request.UpdateSequenceRequest;
import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.enums.SequenceStatus;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.sequence.SequenceDefinition;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.services.sequence.EnrollmentResult;
import com.xendex.backend.services.sequence.SequenceAdminService;
import com.xendex.backend.services.sequence.SequenceEnrollmentService;
import com.xendex.backend.services.sequence.StartResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/sequences")
@RequiredArgsConstructor
@Slf4j
public class SequenceController {

    private final SequenceAdminService adminService;
    private final SequenceEnrollmentService enrollmentService;
    private final LeadRepository leadRepository;
    private final DraftMapper draftMapper;

    @GetMapping
    public ResponseEntity<List<SequenceDto>> listSequences(
            @RequestParam(required = false) SequenceStatus status,
            @RequestParam(required = false, defaultValue = "user") String type) {
        List<SequenceDto> dtos = adminService.list(status, type).stream()
                .map(this::convertSequenceToDto)
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }

    @PostMapping
    public ResponseEntity<SequenceDto> createSequence(@Valid @RequestBody CreateSequenceRequest request) {
        SequenceDefinition sequence = adminService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(convertSequenceToDto(sequence));
    }

    @GetMapping("/{sequenceId}")
    public ResponseEntity<SequenceDto> getSequence(@PathVariable Long sequenceId) {
        return ResponseEntity.ok(convertSequenceToDto(adminService.get(sequenceId)));
    }

    @PatchMapping("/{sequenceId}")
    public ResponseEntity<SequenceDto> updateSequence(
            @PathVariable Long sequenceId,
            @Valid @RequestBody UpdateSequenceRequest request) {
        return ResponseEntity.ok(convertSequenceToDto(adminService.update(sequenceId, request)));
    }

    @DeleteMapping("/{sequenceId}")
    public ResponseEntity<Void> deleteSequence(@PathVariable Long sequenceId) {
        adminService.delete(sequenceId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sequenceId}/start")
    public ResponseEntity<StartResult> startSequence(@PathVariable Long sequenceId) {
        return ResponseEntity.ok(adminService.start(sequenceId));
    }

    @PostMapping("/{sequenceId}/pause")
    public ResponseEntity<SequenceDto> pauseSequence(@PathVariable Long sequenceId) {
        return ResponseEntity.ok(convertSequenceToDto(adminService.pause(sequenceId)));
    }

    @GetMapping("/{sequenceId}/members")
    public ResponseEntity<List<MembershipDto>> listMembers(@PathVariable Long sequenceId) {
        List<SequenceMembership> members = adminService.listMembers(sequenceId);
        Map<Long, Lead> leads = leadRepository.findAllById(
                        members.stream().map(SequenceMembership::getLeadId).toList())
                .stream()
                .collect(Collectors.toMap(Lead::getId, Function.identity()));

        List<MembershipDto> dtos = members.stream()
                .map(m -> convertMembershipToDto(m, leads.get(m.getLeadId())))
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }

    @PostMapping("/{sequenceId}/leads")
    public ResponseEntity<EnrollmentResult> enrollLeads(
            @PathVariable Long sequenceId,
            @Valid @RequestBody EnrollLeadsRequest request) {
        return ResponseEntity.ok(enrollmentService.enroll(sequenceId, request.getLeadIds()));
    }

    /**
     * Manually request the next touch for one member; returns the draft to review
     */
    @PostMapping("/{sequenceId}/leads/{leadId}/follow-up")
    public ResponseEntity<DraftDto> triggerFollowUp(@PathVariable Long sequenceId, @PathVariable Long leadId) {
        return ResponseEntity.ok(draftMapper.toDto(adminService.triggerFollowUp(sequenceId, leadId)));
    }

    private SequenceDto convertSequenceToDto(SequenceDefinition sequence) {
        Map<MembershipStatus, Long> counts = adminService.memberCounts(sequence.getId());
        Map<String, Long> named = new LinkedHashMap<>();
        counts.forEach((status, count) -> named.put(status.name().toLowerCase(), count));

        return SequenceDto.builder()
                .id(sequence.getId())
                .externalId(sequence.getExternalId())
                .name(sequence.getName())
                .description(sequence.getDescription())
                .touches(sequence.getTouches())
                .touchDelays(sequence.getTouchDelays())
                .status(sequence.getStatus())
                .system(sequence.isSystem())
                .memberCount(counts.values().stream().mapToLong(Long::longValue).sum())
                .memberCounts(named)
                .createdAt(sequence.getCreatedAt())
                .updatedAt(sequence.getUpdatedAt())
                .build();
    }

    private MembershipDto convertMembershipToDto(SequenceMembership membership, Lead lead) {
        MembershipDto.MembershipDtoBuilder builder = MembershipDto.builder()
                .id(membership.getId())
                .leadId(membership.getLeadId())
                .currentTouch(membership.getCurrentTouch())
                .nextTouchAt(membership.getNextTouchAt())
                .status(membership.getStatus())
                .stoppedReason(membership.getStoppedReason());
        if (lead != null) {
            builder.leadEmail(lead.getEmail())
                    .leadName(String.join(" ",
                            lead.getFirstName() != null ? lead.getFirstName() : "",
                            lead.getLastName() != null ? lead.getLastName() : "").trim())
                    .companyName(lead.getCompanyName())
                    .leadStatus(lead.getStatus());
        }
        return builder.build();
    }
}
