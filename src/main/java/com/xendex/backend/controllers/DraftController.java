package com.xendex.backend.controllers;

import com.xendex.backend.dto.draft.DraftDto;
import com.xendex.backend.dto.draft.request.ApproveDraftRequest;
import com.xendex.backend.dto.draft.request.BulkApproveRequest;
import com.xendex.backend.dto.draft.request.GenerateDraftsRequest;
import com.xendex.backend.dto.draft.request.RegenerateDraftRequest;
import com.xendex.backend.dto.draft.request.RejectDraftRequest;
import com.xendex.backend.dto.draft.request.UpdateDraftRequest;
import com.xendex.backend.enums.DraftStatus;
import com.xendex.backend.services.sequence.ApprovalResult;
import com.xendex.backend.services.sequence.BulkApprovalResult;
import com.xendex.backend.services.sequence.DraftApprovalService;
import com.xendex.backend.services.sequence.DraftStore;
import com.xendex.backend.services.sequence.DraftingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/drafts")
@RequiredArgsConstructor
@Slf4j
public class DraftController {

    private final DraftingService draftingService;
    private final DraftApprovalService approvalService;
    private final DraftStore draftStore;
    private final DraftMapper draftMapper;

    /**
     * Enroll leads and draft their first touch
     */
    @PostMapping("/generate")
    public ResponseEntity<DraftingService.BatchResult> generateDrafts(@Valid @RequestBody GenerateDraftsRequest request) {
        return ResponseEntity.ok(draftingService.generateForLeads(request.getLeadIds(), request.getSequenceId()));
    }

    @GetMapping
    public ResponseEntity<List<DraftDto>> listDrafts(
            @RequestParam(required = false) DraftStatus status,
            @RequestParam(required = false) Long sequenceId) {
        List<DraftDto> dtos = draftStore.list(status, sequenceId).stream()
                .map(draftMapper::toDto)
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }

    @GetMapping("/{draftId}")
    public ResponseEntity<DraftDto> getDraft(@PathVariable Long draftId) {
        return ResponseEntity.ok(draftMapper.toDto(draftStore.get(draftId)));
    }

    @PatchMapping("/{draftId}")
    public ResponseEntity<DraftDto> updateDraft(@PathVariable Long draftId, @Valid @RequestBody UpdateDraftRequest request) {
        return ResponseEntity.ok(draftMapper.toDto(approvalService.updateContent(
                draftId, request.getSubjectOptions(), request.getSelectedSubject(), request.getBody())));
    }

    @PostMapping("/{draftId}/approve")
    public ResponseEntity<ApprovalResult> approveDraft(
            @PathVariable Long draftId,
            @Valid @RequestBody(required = false) ApproveDraftRequest request) {
        ApproveDraftRequest body = request != null ? request : new ApproveDraftRequest();
        ApprovalResult result = approvalService.approve(draftId, body.getSelectedSubject(), body.getApprovedBy());

        if (result.status() == ApprovalResult.Status.SEND_FAILED) {
            return ResponseEntity.status(502).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/{draftId}/reject")
    public ResponseEntity<DraftDto> rejectDraft(
            @PathVariable Long draftId,
            @Valid @RequestBody(required = false) RejectDraftRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(draftMapper.toDto(approvalService.reject(draftId, reason)));
    }

    @PostMapping("/{draftId}/regenerate")
    public ResponseEntity<DraftDto> regenerateDraft(
            @PathVariable Long draftId,
            @RequestBody(required = false) RegenerateDraftRequest request) {
        return ResponseEntity.ok(draftMapper.toDto(
                approvalService.regenerate(draftId, request != null ? request.getAngle() : null)));
    }

    @PostMapping("/bulk-approve")
    public ResponseEntity<BulkApprovalResult> bulkApprove(@Valid @RequestBody BulkApproveRequest request) {
        return ResponseEntity.ok(approvalService.bulkApprove(request.getDraftIds(), request.getApprovedBy()));
    }
}
