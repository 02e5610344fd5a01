package com.xendex.backend.services.sequence;

import com.xendex.backend.enums.DraftStatus;
import com.xendex.backend.exceptions.InvalidStateTransitionException;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.integrations.content.GenerationResult;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.repositories.sequence.DraftRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of drafts, one transaction per call.
 *
 * <p>At most one non-rejected draft exists per lead, sequence and touch. {@link #createIfAbsent}
 * checks first; a concurrent insert that slips past the check fails on the {@code active_key}
 * unique constraint and surfaces as a {@code DataIntegrityViolationException} to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DraftStore {

    private final DraftRepository draftRepository;
    private final Clock clock;

    public record Creation(Draft draft, boolean created) {
    }

    @Transactional(readOnly = true)
    public Optional<Draft> findActive(Long leadId, Long sequenceId, int touchNumber) {
        return draftRepository.findByActiveKey(Draft.activeKeyFor(leadId, sequenceId, touchNumber));
    }

    @Transactional(readOnly = true)
    public boolean existsActive(Long leadId, Long sequenceId, int touchNumber) {
        return draftRepository.existsByActiveKey(Draft.activeKeyFor(leadId, sequenceId, touchNumber));
    }

    @Transactional(readOnly = true)
    public Draft get(Long draftId) {
        return draftRepository.findById(draftId)
                .orElseThrow(() -> ResourceNotFoundException.of("Draft", draftId));
    }

    @Transactional(readOnly = true)
    public List<Draft> list(DraftStatus status, Long sequenceId) {
        if (sequenceId != null && status != null) {
            return draftRepository.findBySequenceIdAndStatusOrderByCreatedAtDesc(sequenceId, status);
        }
        if (sequenceId != null) {
            return draftRepository.findBySequenceIdOrderByCreatedAtDesc(sequenceId);
        }
        if (status != null) {
            return draftRepository.findByStatusOrderByCreatedAtDesc(status);
        }
        return draftRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Saves a new draft unless a live one already exists for the same touch, in which case
     * that one is returned with {@code created=false}.
     *
     * @param approvedBy non-null to store the draft already approved (automatic follow-ups)
     */
    @Transactional
    public Creation createIfAbsent(Long leadId, Long sequenceId, int touchNumber,
                                   GenerationResult content, String angle, String approvedBy) {
        String key = Draft.activeKeyFor(leadId, sequenceId, touchNumber);
        Optional<Draft> existing = draftRepository.findByActiveKey(key);
        if (existing.isPresent()) {
            return new Creation(existing.get(), false);
        }

        Draft draft = Draft.builder()
                .leadId(leadId)
                .sequenceId(sequenceId)
                .touchNumber(touchNumber)
                .activeKey(key)
                .subjectOptions(content.subjectOptions())
                .body(content.body())
                .angle(angle)
                .fallbackUsed(content.fallbackUsed())
                .status(DraftStatus.PENDING)
                .build();
        if (approvedBy != null) {
            draft.approve(null, approvedBy, now());
        }

        draft = draftRepository.saveAndFlush(draft);
        log.info("Created {} draft {} for lead {} sequence {} touch {}{}",
                draft.getStatus(), draft.getId(), leadId, sequenceId, touchNumber,
                content.fallbackUsed() ? " (fallback: " + content.fallbackReason() + ")" : "");
        return new Creation(draft, true);
    }

    @Transactional
    public Draft approve(Long draftId, String selectedSubject, String approvedBy) {
        Draft draft = get(draftId);
        if (draft.isRejected()) {
            throw new InvalidStateTransitionException("Draft " + draftId + " was rejected and cannot be approved");
        }
        if (draft.isPending()) {
            draft.approve(selectedSubject, approvedBy, now());
            draft = draftRepository.save(draft);
            log.info("Draft {} approved by {}", draftId, approvedBy);
        }
        return draft;
    }

    @Transactional
    public Draft reject(Long draftId, String reason) {
        Draft draft = get(draftId);
        if (draft.isRejected()) {
            return draft;
        }
        draft.reject(reason);
        log.info("Draft {} rejected: {}", draftId, reason);
        return draftRepository.save(draft);
    }

    @Transactional
    public Draft updateContent(Long draftId, List<String> subjectOptions, String selectedSubject, String body) {
        Draft draft = get(draftId);
        if (!draft.isPending()) {
            throw new InvalidStateTransitionException("Only pending drafts can be edited, draft " + draftId
                    + " is " + draft.getStatus());
        }
        if (subjectOptions != null && !subjectOptions.isEmpty()) {
            draft.setSubjectOptions(subjectOptions);
        }
        if (selectedSubject != null) {
            draft.setSelectedSubject(selectedSubject);
        }
        if (body != null && !body.isBlank()) {
            draft.setBody(body);
        }
        return draftRepository.save(draft);
    }

    /**
     * Swaps in freshly generated content and puts the draft back in front of a reviewer.
     */
    @Transactional
    public Draft replaceContent(Long draftId, GenerationResult content, String angle) {
        Draft draft = get(draftId);
        if (draft.isRejected()) {
            throw new InvalidStateTransitionException("Draft " + draftId + " was rejected and cannot be regenerated");
        }
        draft.setSubjectOptions(content.subjectOptions());
        draft.setBody(content.body());
        draft.setAngle(angle);
        draft.setFallbackUsed(content.fallbackUsed());
        draft.setSelectedSubject(null);
        draft.setStatus(DraftStatus.PENDING);
        draft.setApprovedAt(null);
        draft.setApprovedBy(null);
        return draftRepository.save(draft);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
