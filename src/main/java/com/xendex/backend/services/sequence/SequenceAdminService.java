package com.xendex.backend.services.sequence;

import com.xendex.backend.dto.sequence.request.CreateSequenceRequest;
import com.xendex.backend.dto.sequence.request.UpdateSequenceRequest;
import com.xendex.backend.enums.DraftStatus;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.enums.SequenceStatus;
import com.xendex.backend.enums.TaskType;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.exceptions.SequenceConflictException;
import com.xendex.backend.integrations.content.ContentGenerator;
import com.xendex.backend.integrations.content.GenerationResult;
import com.xendex.backend.integrations.content.ResearchContext;
import com.xendex.backend.integrations.content.Strategy;
import com.xendex.backend.integrations.content.TouchContext;
import com.xendex.backend.models.Lead;
import com.xendex.backend.models.LeadIntelligence;
import com.xendex.backend.models.sequence.Draft;
import com.xendex.backend.models.sequence.SequenceDefinition;
import com.xendex.backend.models.sequence.SequenceMembership;
import com.xendex.backend.models.task.TaskPayload;
import com.xendex.backend.repositories.LeadIntelligenceRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.DraftRepository;
import com.xendex.backend.repositories.sequence.SequenceDefinitionRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.scheduler.DelayedTaskScheduler;
import com.xendex.backend.services.content.StrategyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class SequenceAdminService {

    private final SequenceDefinitionRepository sequenceRepository;
    private final SequenceMembershipRepository membershipRepository;
    private final DraftRepository draftRepository;
    private final LeadRepository leadRepository;
    private final LeadIntelligenceRepository intelligenceRepository;
    private final SequenceProgressionService progressionService;
    private final DelayedTaskScheduler taskScheduler;
    private final DraftStore draftStore;
    private final StrategyEngine strategyEngine;
    private final ContentGenerator contentGenerator;
    private final Clock clock;

    /**
     * Create a new user sequence in DRAFT status
     */
    public SequenceDefinition create(CreateSequenceRequest request) {
        SequenceDefinition sequence = SequenceDefinition.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .touches(request.getTouches())
                .touchDelays(request.getTouchDelays() != null ? new ArrayList<>(request.getTouchDelays()) : new ArrayList<>())
                .status(SequenceStatus.DRAFT)
                .build();
        sequence = sequenceRepository.save(sequence);
        log.info("Created sequence {} '{}' with {} touches", sequence.getId(), sequence.getName(), sequence.getTouches());
        return sequence;
    }

    /**
     * @param type "user" (default) hides system sequences, "system" shows only them, "all" shows both
     */
    @Transactional(readOnly = true)
    public List<SequenceDefinition> list(SequenceStatus status, String type) {
        List<SequenceDefinition> sequences = status != null
                ? sequenceRepository.findByStatusOrderByCreatedAtDesc(status)
                : sequenceRepository.findAllByOrderByCreatedAtDesc();

        String filter = type == null ? "user" : type.toLowerCase();
        return switch (filter) {
            case "all" -> sequences;
            case "system" -> sequences.stream().filter(SequenceDefinition::isSystem).toList();
            case "user" -> sequences.stream().filter(s -> !s.isSystem()).toList();
            default -> throw new IllegalArgumentException("Unknown sequence type filter: " + type);
        };
    }

    @Transactional(readOnly = true)
    public SequenceDefinition get(Long sequenceId) {
        return sequenceRepository.findById(sequenceId)
                .orElseThrow(() -> ResourceNotFoundException.of("Sequence", sequenceId));
    }

    @Transactional(readOnly = true)
    public Map<MembershipStatus, Long> memberCounts(Long sequenceId) {
        Map<MembershipStatus, Long> counts = new EnumMap<>(MembershipStatus.class);
        for (MembershipStatus status : MembershipStatus.values()) {
            counts.put(status, membershipRepository.countBySequenceIdAndStatus(sequenceId, status));
        }
        return counts;
    }

    /**
     * Name, description and delays can always change. The touch count is fixed once any member
     * has been sent a touch, and system sequences keep their name.
     */
    public SequenceDefinition update(Long sequenceId, UpdateSequenceRequest request) {
        SequenceDefinition sequence = get(sequenceId);

        if (request.getName() != null && !request.getName().isBlank()
                && !request.getName().trim().equals(sequence.getName())) {
            if (sequence.isSystem()) {
                throw new SequenceConflictException("SYSTEM_SEQUENCE", "System sequences cannot be renamed");
            }
            sequence.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            sequence.setDescription(request.getDescription());
        }
        if (request.getTouches() != null && !request.getTouches().equals(sequence.getTouches())) {
            if (membershipRepository.anyTouchSent(sequenceId)) {
                throw new SequenceConflictException("TOUCHES_LOCKED",
                        "Touch count cannot change after touches have been sent");
            }
            sequence.setTouches(request.getTouches());
        }
        if (request.getTouchDelays() != null) {
            // only affects follow-ups not yet scheduled
            sequence.setTouchDelays(new ArrayList<>(request.getTouchDelays()));
        }
        return sequenceRepository.save(sequence);
    }

    /**
     * Activates the sequence. Pending members become active and wait for touch 1; ready members
     * (touch 1 already sent) start their follow-up chain. Stopped and completed members are left alone.
     */
    public StartResult start(Long sequenceId) {
        SequenceDefinition sequence = get(sequenceId);
        if (sequence.getStatus() == SequenceStatus.COMPLETED) {
            throw new SequenceConflictException("SEQUENCE_COMPLETED", "Sequence " + sequenceId + " is completed");
        }
        sequence.setStatus(SequenceStatus.ACTIVE);
        sequenceRepository.save(sequence);

        OffsetDateTime now = OffsetDateTime.now(clock);
        int activated = 0;
        int followUps = 0;
        int completed = 0;

        List<SequenceMembership> waiting = membershipRepository.findBySequenceIdAndStatusIn(
                sequenceId, List.of(MembershipStatus.PENDING, MembershipStatus.READY));
        for (SequenceMembership membership : waiting) {
            boolean ready = membership.getStatus() == MembershipStatus.READY;
            membership.activate();
            activated++;

            if (ready) {
                Optional<Lead> lead = leadRepository.findById(membership.getLeadId());
                OffsetDateTime reference = lead.map(Lead::getLastContactedAt).orElse(null);
                if (sequence.isLastTouch(membership.getCurrentTouch())) {
                    membership.complete();
                    lead.ifPresent(l -> l.transitionTo(LeadStatus.COMPLETED, now));
                    completed++;
                } else {
                    lead.ifPresent(l -> l.transitionTo(LeadStatus.SEQUENCING, now));
                    progressionService.scheduleFollowUp(membership, sequence, membership.getCurrentTouch(),
                            reference != null ? reference : now);
                    followUps++;
                }
                lead.ifPresent(leadRepository::save);
            }
            membershipRepository.save(membership);
        }

        taskScheduler.schedule(TaskType.DRAFTING_PASS, TaskPayload.forSequence(sequenceId), Duration.ZERO);

        log.info("Started sequence {}: {} members activated, {} follow-ups scheduled, {} completed",
                sequenceId, activated, followUps, completed);
        return new StartResult(sequenceId, activated, followUps, completed);
    }

    /**
     * Pausing holds due follow-ups until the sequence is started again.
     */
    public SequenceDefinition pause(Long sequenceId) {
        SequenceDefinition sequence = get(sequenceId);
        if (!sequence.isActive()) {
            throw new SequenceConflictException("NOT_ACTIVE", "Only active sequences can be paused");
        }
        sequence.setStatus(SequenceStatus.PAUSED);
        log.info("Paused sequence {}", sequenceId);
        return sequenceRepository.save(sequence);
    }

    public void delete(Long sequenceId) {
        SequenceDefinition sequence = get(sequenceId);
        if (sequence.isActive()) {
            throw new SequenceConflictException("SEQUENCE_ACTIVE", "Pause the sequence before deleting it");
        }
        if (membershipRepository.existsBySequenceIdAndStatus(sequenceId, MembershipStatus.ACTIVE)) {
            throw new SequenceConflictException("ACTIVE_MEMBERS", "Sequence " + sequenceId + " still has active members");
        }
        int drafts = draftRepository.deleteBySequenceIdAndStatus(sequenceId, DraftStatus.PENDING);
        int members = membershipRepository.deleteBySequenceId(sequenceId);
        sequenceRepository.delete(sequence);
        log.info("Deleted sequence {} with {} memberships and {} pending drafts", sequenceId, members, drafts);
    }

    @Transactional(readOnly = true)
    public List<SequenceMembership> listMembers(Long sequenceId) {
        get(sequenceId);
        return membershipRepository.findBySequenceIdOrderByCreatedAtAsc(sequenceId);
    }

    /**
     * Manually requests the next touch for one member. Returns the live draft for that touch if one
     * exists, otherwise generates a pending one for review. The next touch may not exceed the
     * sequence's touch count, the same limit the automatic chain enforces.
     */
    public Draft triggerFollowUp(Long sequenceId, Long leadId) {
        SequenceDefinition sequence = get(sequenceId);
        SequenceMembership membership = membershipRepository.findBySequenceIdAndLeadId(sequenceId, leadId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Lead " + leadId + " is not a member of sequence " + sequenceId));
        if (membership.isTerminal()) {
            throw new SequenceConflictException("MEMBERSHIP_FINISHED",
                    "Membership is " + membership.getStatus().name().toLowerCase());
        }

        int nextTouch = membership.getCurrentTouch() + 1;
        if (nextTouch > sequence.getTouches()) {
            throw new SequenceConflictException("MAX_TOUCHES_EXCEEDED",
                    "Sequence " + sequenceId + " allows " + sequence.getTouches() + " touches");
        }

        Optional<Draft> existing = draftStore.findActive(leadId, sequenceId, nextTouch);
        if (existing.isPresent()) {
            return existing.get();
        }

        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> ResourceNotFoundException.of("Lead", leadId));
        LeadIntelligence intelligence = intelligenceRepository.findByLeadId(leadId)
                .orElseThrow(() -> new IllegalArgumentException("Lead " + leadId + " has no research data"));

        ResearchContext research = ResearchContext.from(intelligence);
        Strategy strategy = strategyEngine.select(research);
        GenerationResult content = contentGenerator.generate(TouchContext.of(lead, research, strategy, nextTouch));
        return draftStore.createIfAbsent(leadId, sequenceId, nextTouch, content, strategy.angle().getKey(), null).draft();
    }
}
