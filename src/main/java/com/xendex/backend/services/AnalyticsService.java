package com.xendex.backend.services;

import com.xendex.backend.dto.analytics.FunnelDto;
import com.xendex.backend.dto.analytics.FunnelStageDto;
import com.xendex.backend.dto.analytics.OverviewDto;
import com.xendex.backend.dto.analytics.SequenceMetricsDto;
import com.xendex.backend.enums.DraftStatus;
import com.xendex.backend.enums.EventType;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.enums.SequenceStatus;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.models.sequence.SequenceDefinition;
import com.xendex.backend.repositories.LeadEventRepository;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.repositories.sequence.DraftRepository;
import com.xendex.backend.repositories.sequence.SequenceDefinitionRepository;
import com.xendex.backend.repositories.sequence.SequenceMembershipRepository;
import com.xendex.backend.services.sequence.ReplyHandlingService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only dashboard figures built from the event log and lead statuses.
 * Rates are percentages; a zero denominator yields 0.0.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class AnalyticsService {

    static final int OVERVIEW_WINDOW_DAYS = 7;

    private final LeadRepository leadRepository;
    private final LeadEventRepository eventRepository;
    private final SequenceDefinitionRepository sequenceRepository;
    private final SequenceMembershipRepository membershipRepository;
    private final DraftRepository draftRepository;
    private final Clock clock;

    /**
     * Event counts and rates for one sequence. Replies are counted from memberships the reply
     * stopped, since reply events belong to the lead rather than to a sequence.
     */
    public SequenceMetricsDto getSequenceMetrics(Long sequenceId) {
        SequenceDefinition sequence = sequenceRepository.findById(sequenceId)
                .orElseThrow(() -> ResourceNotFoundException.of("Sequence", sequenceId));

        Map<EventType, Long> events = toEventCounts(eventRepository.countEventTypesBySequenceId(sequenceId));
        long sent = events.getOrDefault(EventType.SENT, 0L);
        long delivered = events.getOrDefault(EventType.DELIVERED, 0L);
        long replied = membershipRepository.countBySequenceIdAndStoppedReason(sequenceId, ReplyHandlingService.STOP_REASON);

        return SequenceMetricsDto.builder()
                .sequenceId(sequence.getId())
                .sequenceName(sequence.getName())
                .totalLeads(membershipRepository.countBySequenceId(sequenceId))
                .activeMembers(membershipRepository.countBySequenceIdAndStatus(sequenceId, MembershipStatus.ACTIVE))
                .completedMembers(membershipRepository.countBySequenceIdAndStatus(sequenceId, MembershipStatus.COMPLETED))
                .sent(sent)
                .delivered(delivered)
                .opened(events.getOrDefault(EventType.OPENED, 0L))
                .clicked(events.getOrDefault(EventType.CLICKED, 0L))
                .replied(replied)
                .bounced(events.getOrDefault(EventType.BOUNCED, 0L))
                .complaints(events.getOrDefault(EventType.SPAM_COMPLAINT, 0L))
                .deliveryRate(percentage(delivered, sent))
                .openRate(percentage(events.getOrDefault(EventType.OPENED, 0L), delivered))
                .replyRate(percentage(replied, delivered))
                .build();
    }

    /**
     * Lead counts per visible status. Leads in the hidden IN_PROGRESS state have had touch 1
     * sent, so they are shown as CONTACTED.
     */
    public FunnelDto getFunnel() {
        Map<LeadStatus, Long> byStatus = visibleLeadCounts();
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();

        List<FunnelStageDto> stages = new ArrayList<>();
        byStatus.forEach((status, count) -> stages.add(FunnelStageDto.builder()
                .status(status)
                .label(status.getDisplayName())
                .count(count)
                .percentage(percentage(count, total))
                .build()));

        long fresh = byStatus.get(LeadStatus.NEW);
        long contacted = byStatus.get(LeadStatus.CONTACTED);
        long replied = byStatus.get(LeadStatus.REPLIED);
        long converted = byStatus.get(LeadStatus.CONVERTED);

        return FunnelDto.builder()
                .totalLeads(total)
                .stages(stages)
                .contactedRate(percentage(contacted, fresh))
                .replyRate(percentage(replied, contacted))
                .conversionRate(percentage(converted, replied))
                .build();
    }

    public OverviewDto getOverview() {
        Map<LeadStatus, Long> byStatus = visibleLeadCounts();
        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(OVERVIEW_WINDOW_DAYS);
        Map<EventType, Long> recent = toEventCounts(eventRepository.countEventTypesSince(since));
        long sent = recent.getOrDefault(EventType.SENT, 0L);

        long activeSequences = sequenceRepository.findByStatusOrderByCreatedAtDesc(SequenceStatus.ACTIVE).stream()
                .filter(sequence -> !sequence.isSystem())
                .count();

        return OverviewDto.builder()
                .totalLeads(byStatus.values().stream().mapToLong(Long::longValue).sum())
                .leadsByStatus(byStatus)
                .activeSequences(activeSequences)
                .pendingApprovals(draftRepository.countByStatus(DraftStatus.PENDING))
                .windowDays(OVERVIEW_WINDOW_DAYS)
                .sentInWindow(sent)
                .openRate(percentage(recent.getOrDefault(EventType.OPENED, 0L), sent))
                .replyRate(percentage(recent.getOrDefault(EventType.REPLIED, 0L), sent))
                .bounceRate(percentage(recent.getOrDefault(EventType.BOUNCED, 0L), sent))
                .build();
    }

    private Map<LeadStatus, Long> visibleLeadCounts() {
        Map<LeadStatus, Long> counts = new EnumMap<>(LeadStatus.class);
        for (LeadStatus status : LeadStatus.values()) {
            if (status.isVisibleInFunnel()) {
                counts.put(status, 0L);
            }
        }
        for (Object[] row : leadRepository.countLeadsByStatus()) {
            LeadStatus status = (LeadStatus) row[0];
            LeadStatus shown = status.isVisibleInFunnel() ? status : LeadStatus.CONTACTED;
            counts.merge(shown, (Long) row[1], Long::sum);
        }
        return counts;
    }

    private static Map<EventType, Long> toEventCounts(List<Object[]> rows) {
        Map<EventType, Long> counts = new EnumMap<>(EventType.class);
        for (Object[] row : rows) {
            counts.put((EventType) row[0], (Long) row[1]);
        }
        return counts;
    }

    private static Double percentage(long part, long whole) {
        return whole > 0 ? (part * 100.0 / whole) : 0.0;
    }
}
