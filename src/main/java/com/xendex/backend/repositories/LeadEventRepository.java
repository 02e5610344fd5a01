package com.xendex.backend.repositories;

import com.xendex.backend.enums.EventType;
import com.xendex.backend.models.LeadEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeadEventRepository extends JpaRepository<LeadEvent, Long> {

    @Query("""
            SELECT COUNT(e) > 0 FROM LeadEvent e
            WHERE e.leadId = :leadId
              AND e.eventType = :type
              AND e.occurredAt >= :since
            """)
    boolean existsByLeadIdAndTypeSince(@Param("leadId") Long leadId,
                                       @Param("type") EventType type,
                                       @Param("since") OffsetDateTime since);

    boolean existsByDraftIdAndEventType(Long draftId, EventType eventType);

    Optional<LeadEvent> findFirstByDraftIdAndEventTypeOrderByOccurredAtAsc(Long draftId, EventType eventType);

    boolean existsByMessageIdAndEventType(String messageId, EventType eventType);

    Optional<LeadEvent> findFirstByMessageIdAndEventType(String messageId, EventType eventType);

    List<LeadEvent> findByLeadIdOrderByOccurredAtAsc(Long leadId);

    @Query("SELECT e.eventType, COUNT(e) FROM LeadEvent e WHERE e.sequenceId = :sequenceId GROUP BY e.eventType")
    List<Object[]> countEventTypesBySequenceId(@Param("sequenceId") Long sequenceId);

    @Query("SELECT e.eventType, COUNT(e) FROM LeadEvent e WHERE e.occurredAt >= :since GROUP BY e.eventType")
    List<Object[]> countEventTypesSince(@Param("since") OffsetDateTime since);
}
