package com.xendex.backend.repositories.sequence;

import com.xendex.backend.enums.MembershipStatus;
import com.xendex.backend.models.sequence.SequenceMembership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SequenceMembershipRepository extends JpaRepository<SequenceMembership, Long> {

    Optional<SequenceMembership> findBySequenceIdAndLeadId(Long sequenceId, Long leadId);

    boolean existsBySequenceIdAndLeadId(Long sequenceId, Long leadId);

    boolean existsBySequenceIdAndStatus(Long sequenceId, MembershipStatus status);

    List<SequenceMembership> findBySequenceIdOrderByCreatedAtAsc(Long sequenceId);

    List<SequenceMembership> findBySequenceIdAndStatusIn(Long sequenceId, Collection<MembershipStatus> statuses);

    @Query("""
            SELECT m FROM SequenceMembership m
            WHERE m.sequenceId = :sequenceId
              AND m.status IN :statuses
              AND m.currentTouch < :touch
            ORDER BY m.id ASC
            """)
    List<SequenceMembership> findAwaitingTouch(@Param("sequenceId") Long sequenceId,
                                               @Param("statuses") Collection<MembershipStatus> statuses,
                                               @Param("touch") int touch);

    List<SequenceMembership> findByLeadIdAndStatusIn(Long leadId, Collection<MembershipStatus> statuses);

    long countBySequenceIdAndStatus(Long sequenceId, MembershipStatus status);

    long countBySequenceId(Long sequenceId);

    long countBySequenceIdAndStoppedReason(Long sequenceId, String stoppedReason);

    @Query("SELECT COUNT(m) > 0 FROM SequenceMembership m WHERE m.sequenceId = :sequenceId AND m.currentTouch >= 1")
    boolean anyTouchSent(@Param("sequenceId") Long sequenceId);

    @Modifying
    @Query("DELETE FROM SequenceMembership m WHERE m.sequenceId = :sequenceId")
    int deleteBySequenceId(@Param("sequenceId") Long sequenceId);
}
