package com.xendex.backend.repositories.sequence;

import com.xendex.backend.enums.DraftStatus;
import com.xendex.backend.models.sequence.Draft;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DraftRepository extends JpaRepository<Draft, Long> {

    /**
     * The live (non-rejected) draft for a lead, sequence and touch, if any.
     */
    Optional<Draft> findByActiveKey(String activeKey);

    boolean existsByActiveKey(String activeKey);

    List<Draft> findByStatusOrderByCreatedAtDesc(DraftStatus status);

    long countByStatus(DraftStatus status);

    List<Draft> findBySequenceIdAndStatusOrderByCreatedAtDesc(Long sequenceId, DraftStatus status);

    List<Draft> findBySequenceIdOrderByCreatedAtDesc(Long sequenceId);

    List<Draft> findAllByOrderByCreatedAtDesc();

    @Modifying
    @Query("DELETE FROM Draft d WHERE d.sequenceId = :sequenceId AND d.status = :status")
    int deleteBySequenceIdAndStatus(@Param("sequenceId") Long sequenceId, @Param("status") DraftStatus status);
}
