package com.xendex.backend.repositories.sequence;

import com.xendex.backend.enums.SequenceStatus;
import com.xendex.backend.models.sequence.SequenceDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SequenceDefinitionRepository extends JpaRepository<SequenceDefinition, Long> {

    Optional<SequenceDefinition> findByExternalId(String externalId);

    List<SequenceDefinition> findAllByOrderByCreatedAtDesc();

    List<SequenceDefinition> findByStatusOrderByCreatedAtDesc(SequenceStatus status);
}
