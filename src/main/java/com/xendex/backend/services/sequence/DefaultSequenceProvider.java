package com.xendex.backend.services.sequence;

import com.xendex.backend.config.SequenceProperties;
import com.xendex.backend.enums.SequenceStatus;
import com.xendex.backend.models.sequence.SequenceDefinition;
import com.xendex.backend.repositories.sequence.SequenceDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;

/**
 * Owns the system follow-up sequence used when drafts are generated without a sequence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DefaultSequenceProvider {

    private final SequenceDefinitionRepository sequenceRepository;
    private final SequenceProperties sequenceProperties;

    @Transactional
    public SequenceDefinition getOrCreate() {
        SequenceProperties.DefaultSequence config = sequenceProperties.defaultSequence();
        return sequenceRepository.findByExternalId(config.externalId())
                .orElseGet(() -> {
                    SequenceDefinition created = sequenceRepository.save(SequenceDefinition.builder()
                            .externalId(config.externalId())
                            .name(config.name())
                            .description("System sequence for follow-ups of individually approved drafts")
                            .touches(config.touches())
                            .touchDelays(new ArrayList<>(config.touchDelays()))
                            .status(SequenceStatus.ACTIVE)
                            .build());
                    log.info("Created system sequence {} ({})", created.getId(), config.externalId());
                    return created;
                });
    }

    public boolean isDefault(SequenceDefinition sequence) {
        return sequenceProperties.defaultSequence().externalId().equals(sequence.getExternalId());
    }
}
