package com.xendex.backend.services;

import com.xendex.backend.config.RecoveryProperties;
import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.models.Lead;
import com.xendex.backend.repositories.LeadRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Research jobs can die without reporting back. Leads left in RESEARCHING past the timeout
 * are moved to NOT_QUALIFIED so they show up in the funnel again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StuckLeadRecoveryService {

    private final LeadRepository leadRepository;
    private final RecoveryProperties recoveryProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${xendex.recovery.sweep-interval-ms:300000}")
    @Transactional
    public void sweep() {
        try {
            recoverStuckLeads();
        } catch (Exception e) {
            log.error("Error in stuck lead recovery: {}", e.getMessage(), e);
        }
    }

    @Transactional
    public int recoverStuckLeads() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime threshold = now.minus(recoveryProperties.researchTimeout());

        List<Lead> stuck = leadRepository.findStuckInStatus(LeadStatus.RESEARCHING, threshold);
        if (stuck.isEmpty()) {
            log.debug("No leads stuck in research");
            return 0;
        }

        for (Lead lead : stuck) {
            log.warn("Lead {} stuck in RESEARCHING since {}, marking NOT_QUALIFIED",
                    lead.getId(), lead.getStatusChangedAt());
            lead.transitionTo(LeadStatus.NOT_QUALIFIED, now);
        }
        leadRepository.saveAll(stuck);

        Counter.builder("leads.recovered.stuck")
                .description("Leads forced out of RESEARCHING by the recovery sweep")
                .register(meterRegistry)
                .increment(stuck.size());

        log.info("Recovered {} leads stuck in research", stuck.size());
        return stuck.size();
    }
}
