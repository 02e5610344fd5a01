package com.xendex.backend.repositories;

import com.xendex.backend.models.LeadIntelligence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LeadIntelligenceRepository extends JpaRepository<LeadIntelligence, Long> {

    Optional<LeadIntelligence> findByLeadId(Long leadId);
}
