package com.xendex.backend.repositories;

import com.xendex.backend.enums.LeadStatus;
import com.xendex.backend.models.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeadRepository extends JpaRepository<Lead, Long> {

    Optional<Lead> findFirstByEmailIgnoreCase(String email);

    @Query("""
            SELECT l FROM Lead l
            WHERE l.status = :status
              AND COALESCE(l.statusChangedAt, l.updatedAt) < :before
            """)
    List<Lead> findStuckInStatus(@Param("status") LeadStatus status,
                                 @Param("before") OffsetDateTime before);

    @Query("SELECT l.status, COUNT(l) FROM Lead l GROUP BY l.status")
    List<Object[]> countLeadsByStatus();
}
