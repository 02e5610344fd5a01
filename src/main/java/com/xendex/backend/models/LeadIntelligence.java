package com.xendex.backend.models;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Research gathered for a lead before it can be drafted for.
 * Written by the research pipeline; read-only here.
 */
@Entity
@Table(name = "lead_intelligence")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadIntelligence {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lead_id", nullable = false, unique = true)
    private Long leadId;

    @Column(length = 150)
    private String industry;

    @Column(name = "company_summary", columnDefinition = "TEXT")
    private String companySummary;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "pain_indicators", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> painIndicators = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "buying_signals", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> buyingSignals = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "triggers", columnDefinition = "jsonb")
    @Builder.Default
    private List<TriggerSignal> triggers = new ArrayList<>();

    @Column(name = "linkedin_role")
    private String linkedinRole;

    @Column(name = "linkedin_seniority", length = 50)
    private String linkedinSeniority;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "linkedin_topics", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> linkedinTopics = new ArrayList<>();

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
