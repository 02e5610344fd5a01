package com.xendex.backend.models;

import com.xendex.backend.enums.LeadStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "leads", indexes = {
        @Index(name = "idx_leads_email", columnList = "email"),
        @Index(name = "idx_leads_status_changed", columnList = "status, status_changed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Email
    @Column(length = 320)
    private String email;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "company_name")
    private String companyName;

    @Column(name = "company_domain")
    private String companyDomain;

    @Column(length = 100)
    private String persona;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private LeadStatus status = LeadStatus.NEW;

    @Column(name = "status_changed_at")
    private OffsetDateTime statusChangedAt;

    @Column(name = "last_contacted_at")
    private OffsetDateTime lastContactedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    /**
     * Moves the lead through the funnel, stamping when the change happened.
     * The stamp drives stuck-state recovery.
     */
    public void transitionTo(LeadStatus newStatus, OffsetDateTime at) {
        if (this.status != newStatus) {
            this.status = newStatus;
            this.statusChangedAt = at;
        }
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    public String getDisplayName() {
        if (firstName == null || firstName.isBlank()) {
            return "there";
        }
        return firstName;
    }
}
