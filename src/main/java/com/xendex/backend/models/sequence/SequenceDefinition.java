package com.xendex.backend.models.sequence;

import com.xendex.backend.enums.SequenceStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A named outreach campaign: how many touches, and how long to wait before each follow-up.
 * {@code touchDelays[0]} is the wait before touch 2, in the configured delay unit.
 */
@Entity
@Table(name = "sequences")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SequenceDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Stable key for system-owned sequences such as DEFAULT-FOLLOWUP; null for user sequences. */
    @Column(name = "external_id", unique = true, length = 100)
    private String externalId;

    @NotBlank
    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Min(1)
    @Column(nullable = false)
    @Builder.Default
    private Integer touches = 3;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "touch_delays", columnDefinition = "jsonb")
    @Builder.Default
    private List<Integer> touchDelays = new ArrayList<>(List.of(3, 5));

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SequenceStatus status = SequenceStatus.DRAFT;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isSystem() {
        return externalId != null;
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    /**
     * Delay units to wait after {@code sentTouch} before the next touch goes out.
     */
    public int delayAfterTouch(int sentTouch, int fallback) {
        int index = sentTouch - 1;
        if (touchDelays == null || index < 0 || index >= touchDelays.size() || touchDelays.get(index) == null) {
            return fallback;
        }
        return touchDelays.get(index);
    }

    public boolean isLastTouch(int touchNumber) {
        return touchNumber >= touches;
    }
}
