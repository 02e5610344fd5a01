package com.xendex.backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum MembershipStatus {
    PENDING("Pending"),
    READY("Ready"),
    ACTIVE("Active"),
    COMPLETED("Completed"),
    STOPPED("Stopped");

    /**
     * Memberships that a reply must stop.
     */
    public static final Set<MembershipStatus> IN_FLIGHT = EnumSet.of(PENDING, READY, ACTIVE);

    private final String displayName;

    MembershipStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED;
    }
}
