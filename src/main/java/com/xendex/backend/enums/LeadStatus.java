package com.xendex.backend.enums;

/**
 * Funnel position of a lead. IN_PROGRESS is the hidden state between touch 1 being sent
 * and its confirmation; it is never shown as "in sequence".
 */
public enum LeadStatus {
    NEW("New"),
    RESEARCHING("Researching"),
    QUALIFIED("Qualified"),
    NOT_QUALIFIED("Not Qualified"),
    IN_PROGRESS("In Progress"),
    CONTACTED("Contacted"),
    SEQUENCING("Sequencing"),
    REPLIED("Replied"),
    CONVERTED("Converted"),
    DISQUALIFIED("Disqualified"),
    COMPLETED("Completed");

    private final String displayName;

    LeadStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isVisibleInFunnel() {
        return this != IN_PROGRESS;
    }

    /**
     * Leads in these states never receive another drafted touch.
     */
    public boolean isClosedForOutreach() {
        return this == REPLIED || this == CONVERTED || this == DISQUALIFIED;
    }

    public boolean canRecordReply() {
        return this != CONVERTED;
    }
}
