package com.xendex.backend.services.sequence;

public record ReplyResult(Long leadId, Long eventId, int membershipsStopped, boolean duplicate) {

    public static ReplyResult duplicate(Long leadId) {
        return new ReplyResult(leadId, null, 0, true);
    }
}
