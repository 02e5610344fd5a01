package com.xendex.backend.services.sequence;

/**
 * What happened when a draft was approved.
 *
 * @param nextStep set only when the draft was sent
 */
public record ApprovalResult(Long draftId, Status status, String messageId, String error,
                             SequenceProgressionService.Step nextStep) {

    public enum Status {
        SENT,
        ALREADY_SENT,
        SEND_FAILED,
        REJECTED_BY_STATE
    }

    public boolean isSent() {
        return status == Status.SENT;
    }
}
