package com.xendex.backend.enums;

public enum TaskType {
    /** Generate touch-1 drafts for a sequence's pending and active members. */
    DRAFTING_PASS,
    /** Promote a lead to "contacted" once the grace period after touch 1 passed without a reply. */
    CONFIRM_TOUCH_ONE,
    /** Produce and send the next touch of a sequence. */
    FOLLOW_UP
}
