package com.xendex.backend.enums;

public enum DraftStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isActive() {
        return this != REJECTED;
    }
}
