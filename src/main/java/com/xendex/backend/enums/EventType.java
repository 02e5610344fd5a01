package com.xendex.backend.enums;

import java.util.Arrays;
import java.util.Optional;

public enum EventType {
    SENT("email.sent"),
    DELIVERED("email.delivered"),
    OPENED("email.opened"),
    CLICKED("email.clicked"),
    REPLIED("email.replied"),
    BOUNCED("email.bounced"),
    SPAM_COMPLAINT("email.complained");

    private final String providerType;

    EventType(String providerType) {
        this.providerType = providerType;
    }

    public String getProviderType() {
        return providerType;
    }

    public boolean suppressesAddress() {
        return this == BOUNCED || this == SPAM_COMPLAINT;
    }

    public static Optional<EventType> fromProviderType(String type) {
        return Arrays.stream(values())
                .filter(value -> value.providerType.equalsIgnoreCase(type))
                .findFirst();
    }
}
