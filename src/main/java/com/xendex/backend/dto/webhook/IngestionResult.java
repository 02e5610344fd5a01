package com.xendex.backend.dto.webhook;

public record IngestionResult(String status, Long leadId, String detail) {

    public static IngestionResult ignored(String detail) {
        return new IngestionResult("ignored", null, detail);
    }
}
