package com.xendex.backend.services.sequence;

public record StartResult(Long sequenceId, int activated, int followUpsScheduled, int completed) {
}
