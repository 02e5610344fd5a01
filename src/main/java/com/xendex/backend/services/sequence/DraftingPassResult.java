package com.xendex.backend.services.sequence;

public record DraftingPassResult(int created, int skippedExisting, int skippedNoResearch, int skippedClosed, int failed) {

    public int skipped() {
        return skippedExisting + skippedNoResearch + skippedClosed;
    }
}
