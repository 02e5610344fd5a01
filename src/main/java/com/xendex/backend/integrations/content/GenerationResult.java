package com.xendex.backend.integrations.content;

import java.util.List;

/**
 * Generated subject lines and body. {@code fallbackUsed} is true when the templated draft was
 * used instead of the model's output; {@code fallbackReason} then says why.
 */
public record GenerationResult(
        List<String> subjectOptions,
        String body,
        boolean fallbackUsed,
        String fallbackReason
) {

    public GenerationResult {
        subjectOptions = subjectOptions == null ? List.of() : List.copyOf(subjectOptions);
    }

    public static GenerationResult generated(List<String> subjectOptions, String body) {
        return new GenerationResult(subjectOptions, body, false, null);
    }

    public static GenerationResult fallback(List<String> subjectOptions, String body, String reason) {
        return new GenerationResult(subjectOptions, body, true, reason);
    }
}
