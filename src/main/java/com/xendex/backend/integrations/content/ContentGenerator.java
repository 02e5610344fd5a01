package com.xendex.backend.integrations.content;

/**
 * Produces email content for a touch. Has no side effects and does not throw for model
 * failures; those come back as a fallback result.
 */
public interface ContentGenerator {

    GenerationResult generate(TouchContext context);
}
