package com.xendex.backend.integrations.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Content generation backed by the Anthropic Messages API.
 * Any failure to get usable JSON back falls through to {@link FallbackDraftTemplates}.
 */
@Service
@Slf4j
public class ClaudeContentGenerator implements ContentGenerator {

    @Value("${anthropic.api.key:}")
    private String anthropicApiKey;

    @Value("${anthropic.api.url:https://api.anthropic.com/v1/messages}")
    private String anthropicApiUrl;

    @Value("${anthropic.model:claude-3-5-sonnet-20241022}")
    private String model;

    @Value("${anthropic.version:2023-06-01}")
    private String apiVersion;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CompanyProfileCache companyProfileCache;
    private final FallbackDraftTemplates fallbackTemplates;

    public ClaudeContentGenerator(RestTemplate restTemplate,
                                  ObjectMapper objectMapper,
                                  CompanyProfileCache companyProfileCache,
                                  FallbackDraftTemplates fallbackTemplates) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.companyProfileCache = companyProfileCache;
        this.fallbackTemplates = fallbackTemplates;
    }

    @Override
    public GenerationResult generate(TouchContext context) {
        CompanyProfile profile = companyProfileCache.get();

        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            log.warn("Anthropic API key not configured, using fallback draft for lead {}", context.leadId());
            return fallbackTemplates.build(context, profile, "api_key_missing");
        }

        try {
            Map<String, Object> requestBody = Map.of(
                    "model", model,
                    "max_tokens", 800,
                    "system", buildSystemPrompt(profile),
                    "messages", List.of(Map.of("role", "user", "content", buildUserPrompt(context)))
            );

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.set("x-api-key", anthropicApiKey);
            headers.set("anthropic-version", apiVersion);

            ResponseEntity<String> response = restTemplate.postForEntity(
                    anthropicApiUrl, new HttpEntity<>(requestBody, headers), String.class);

            GenerationResult parsed = parseResponse(response.getBody());
            if (parsed == null) {
                log.warn("Unusable Claude response for lead {} touch {}, using fallback",
                        context.leadId(), context.touchNumber());
                return fallbackTemplates.build(context, profile, "unparseable_response");
            }

            log.info("Generated touch {} draft for lead {} with angle {}",
                    context.touchNumber(), context.leadId(), context.strategy().angle().getKey());
            return parsed;

        } catch (RestClientException e) {
            log.error("Error calling Claude API for lead {}: {}", context.leadId(), e.getMessage(), e);
            return fallbackTemplates.build(context, profile, "api_error");
        }
    }

    /**
     * Pulls {"subject_options": [...], "body": "..."} out of the first text block.
     * Returns null when the shape is not what was asked for.
     */
    GenerationResult parseResponse(String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            return null;
        }
        try {
            JsonNode content = objectMapper.readTree(rawResponse).path("content");
            if (!content.isArray() || content.isEmpty()) {
                return null;
            }
            JsonNode textBlock = content.get(0);
            if (!"text".equals(textBlock.path("type").asText())) {
                return null;
            }

            JsonNode draft = objectMapper.readTree(stripCodeFence(textBlock.path("text").asText()));
            String body = draft.path("body").asText("");
            List<String> subjects = new ArrayList<>();
            draft.path("subject_options").forEach(node -> {
                if (!node.asText().isBlank()) {
                    subjects.add(node.asText().trim());
                }
            });

            if (body.isBlank() || subjects.isEmpty()) {
                return null;
            }
            return GenerationResult.generated(subjects, body.trim());

        } catch (Exception e) {
            log.debug("Could not parse Claude draft JSON: {}", e.getMessage());
            return null;
        }
    }

    private String buildSystemPrompt(CompanyProfile profile) {
        return String.format(
                "You write short, specific B2B cold emails on behalf of %s. %s\n" +
                        "Services: %s\n" +
                        "Rules:\n" +
                        "- Under 120 words, plain text, no emojis\n" +
                        "- One idea per email, grounded in the research provided\n" +
                        "- Never invent facts about the prospect\n" +
                        "Respond with JSON only: {\"subject_options\": [three subjects], \"body\": \"...\"}",
                profile.name(),
                profile.positioning() == null ? "" : profile.positioning(),
                String.join(", ", profile.services()));
    }

    private String buildUserPrompt(TouchContext context) {
        ResearchContext research = context.research();
        StringBuilder prompt = new StringBuilder();
        prompt.append(String.format("Touch number: %d\n", context.touchNumber()));
        prompt.append(String.format("Template: %s\n", templateFor(context)));
        prompt.append(String.format("Prospect: %s at %s\n", context.firstName(), context.companyOrFallback()));

        if (context.persona() != null) {
            prompt.append(String.format("Persona: %s\n", context.persona()));
        }
        if (research.hasIndustry()) {
            prompt.append(String.format("Industry: %s\n", research.industry()));
        }
        if (research.companySummary() != null) {
            prompt.append(String.format("Company summary: %s\n", research.companySummary()));
        }
        if (!research.painIndicators().isEmpty()) {
            prompt.append(String.format("Pain indicators: %s\n", String.join("; ", research.painIndicators())));
        }
        if (!research.linkedinTopics().isEmpty()) {
            prompt.append(String.format("Recent LinkedIn topics: %s\n", String.join("; ", research.linkedinTopics())));
        }

        Strategy strategy = context.strategy();
        prompt.append(String.format("Angle: %s\n", strategy.angle().getKey()));
        if (strategy.hook() != null) {
            prompt.append(String.format("Hook: %s\n", strategy.hook()));
        }
        prompt.append(String.format("Tone: %s\n", strategy.tone()));
        prompt.append(String.format("Call to action: %s\n", strategy.cta().getPrompt()));

        return prompt.toString();
    }

    private static String templateFor(TouchContext context) {
        if (context.touchNumber() == 1) {
            return context.strategy().angle().getKey();
        }
        return context.touchNumber() == 2 ? "follow_up" : "breakup";
    }

    private static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
