package com.xendex.backend.integrations.email;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xendex.backend.exceptions.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the Resend receiving API ({@code GET /emails/receiving}).
 */
@Service
@Slf4j
public class ResendInboundEmailClient implements InboundEmailSource {

    @Value("${resend.api-key:}")
    private String apiKey;

    @Value("${resend.api-url:https://api.resend.com}")
    private String apiUrl;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public ResendInboundEmailClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && apiKey.startsWith("re_");
    }

    @Override
    public List<InboundEmail> fetchReceived() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    apiUrl + "/emails/receiving", HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return parseList(response.getBody());
        } catch (RestClientException e) {
            throw new CollaboratorException("Listing received emails from Resend failed: " + e.getMessage(), e);
        }
    }

    List<InboundEmail> parseList(String rawResponse) {
        List<InboundEmail> emails = new ArrayList<>();
        if (rawResponse == null || rawResponse.isBlank()) {
            return emails;
        }
        JsonNode data;
        try {
            data = objectMapper.readTree(rawResponse).path("data");
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Unreadable Resend receiving response", e);
        }
        for (JsonNode node : data) {
            String id = node.path("id").asText("");
            if (id.isBlank()) {
                continue;
            }
            emails.add(new InboundEmail(id,
                    node.path("from").asText(""),
                    node.path("subject").asText(null),
                    parseTimestamp(node.path("created_at").asText(null))));
        }
        return emails;
    }

    /**
     * Resend sends both ISO-8601 and Postgres-style ("2025-03-01 10:00:00.123+00") timestamps.
     */
    static OffsetDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace(' ', 'T');
        if (normalized.matches(".*[+-]\\d{2}$")) {
            normalized = normalized + ":00";
        }
        try {
            return OffsetDateTime.parse(normalized);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable received-at timestamp '{}', using poll time", value);
            return null;
        }
    }
}
