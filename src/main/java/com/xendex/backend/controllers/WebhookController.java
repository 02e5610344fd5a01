package com.xendex.backend.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xendex.backend.dto.webhook.IngestionResult;
import com.xendex.backend.dto.webhook.ManualReplyRequest;
import com.xendex.backend.dto.webhook.ResendWebhookEvent;
import com.xendex.backend.dto.webhook.TestReplyRequest;
import com.xendex.backend.exceptions.ResourceNotFoundException;
import com.xendex.backend.integrations.email.ResendWebhookVerifier;
import com.xendex.backend.models.Lead;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.services.EmailEventIngestionService;
import com.xendex.backend.services.sequence.ReplyHandlingService;
import com.xendex.backend.services.sequence.ReplyResult;
import com.xendex.backend.services.sequence.ReplySignal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final EmailEventIngestionService ingestionService;
    private final ReplyHandlingService replyHandlingService;
    private final LeadRepository leadRepository;
    private final ResendWebhookVerifier webhookVerifier;
    private final ObjectMapper objectMapper;

    /**
     * Resend delivery, engagement, bounce and reply events. The raw body is kept for
     * signature checking when {@code resend.webhook.secret} is set.
     */
    @PostMapping("/resend")
    public ResponseEntity<IngestionResult> handleResendWebhook(
            @RequestBody String payload,
            @RequestHeader(value = "svix-id", required = false) String messageId,
            @RequestHeader(value = "svix-timestamp", required = false) String timestamp,
            @RequestHeader(value = "svix-signature", required = false) String signature) {

        if (webhookVerifier.isEnabled() && !webhookVerifier.isSignatureValid(payload, messageId, timestamp, signature)) {
            log.warn("Rejecting Resend webhook {} with invalid signature", messageId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(IngestionResult.ignored("invalid_signature"));
        }

        ResendWebhookEvent event;
        try {
            event = objectMapper.readValue(payload, ResendWebhookEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid webhook JSON: " + e.getOriginalMessage(), e);
        }
        if (!StringUtils.hasText(event.getType())) {
            throw new IllegalArgumentException("type is required");
        }
        log.debug("Received Resend webhook {}", event.getType());
        return ResponseEntity.ok(ingestionService.ingest(event));
    }

    /**
     * Simulate an inbound reply, for testing cancellation end to end
     */
    @PostMapping("/test-reply")
    public ResponseEntity<ReplyResult> testReply(@Valid @RequestBody TestReplyRequest request) {
        String body = request.getBody() != null ? request.getBody() : "Test reply";
        return ResponseEntity.ok(replyHandlingService.recordReply(
                ReplySignal.manual(request.getLeadId(), body, "test")));
    }

    /**
     * Log a reply that arrived outside the mail pipeline
     */
    @PostMapping("/manual-reply")
    public ResponseEntity<ReplyResult> logManualReply(@Valid @RequestBody ManualReplyRequest request) {
        Long leadId = request.getLeadId();
        if (leadId == null) {
            if (request.getEmail() == null) {
                throw new IllegalArgumentException("leadId or email is required");
            }
            leadId = leadRepository.findFirstByEmailIgnoreCase(request.getEmail())
                    .map(Lead::getId)
                    .orElseThrow(() -> new ResourceNotFoundException("No lead with email " + request.getEmail()));
        }
        return ResponseEntity.ok(replyHandlingService.recordReply(new ReplySignal(leadId, null,
                request.getSubject(), request.getBody(), request.getRepliedAt(), "manual")));
    }
}
