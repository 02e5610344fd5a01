package com.xendex.backend.services;

import com.xendex.backend.integrations.email.InboundEmail;
import com.xendex.backend.integrations.email.InboundEmailSource;
import com.xendex.backend.models.Lead;
import com.xendex.backend.repositories.LeadRepository;
import com.xendex.backend.services.sequence.ReplyHandlingService;
import com.xendex.backend.services.sequence.ReplyResult;
import com.xendex.backend.services.sequence.ReplySignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Picks up replies the webhook may have missed by polling the provider's inbox.
 * Emails from unknown senders are ignored; repeats are dropped by message id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplyPollingService {

    static final String SOURCE = "polling";

    private final InboundEmailSource inboundEmailSource;
    private final LeadRepository leadRepository;
    private final ReplyHandlingService replyHandlingService;

    @Scheduled(fixedDelayString = "${xendex.replies.poll-interval-ms:300000}")
    public void poll() {
        try {
            pollInbox();
        } catch (Exception e) {
            log.error("Error polling for replies: {}", e.getMessage(), e);
        }
    }

    /**
     * Returns how many new replies were recorded.
     */
    public int pollInbox() {
        if (!inboundEmailSource.isConfigured()) {
            log.debug("Inbound email source not configured, skipping reply poll");
            return 0;
        }

        List<InboundEmail> received = inboundEmailSource.fetchReceived();
        int recorded = 0;
        for (InboundEmail email : received) {
            String sender = EmailEventIngestionService.extractAddress(email.from());
            Optional<Lead> lead = leadRepository.findFirstByEmailIgnoreCase(sender);
            if (lead.isEmpty()) {
                log.debug("Received email {} from {} matches no lead", email.id(), sender);
                continue;
            }
            try {
                ReplyResult result = replyHandlingService.recordReply(new ReplySignal(lead.get().getId(),
                        email.id(), email.subject(), null, email.receivedAt(), SOURCE));
                if (!result.duplicate()) {
                    recorded++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to record polled reply {} for lead {}: {}",
                        email.id(), lead.get().getId(), e.getMessage(), e);
            }
        }

        if (recorded > 0) {
            log.info("Reply poll recorded {} new replies out of {} received emails", recorded, received.size());
        }
        return recorded;
    }
}
