package com.xendex.backend.integrations.email;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Checks the Svix signature Resend attaches to webhook deliveries.
 *
 * <p>The signed content is {@code svix-id + "." + svix-timestamp + "." + body}, signed with
 * HMAC-SHA256 under the base64 key that follows the {@code whsec_} prefix of the endpoint secret.
 * The {@code svix-signature} header holds one or more space-separated {@code v1,<base64>} entries.
 * With no secret configured every delivery is accepted.
 */
@Component
@Slf4j
public class ResendWebhookVerifier {

    static final Duration TOLERANCE = Duration.ofMinutes(5);
    private static final String SECRET_PREFIX = "whsec_";

    @Value("${resend.webhook.secret:}")
    private String secret;

    private final Clock clock;

    public ResendWebhookVerifier(Clock clock) {
        this.clock = clock;
    }

    public boolean isEnabled() {
        return StringUtils.hasText(secret);
    }

    public boolean isSignatureValid(String payload, String messageId, String timestamp, String signatureHeader) {
        if (!StringUtils.hasText(messageId) || !StringUtils.hasText(timestamp) || !StringUtils.hasText(signatureHeader)) {
            log.warn("Missing svix-id, svix-timestamp or svix-signature header");
            return false;
        }
        if (!isFresh(timestamp)) {
            log.warn("Webhook {} timestamp {} is outside the {} tolerance", messageId, timestamp, TOLERANCE);
            return false;
        }

        byte[] expected;
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(signingKey(), "HmacSHA256"));
            String signedContent = messageId + "." + timestamp + "." + payload;
            expected = mac.doFinal(signedContent.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException | IllegalArgumentException e) {
            log.error("Error validating Resend signature: {}", e.getMessage());
            return false;
        }

        for (String entry : signatureHeader.trim().split(" ")) {
            int comma = entry.indexOf(',');
            if (comma < 0 || !"v1".equals(entry.substring(0, comma))) {
                continue;
            }
            byte[] candidate;
            try {
                candidate = Base64.getDecoder().decode(entry.substring(comma + 1));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed signature entry on webhook {}", messageId);
                continue;
            }
            if (MessageDigest.isEqual(expected, candidate)) {
                return true;
            }
        }
        log.warn("Signature mismatch on webhook {}", messageId);
        return false;
    }

    private boolean isFresh(String timestamp) {
        long seconds;
        try {
            seconds = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            return false;
        }
        Duration skew = Duration.between(Instant.ofEpochSecond(seconds), clock.instant()).abs();
        return skew.compareTo(TOLERANCE) <= 0;
    }

    private byte[] signingKey() {
        String encoded = secret.startsWith(SECRET_PREFIX) ? secret.substring(SECRET_PREFIX.length()) : secret;
        return Base64.getDecoder().decode(encoded);
    }
}
