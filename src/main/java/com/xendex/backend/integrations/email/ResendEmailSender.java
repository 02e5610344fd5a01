package com.xendex.backend.integrations.email;

import com.resend.Resend;
import com.resend.core.exception.ResendException;
import com.resend.services.emails.model.CreateEmailOptions;
import com.resend.services.emails.model.CreateEmailResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * EmailSender backed by Resend
 * https://resend.com
 */
@Service
@Slf4j
public class ResendEmailSender implements EmailSender {

    private final Resend resend;
    private final boolean enabled;
    private final String fromEmail;
    private final String fromName;

    public ResendEmailSender(
            @Value("${resend.api-key:}") String apiKey,
            @Value("${resend.enabled:true}") boolean enabledConfig,
            @Value("${resend.from-email:outreach@xendex.io}") String fromEmail,
            @Value("${resend.from-name:Xendex}") String fromName) {

        this.fromEmail = fromEmail;
        this.fromName = fromName;

        boolean hasValidKey = apiKey != null && apiKey.startsWith("re_");
        this.enabled = enabledConfig && hasValidKey;

        if (this.enabled) {
            this.resend = new Resend(apiKey);
            log.info("Resend email sender initialized, from: {} <{}>", fromName, fromEmail);
        } else {
            this.resend = null;
            if (!hasValidKey) {
                log.warn("Resend API key not configured or invalid - outreach emails will not be sent");
            } else {
                log.warn("Resend is disabled via configuration");
            }
        }
    }

    @Override
    public SendResult send(String toEmail, String subject, String body) {
        if (!enabled) {
            log.warn("Resend DISABLED - would send to: {} | Subject: {}", toEmail, subject);
            return SendResult.failed("Resend service is disabled - set RESEND_API_KEY");
        }
        if (toEmail == null || toEmail.isBlank()) {
            return SendResult.failed("Recipient email is required");
        }
        if (subject == null || subject.isBlank()) {
            return SendResult.failed("Subject is required");
        }

        try {
            CreateEmailOptions options = CreateEmailOptions.builder()
                    .from(String.format("%s <%s>", fromName, fromEmail))
                    .to(toEmail)
                    .subject(subject)
                    .text(body)
                    .html(toHtml(body))
                    .build();

            CreateEmailResponse response = resend.emails().send(options);
            log.info("Email sent via Resend to {} - Message ID: {}", toEmail, response.getId());
            return SendResult.sent(response.getId());

        } catch (ResendException e) {
            log.error("Resend API error sending to {}: {}", toEmail, e.getMessage());
            return SendResult.failed("Resend API error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error sending email to {}: {}", toEmail, e.getMessage(), e);
            return SendResult.failed("Unexpected error: " + e.getMessage());
        }
    }

    private static String toHtml(String body) {
        return "<div style=\"font-family: Arial, sans-serif; font-size: 14px;\">"
                + HtmlUtils.htmlEscape(body).replace("\n", "<br>")
                + "</div>";
    }
}
