package com.xendex.backend.services;

import com.xendex.backend.models.SuppressedEmail;
import com.xendex.backend.repositories.SuppressedEmailRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class SuppressionService {

    private final SuppressedEmailRepository suppressedEmailRepository;

    @Transactional(readOnly = true)
    public boolean isSuppressed(String email) {
        return email != null && suppressedEmailRepository.existsByEmailIgnoreCase(email.trim());
    }

    /**
     * Adds the address to the suppression list. Already-suppressed addresses are left as they are.
     */
    @Transactional
    public boolean suppress(String email, String reason) {
        if (email == null || email.isBlank() || isSuppressed(email)) {
            return false;
        }
        suppressedEmailRepository.save(SuppressedEmail.builder()
                .email(email.trim().toLowerCase(Locale.ROOT))
                .reason(reason)
                .build());
        log.info("Suppressed {} ({})", email, reason);
        return true;
    }
}
