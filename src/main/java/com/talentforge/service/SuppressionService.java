package com.talentforge.service;

import com.talentforge.model.EmailSuppression;
import com.talentforge.model.SuppressionReason;
import com.talentforge.repository.EmailSuppressionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SuppressionService {

    private final EmailSuppressionRepository suppressionRepository;

    public static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Adds the address to the company's suppression list unless it is already
     * there. The (company, email) unique constraint backs up the check; a
     * racing insert fails the surrounding transaction, which the ledger retries.
     *
     * @return true if a new record was written
     */
    @Transactional
    public boolean suppress(UUID companyId, String email, SuppressionReason reason, String source) {
        if (email == null || email.isBlank()) {
            return false;
        }
        String normalized = normalize(email);
        if (suppressionRepository.existsByCompanyIdAndEmail(companyId, normalized)) {
            log.debug("{} already suppressed for company {}", normalized, companyId);
            return false;
        }

        suppressionRepository.save(EmailSuppression.builder()
                .companyId(companyId)
                .email(normalized)
                .reason(reason)
                .source(source)
                .build());
        log.info("Suppressed {} for company {} ({})", normalized, companyId, reason.getValue());
        return true;
    }
}
