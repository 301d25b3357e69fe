package com.fulfillment.pipeline.core;

import com.fulfillment.pipeline.persistence.entity.AffiliateEntity;
import com.fulfillment.pipeline.persistence.entity.AffiliateLedgerEntryEntity;
import com.fulfillment.pipeline.persistence.repository.AffiliateLedgerRepository;
import com.fulfillment.pipeline.persistence.repository.AffiliateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.List;
import java.util.Optional;

/**
 * Affiliate registration and lookup. Commission booking lives in
 * {@link com.fulfillment.pipeline.persistence.service.AffiliateLedgerService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AffiliateService {

    static final String CODE_PREFIX = "AFF_";
    private static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int CODE_LENGTH = 8;
    private static final int MAX_CODE_ATTEMPTS = 5;

    private final AffiliateRepository affiliateRepository;
    private final AffiliateLedgerRepository ledgerRepository;
    private final SecureRandom random = new SecureRandom();

    /**
     * Registers {@code userRef} as an affiliate, or returns the existing registration.
     */
    @Transactional
    public AffiliateEntity register(String userRef) {
        Optional<AffiliateEntity> existing = affiliateRepository.findByUserRef(userRef);
        if (existing.isPresent()) {
            return existing.get();
        }
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = generateCode();
            if (!affiliateRepository.existsById(code)) {
                AffiliateEntity saved = affiliateRepository.save(AffiliateEntity.builder()
                        .code(code)
                        .userRef(userRef)
                        .build());
                log.info("Affiliate registered: code={}", code);
                return saved;
            }
        }
        throw new IllegalStateException("Could not allocate a unique affiliate code");
    }

    @Transactional(readOnly = true)
    public AffiliateEntity get(String code) {
        return affiliateRepository.findById(code).orElseThrow(() -> new AffiliateNotFoundException(code));
    }

    @Transactional(readOnly = true)
    public boolean exists(String code) {
        return code != null && affiliateRepository.existsById(code);
    }

    @Transactional(readOnly = true)
    public List<AffiliateLedgerEntryEntity> ledger(String code) {
        return ledgerRepository.findByAffiliateCodeOrderByCreatedAtDesc(code);
    }

    private String generateCode() {
        StringBuilder sb = new StringBuilder(CODE_PREFIX);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }
}
