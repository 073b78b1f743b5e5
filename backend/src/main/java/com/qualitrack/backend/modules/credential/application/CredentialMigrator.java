package com.qualitrack.backend.modules.credential.application;

import com.qualitrack.backend.modules.credential.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Replaces a just-verified legacy digest with an adaptive hash.
 * Runs in its own transaction and never fails the login that triggered it.
 */
@Component
public class CredentialMigrator {

    private static final Logger log = LoggerFactory.getLogger(CredentialMigrator.class);

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final TransactionTemplate transactionTemplate;

    public CredentialMigrator(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            PlatformTransactionManager transactionManager
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * @return true when this call performed the upgrade, false when it was already done or failed
     */
    public boolean migrate(Long userId, String verifiedPassword) {
        try {
            String adaptiveHash = passwordEncoder.encode(verifiedPassword);
            Integer updated = transactionTemplate.execute(
                    status -> appUserRepository.upgradeLegacyCredential(userId, adaptiveHash));
            if (updated != null && updated > 0) {
                log.info("Upgraded legacy credential of user {} to adaptive hash", userId);
                return true;
            }
            log.debug("Legacy credential of user {} was already upgraded", userId);
            return false;
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to upgrade legacy credential of user {}; legacy digest kept", userId, ex);
            return false;
        }
    }
}
