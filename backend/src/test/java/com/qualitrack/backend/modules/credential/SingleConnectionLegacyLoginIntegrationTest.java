package com.qualitrack.backend.modules.credential;

import static org.assertj.core.api.Assertions.assertThat;

import com.qualitrack.backend.modules.credential.application.CredentialStore;
import com.qualitrack.backend.modules.credential.application.CredentialVerification;
import com.qualitrack.backend.modules.credential.domain.CredentialFormat;
import com.qualitrack.backend.modules.credential.infrastructure.persistence.AppUserRepository;
import com.qualitrack.backend.support.AbstractPostgresIntegrationTest;
import com.qualitrack.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * With a pool of one connection, the legacy upgrade only succeeds if the account lookup has
 * already handed its connection back.
 */
@SpringBootTest(properties = {
        "spring.datasource.hikari.maximum-pool-size=1",
        "spring.datasource.hikari.connection-timeout=2000"
})
@Testcontainers(disabledWithoutDocker = true)
class SingleConnectionLegacyLoginIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void legacyUpgradeDoesNotWaitForASecondConnection() {
        testUserFactory.legacyUser("otk5", "pass-otk5");

        long startedAt = System.nanoTime();
        CredentialVerification verification = credentialStore.verify("otk5", "pass-otk5");
        long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000;

        assertThat(verification.ok()).isTrue();
        assertThat(verification.formatUsed()).isEqualTo(CredentialFormat.LEGACY);
        assertThat(appUserRepository.findByLoginIgnoreCase("otk5").orElseThrow().getPasswordFormat())
                .isEqualTo(CredentialFormat.ADAPTIVE);
        assertThat(elapsedMillis).isLessThan(2000);
    }
}
