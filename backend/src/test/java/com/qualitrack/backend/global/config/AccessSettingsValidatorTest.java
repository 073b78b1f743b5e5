package com.qualitrack.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class AccessSettingsValidatorTest {

    @Test
    void defaultsAreValid() {
        AccessSettingsValidator validator = new AccessSettingsValidator(new MockEnvironment());

        assertThat(validator.validate()).isEmpty();
    }

    @Test
    void reportsEveryInvalidSetting() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(AccessSettingsValidator.BCRYPT_STRENGTH, "3")
                .withProperty(AccessSettingsValidator.CACHE_TTL, "PT0S")
                .withProperty(AccessSettingsValidator.DEFAULT_GRANT_DURATION, "soon");

        assertThat(new AccessSettingsValidator(environment).validate())
                .hasSize(3)
                .anySatisfy(problem -> assertThat(problem).startsWith(AccessSettingsValidator.BCRYPT_STRENGTH))
                .anySatisfy(problem -> assertThat(problem).contains("must be positive"))
                .anySatisfy(problem -> assertThat(problem).contains("not a duration"));
    }

    @Test
    void acceptsSimpleDurationStyle() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(AccessSettingsValidator.CACHE_TTL, "90s")
                .withProperty(AccessSettingsValidator.DEFAULT_GRANT_DURATION, "30d");

        assertThat(new AccessSettingsValidator(environment).validate()).isEmpty();
    }

    @Test
    void rejectsUnusableCacheAndSessionLimits() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(AccessSettingsValidator.CACHE_MAX_SIZE, "0")
                .withProperty(AccessSettingsValidator.SESSION_MAX_PER_USER, "many")
                .withProperty(AccessSettingsValidator.SESSION_REMEMBER_ME_TIMEOUT, "-P1D");

        assertThat(new AccessSettingsValidator(environment).validate())
                .containsExactlyInAnyOrder(
                        AccessSettingsValidator.CACHE_MAX_SIZE + ": must be positive",
                        AccessSettingsValidator.SESSION_MAX_PER_USER + ": must be a number",
                        AccessSettingsValidator.SESSION_REMEMBER_ME_TIMEOUT + ": must be positive");
    }

    @Test
    void startupFailsOnInvalidSettings() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(AccessSettingsValidator.BCRYPT_STRENGTH, "strong");

        assertThatThrownBy(() -> new AccessSettingsValidator(environment).validateSettings())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must be a number");
    }
}
