package com.qualitrack.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Validates the access core settings once the context is ready and refuses to run with unusable values.
 */
@Component
public class AccessSettingsValidator {

    static final String BCRYPT_STRENGTH = "app.access.password.bcrypt-strength";
    static final String CACHE_TTL = "app.access.cache.ttl";
    static final String DEFAULT_GRANT_DURATION = "app.access.grants.default-duration";
    static final String CACHE_MAX_SIZE = "app.access.cache.max-size";
    static final String SESSION_TIMEOUT = "app.access.session.timeout";
    static final String SESSION_REMEMBER_ME_TIMEOUT = "app.access.session.remember-me-timeout";
    static final String SESSION_MAX_PER_USER = "app.access.session.max-per-user";
    static final String SESSION_CLEANUP_INTERVAL = "app.access.session.cleanup-interval";

    private static final Logger log = LoggerFactory.getLogger(AccessSettingsValidator.class);

    private final Environment environment;

    public AccessSettingsValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateSettings() {
        List<String> invalid = validate();
        if (!invalid.isEmpty()) {
            invalid.forEach(problem -> log.error("Invalid access setting: {}", problem));
            throw new IllegalStateException("Invalid access core settings: " + String.join("; ", invalid));
        }
        log.info("Access core settings validated");
    }

    List<String> validate() {
        List<String> invalid = new ArrayList<>();

        Optional<String> strength = property(BCRYPT_STRENGTH);
        if (strength.isPresent()) {
            try {
                int value = Integer.parseInt(strength.get());
                // BCrypt log rounds
                if (value < 4 || value > 31) {
                    invalid.add(BCRYPT_STRENGTH + ": must be between 4 and 31");
                }
            } catch (NumberFormatException e) {
                invalid.add(BCRYPT_STRENGTH + ": must be a number");
            }
        }

        property(CACHE_TTL).ifPresent(raw -> checkPositiveDuration(CACHE_TTL, raw, invalid));
        property(DEFAULT_GRANT_DURATION).ifPresent(raw -> checkPositiveDuration(DEFAULT_GRANT_DURATION, raw, invalid));
        property(CACHE_MAX_SIZE).ifPresent(raw -> checkPositiveNumber(CACHE_MAX_SIZE, raw, invalid));
        property(SESSION_TIMEOUT).ifPresent(raw -> checkPositiveDuration(SESSION_TIMEOUT, raw, invalid));
        property(SESSION_REMEMBER_ME_TIMEOUT)
                .ifPresent(raw -> checkPositiveDuration(SESSION_REMEMBER_ME_TIMEOUT, raw, invalid));
        property(SESSION_MAX_PER_USER).ifPresent(raw -> checkPositiveNumber(SESSION_MAX_PER_USER, raw, invalid));
        property(SESSION_CLEANUP_INTERVAL).ifPresent(raw -> checkPositiveDuration(SESSION_CLEANUP_INTERVAL, raw, invalid));
        return invalid;
    }

    private void checkPositiveNumber(String key, String raw, List<String> invalid) {
        try {
            if (Long.parseLong(raw) <= 0) {
                invalid.add(key + ": must be positive");
            }
        } catch (NumberFormatException e) {
            invalid.add(key + ": must be a number");
        }
    }

    private void checkPositiveDuration(String key, String raw, List<String> invalid) {
        try {
            Duration duration = DurationStyle.detectAndParse(raw);
            if (duration.isNegative() || duration.isZero()) {
                invalid.add(key + ": must be positive");
            }
        } catch (IllegalArgumentException e) {
            invalid.add(key + ": not a duration");
        }
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
