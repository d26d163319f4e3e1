package com.hal9001.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks security and pool settings once the application is ready. The development signing
 * key only logs a warning; invalid values fail startup.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEVELOPMENT_SECRET = "a_very_secret_key_that_should_be_changed_in_production";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String secret = environment.getProperty("jwt.secret");
        if (secret == null || secret.isBlank()) {
            problems.add("jwt.secret is required");
        } else if (DEVELOPMENT_SECRET.equals(secret)) {
            log.warn("jwt.secret is the development default; set SECRET_KEY before deploying");
        }

        try {
            Duration ttl = DurationStyle.detectAndParse(environment.getProperty("jwt.expiration", "30m"));
            if (ttl.isZero() || ttl.isNegative()) {
                problems.add("jwt.expiration must be positive");
            }
        } catch (IllegalArgumentException ex) {
            problems.add("jwt.expiration must be a duration such as 30m or PT30M");
        }

        Integer minIdle = environment.getProperty("hal.storage.pool.min-idle", Integer.class, 1);
        Integer maxSize = environment.getProperty("hal.storage.pool.max-size", Integer.class, 10);
        if (minIdle < 0) {
            problems.add("hal.storage.pool.min-idle must not be negative");
        }
        if (maxSize < 1) {
            problems.add("hal.storage.pool.max-size must be at least 1");
        }
        if (minIdle > maxSize) {
            problems.add("hal.storage.pool.min-idle must not exceed hal.storage.pool.max-size");
        }
        return problems;
    }
}
