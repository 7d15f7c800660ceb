package com.rostermate.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks required settings once the context is up and aborts startup when any are missing.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "spring.datasource.username",
            "rostermate.assignment.store-timeout",
            "rostermate.calendar.zone"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missing.add(key);
            }
        }

        List<String> invalid = new ArrayList<>();
        String jdbcUrl = environment.getProperty("spring.datasource.url");
        if (jdbcUrl != null && !jdbcUrl.startsWith("jdbc:postgresql:")) {
            invalid.add("spring.datasource.url: PostgreSQL JDBC URL expected");
        }

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            log.error("Environment validation failed: missing={} invalid={}", missing, invalid);
            throw new IllegalStateException("Environment validation failed: missing=" + missing + " invalid=" + invalid);
        }
        log.info("Environment validation passed");
    }
}
