package com.orgscope.backend.global.config;

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
 * Checks required configuration once the application is up and refuses to keep running without it.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.identity.actor-header",
            "app.hierarchy.max-depth",
            "app.query.max-page-size"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        requirePositiveInt("app.hierarchy.max-depth", problems);
        requirePositiveInt("app.query.max-page-size", problems);

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join(", ", problems));
        }
        log.info("Configuration validated");
    }

    private void requirePositiveInt(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            if (Integer.parseInt(raw.trim()) <= 0) {
                problems.add(key + ": must be positive");
            }
        } catch (NumberFormatException ex) {
            problems.add(key + ": must be a number");
        }
    }
}
