package com.assetdesk.backend.global.config;

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
 * Checks the properties the service cannot run without once the context is ready.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "spring.flyway.locations",
            "assetdesk.actor-header"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = findMissingProperties();
        if (!missing.isEmpty()) {
            log.error("Missing required configuration properties: {}", String.join(", ", missing));
            throw new IllegalStateException("Missing required configuration properties: " + missing);
        }
        log.info("Environment validation passed");
    }

    List<String> findMissingProperties() {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missing.add(key);
            }
        }
        return missing;
    }
}
