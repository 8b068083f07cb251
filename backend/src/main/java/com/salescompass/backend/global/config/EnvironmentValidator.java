package com.salescompass.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Validates the required settings once the application is up.
 * Missing or malformed access-control settings stop the startup.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
                "spring.datasource.url",
                "crm.access.cache.type",
                "crm.access.cache.ttl"
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(var + " is missing");
            }
        }

        String cacheType = environment.getProperty("crm.access.cache.type", "memory").trim().toLowerCase(Locale.ROOT);
        if (!cacheType.equals("memory") && !cacheType.equals("redis")) {
            problems.add("crm.access.cache.type must be memory or redis");
        }
        if (cacheType.equals("redis") && environment.getProperty("spring.data.redis.host") == null) {
            problems.add("spring.data.redis.host is required when crm.access.cache.type=redis");
        }

        String ttl = environment.getProperty("crm.access.cache.ttl");
        if (ttl != null) {
            try {
                if (Duration.parse(ttl.trim()).isNegative()) {
                    problems.add("crm.access.cache.ttl must not be negative");
                }
            } catch (RuntimeException ex) {
                problems.add("crm.access.cache.ttl must be an ISO-8601 duration such as PT5M");
            }
        }

        String invalidation = environment.getProperty("crm.access.cache.invalidation", "acting-user")
                .trim().replace('_', '-').toLowerCase(Locale.ROOT);
        if (!invalidation.equals("acting-user") && !invalidation.equals("affected-users")) {
            problems.add("crm.access.cache.invalidation must be acting-user or affected-users");
        }

        Integer maxDepth = environment.getProperty("crm.access.role-hierarchy.max-depth", Integer.class, 32);
        if (maxDepth < 1) {
            problems.add("crm.access.role-hierarchy.max-depth must be at least 1");
        }
        return problems;
    }
}
