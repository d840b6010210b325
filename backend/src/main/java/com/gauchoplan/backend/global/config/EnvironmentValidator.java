package com.gauchoplan.backend.global.config;

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
 * Validates required settings once the application is ready.
 * Startup fails when the datasource is missing or the planner load thresholds are not ascending.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url"
    };

    static final String[] LOAD_THRESHOLD_PROPERTIES = {
            "app.planner.light-load-units",
            "app.planner.typical-load-units",
            "app.planner.heavy-load-units"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        for (String var : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missingVars.add(var);
            }
        }

        // non-numeric thresholds already fail PlannerService creation
        Integer previous = null;
        for (String var : LOAD_THRESHOLD_PROPERTIES) {
            Integer value = environment.getProperty(var, Integer.class);
            if (value == null) {
                // defaults declared on PlannerService apply
                continue;
            }
            if (value <= 0) {
                invalidVars.add(var + ": must be positive");
            }
            if (previous != null && value <= previous) {
                invalidVars.add(var + ": must be greater than the previous load threshold (" + previous + ")");
            }
            previous = value;
        }

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            StringBuilder message = new StringBuilder("Environment validation failed.");
            if (!missingVars.isEmpty()) {
                message.append(" Missing: ").append(String.join(", ", missingVars)).append('.');
            }
            if (!invalidVars.isEmpty()) {
                message.append(" Invalid: ").append(String.join("; ", invalidVars)).append('.');
            }
            log.error(message.toString());
            throw new IllegalStateException(message.toString());
        }

        log.info("Environment validation passed");
    }
}
