package com.session.pooling.config;

import com.session.pooling.SessionPoolException;

import java.util.List;

/**
 * Thrown when a pool configuration is rejected. No state change is applied.
 */
public class ConfigValidationException extends SessionPoolException {

    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super("Invalid pool configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
