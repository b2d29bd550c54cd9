package com.z254.sentinel.correlation.exception;

import java.util.List;

/**
 * Thrown at engine construction when the correlation configuration is unusable.
 */
public class InvalidConfigException extends CorrelationException {

    private final List<String> violations;

    public InvalidConfigException(List<String> violations) {
        super("Invalid correlation configuration: " + String.join("; ", violations), "INVALID_CONFIG");
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
