package com.company.energyanalytics.exception;

import java.util.List;

/**
 * Raised before any analyzer runs when an option or input window is outside its valid domain.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid analytics configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidConfigurationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
