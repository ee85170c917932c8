package com.phillippitts.guardian.exception;

/**
 * Thrown at startup when thresholds are ordered in a way that would make the
 * state machine oscillate or never fire.
 */
public class InvalidThresholdConfigurationException extends GuardianException {

    private final String property;

    public InvalidThresholdConfigurationException(String property, String reason) {
        super("Invalid guardian threshold '" + property + "': " + reason);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
