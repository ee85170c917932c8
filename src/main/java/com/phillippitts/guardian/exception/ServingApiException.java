package com.phillippitts.guardian.exception;

/**
 * Thrown when a call to the serving system or inference backend fails at the transport
 * level or returns a response that violates the expected protocol.
 */
public class ServingApiException extends GuardianException {

    private final String action;

    public ServingApiException(String action, String message) {
        super(message + " (action: " + action + ")");
        this.action = action;
    }

    public ServingApiException(String action, String message, Throwable cause) {
        super(message + " (action: " + action + ")", cause);
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
