package com.phillippitts.guardian.exception;

/**
 * Base exception for all guardian-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class GuardianException extends RuntimeException {

    public GuardianException(String message) {
        super(message);
    }

    public GuardianException(String message, Throwable cause) {
        super(message, cause);
    }

    public GuardianException(Throwable cause) {
        super(cause);
    }
}
