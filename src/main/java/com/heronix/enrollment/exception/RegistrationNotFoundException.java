package com.heronix.enrollment.exception;

/**
 * Exception thrown when a registration id does not resolve.
 */
public class RegistrationNotFoundException extends RuntimeException {

    public RegistrationNotFoundException(String registrationId) {
        super("Registration not found: " + registrationId);
    }

    public RegistrationNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
