package com.heronix.enrollment.exception;

/**
 * Exception thrown when the persistence collaborator fails to read or write
 * a snapshot.
 */
public class EnrollmentStoreException extends RuntimeException {

    public EnrollmentStoreException(String message) {
        super(message);
    }

    public EnrollmentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
