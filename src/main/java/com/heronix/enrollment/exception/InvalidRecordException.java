package com.heronix.enrollment.exception;

/**
 * Exception thrown when a course or registration record cannot be
 * translated into a domain object.
 */
public class InvalidRecordException extends RuntimeException {

    public InvalidRecordException(String message) {
        super(message);
    }

    public InvalidRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
