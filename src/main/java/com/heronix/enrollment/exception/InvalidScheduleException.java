package com.heronix.enrollment.exception;

/**
 * Exception thrown when schedule data (days, time range, room) is malformed.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
