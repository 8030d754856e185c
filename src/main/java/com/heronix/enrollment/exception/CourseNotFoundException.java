package com.heronix.enrollment.exception;

/**
 * Exception thrown when a course id does not resolve in the catalog.
 */
public class CourseNotFoundException extends RuntimeException {

    public CourseNotFoundException(String courseId) {
        super("Course not found: " + courseId);
    }

    public CourseNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
