package com.heronix.enrollment.exception;

/**
 * Exception thrown when a course is created with an id already in the catalog.
 */
public class DuplicateCourseException extends RuntimeException {

    public DuplicateCourseException(String courseId) {
        super("Course already exists: " + courseId);
    }
}
