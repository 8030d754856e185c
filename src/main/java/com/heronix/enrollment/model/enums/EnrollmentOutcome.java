package com.heronix.enrollment.model.enums;

/**
 * Result of a policy-checked enrollment attempt.
 */
public enum EnrollmentOutcome {

    ENROLLED,

    COURSE_NOT_FOUND,

    /**
     * Course is inactive or full
     */
    COURSE_UNAVAILABLE,

    ALREADY_ENROLLED,

    PREREQUISITES_NOT_MET,

    /**
     * Course overlaps one of the student's active courses
     */
    SCHEDULE_CONFLICT,

    COURSE_LIMIT_REACHED,

    CREDIT_LIMIT_REACHED
}
