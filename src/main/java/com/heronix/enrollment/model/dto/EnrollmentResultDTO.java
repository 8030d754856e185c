package com.heronix.enrollment.model.dto;

import java.util.List;

import com.heronix.enrollment.model.enums.EnrollmentOutcome;

/**
 * Result of a policy-checked enrollment attempt.
 *
 * @param outcome      what happened
 * @param registration the new registration when enrolled, otherwise null
 * @param message      human-readable explanation
 * @param conflicts    conflicting course pairs when the outcome is SCHEDULE_CONFLICT
 */
public record EnrollmentResultDTO(
        EnrollmentOutcome outcome,
        RegistrationRecord registration,
        String message,
        List<CourseConflictDTO> conflicts
) {
    public static EnrollmentResultDTO enrolled(RegistrationRecord registration) {
        return new EnrollmentResultDTO(EnrollmentOutcome.ENROLLED, registration,
                "Enrolled in " + registration.getCourseId(), List.of());
    }

    public static EnrollmentResultDTO refused(EnrollmentOutcome outcome, String message) {
        return new EnrollmentResultDTO(outcome, null, message, List.of());
    }

    public static EnrollmentResultDTO conflict(String message, List<CourseConflictDTO> conflicts) {
        return new EnrollmentResultDTO(EnrollmentOutcome.SCHEDULE_CONFLICT, null, message, conflicts);
    }

    public boolean isEnrolled() {
        return outcome == EnrollmentOutcome.ENROLLED;
    }
}
