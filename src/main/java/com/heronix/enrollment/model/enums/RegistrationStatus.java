package com.heronix.enrollment.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a student's registration in a course.
 *
 * Only ENROLLED and DROPPED are produced by the registration engine.
 * WAITLISTED and PENDING are reserved for admission control and are
 * carried through snapshots unchanged.
 */
@Getter
@RequiredArgsConstructor
public enum RegistrationStatus {

    /**
     * Registration holds a seat in the course
     */
    ENROLLED("enrolled"),

    /**
     * Student dropped the course; the seat was released
     */
    DROPPED("dropped"),

    /**
     * Waiting for a seat to open
     */
    WAITLISTED("waitlisted"),

    /**
     * Awaiting approval
     */
    PENDING("pending");

    /**
     * Value used in registration records
     */
    private final String wireValue;

    /**
     * Get RegistrationStatus from its record value.
     *
     * @param wireValue the record value (e.g., "enrolled")
     * @return matching RegistrationStatus
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static RegistrationStatus fromWireValue(String wireValue) {
        for (RegistrationStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(wireValue)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown registration status: " + wireValue);
    }
}
