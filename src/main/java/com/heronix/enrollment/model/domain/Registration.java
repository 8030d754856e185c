package com.heronix.enrollment.model.domain;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

import com.heronix.enrollment.model.enums.RegistrationStatus;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * A student's registration in a course.
 *
 * Refers to the student and the course by id only. The identity fields
 * never change after construction; status moves ENROLLED -> DROPPED on
 * drop and DROPPED -> ENROLLED on re-enroll.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Getter
public class Registration {

    private static final String NOTE_SEPARATOR = "; ";

    private final String id;

    private final String studentId;

    private final String courseId;

    private volatile RegistrationStatus status;

    private volatile LocalDateTime enrollmentDate;

    /**
     * Set when the registration is dropped, cleared on re-enroll.
     */
    private volatile LocalDateTime dropDate;

    /**
     * Final grade, recorded independently of status.
     */
    private volatile String grade;

    private volatile String notes;

    @Getter(AccessLevel.NONE)
    private final Clock clock;

    @Builder
    private Registration(String id, String studentId, String courseId, RegistrationStatus status,
                         LocalDateTime enrollmentDate, LocalDateTime dropDate, String grade,
                         String notes, Clock clock) {
        if (studentId == null || studentId.isBlank()) {
            throw new IllegalArgumentException("Student id is required");
        }
        if (courseId == null || courseId.isBlank()) {
            throw new IllegalArgumentException("Course id is required");
        }
        this.clock = clock != null ? clock : Clock.systemDefaultZone();
        this.id = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        this.studentId = studentId;
        this.courseId = courseId;
        this.status = status != null ? status : RegistrationStatus.ENROLLED;
        this.enrollmentDate = enrollmentDate != null ? enrollmentDate : LocalDateTime.now(this.clock);
        this.dropDate = dropDate;
        this.grade = grade;
        this.notes = notes != null ? notes : "";
    }

    /**
     * Create a new ENROLLED registration dated now.
     */
    public static Registration enroll(String studentId, String courseId, Clock clock) {
        return Registration.builder()
                .studentId(studentId)
                .courseId(courseId)
                .status(RegistrationStatus.ENROLLED)
                .clock(clock)
                .build();
    }

    // ========================================================================
    // STATE TRANSITIONS
    // ========================================================================

    /**
     * ENROLLED -> DROPPED.
     *
     * @return false if the registration was not ENROLLED
     */
    public synchronized boolean drop() {
        if (status != RegistrationStatus.ENROLLED) {
            return false;
        }
        status = RegistrationStatus.DROPPED;
        dropDate = LocalDateTime.now(clock);
        return true;
    }

    /**
     * DROPPED -> ENROLLED.
     *
     * @return false if the registration was not DROPPED
     */
    public synchronized boolean reEnroll() {
        if (status != RegistrationStatus.DROPPED) {
            return false;
        }
        status = RegistrationStatus.ENROLLED;
        dropDate = null;
        return true;
    }

    public synchronized void setGrade(String grade) {
        this.grade = grade;
    }

    public synchronized void addNote(String note) {
        if (note == null || note.isBlank()) {
            return;
        }
        notes = notes.isEmpty() ? note : notes + NOTE_SEPARATOR + note;
    }

    public boolean isActive() {
        return status == RegistrationStatus.ENROLLED;
    }

    public boolean isDropped() {
        return status == RegistrationStatus.DROPPED;
    }

    /**
     * Whether this is a DROPPED registration whose drop date precedes the cutoff.
     */
    public boolean droppedBefore(LocalDateTime cutoff) {
        LocalDateTime dropped = this.dropDate;
        return isDropped() && dropped != null && dropped.isBefore(cutoff);
    }

    @Override
    public String toString() {
        return "Registration(" + studentId + " -> " + courseId + ", " + status.getWireValue() + ")";
    }
}
