package com.heronix.enrollment.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.heronix.enrollment.exception.InvalidRecordException;
import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.domain.Registration;
import com.heronix.enrollment.model.domain.Schedule;
import com.heronix.enrollment.model.dto.CourseRecord;
import com.heronix.enrollment.model.dto.RegistrationRecord;
import com.heronix.enrollment.model.dto.ScheduleRecord;
import com.heronix.enrollment.model.enums.RegistrationStatus;

import lombok.RequiredArgsConstructor;

/**
 * Service for translating between domain objects and their records.
 *
 * OUTBOUND: Course / Registration -> CourseRecord / RegistrationRecord
 * INBOUND:  records -> domain objects, rejecting incomplete or invalid
 *           records with {@link InvalidRecordException} instead of
 *           filling in defaults.
 */
@Service
@RequiredArgsConstructor
public class RecordTranslationService {

    private final Clock clock;

    // ========================================================================
    // OUTBOUND (Domain -> Record)
    // ========================================================================

    public CourseRecord toRecord(Course course) {
        return CourseRecord.builder()
                .id(course.getId())
                .name(course.getName())
                .description(course.getDescription())
                .credits(course.getCredits())
                .instructor(course.getInstructor())
                .capacity(course.getCapacity())
                .enrolled(course.getEnrolled())
                .prerequisites(new ArrayList<>(course.getPrerequisites()))
                .schedule(course.findSchedule().map(this::toRecord).orElse(null))
                .active(course.isActive())
                .createdAt(course.getCreatedAt().toString())
                .updatedAt(course.getUpdatedAt().toString())
                .build();
    }

    public ScheduleRecord toRecord(Schedule schedule) {
        return ScheduleRecord.builder()
                .days(schedule.dayNames())
                .time(schedule.formatTime())
                .room(schedule.room())
                .build();
    }

    public RegistrationRecord toRecord(Registration registration) {
        return RegistrationRecord.builder()
                .id(registration.getId())
                .studentId(registration.getStudentId())
                .courseId(registration.getCourseId())
                .status(registration.getStatus().getWireValue())
                .enrollmentDate(registration.getEnrollmentDate().toString())
                .dropDate(registration.getDropDate() != null ? registration.getDropDate().toString() : null)
                .grade(registration.getGrade())
                .notes(registration.getNotes())
                .build();
    }

    public List<CourseRecord> toCourseRecords(List<Course> courses) {
        return courses.stream().map(this::toRecord).collect(Collectors.toList());
    }

    public List<RegistrationRecord> toRegistrationRecords(List<Registration> registrations) {
        return registrations.stream().map(this::toRecord).collect(Collectors.toList());
    }

    // ========================================================================
    // INBOUND (Record -> Domain)
    // ========================================================================

    /**
     * Rebuild a course from its record.
     *
     * @throws InvalidRecordException if a required field is missing or a value is invalid
     */
    public Course toCourse(CourseRecord record) {
        String id = requireText(record.getId(), "id", "course", "?");
        try {
            return Course.builder()
                    .id(id)
                    .name(requireText(record.getName(), "name", "course", id))
                    .description(require(record.getDescription(), "description", "course", id))
                    .credits(require(record.getCredits(), "credits", "course", id))
                    .instructor(require(record.getInstructor(), "instructor", "course", id))
                    .capacity(require(record.getCapacity(), "capacity", "course", id))
                    .enrolled(require(record.getEnrolled(), "enrolled", "course", id))
                    .prerequisites(record.getPrerequisites() != null ? record.getPrerequisites() : List.of())
                    .schedule(record.getSchedule() != null ? toSchedule(record.getSchedule()) : null)
                    .active(require(record.getActive(), "active", "course", id))
                    .createdAt(parseTimestamp(requireText(record.getCreatedAt(), "created_at", "course", id), "created_at", id))
                    .updatedAt(parseTimestamp(requireText(record.getUpdatedAt(), "updated_at", "course", id), "updated_at", id))
                    .clock(clock)
                    .build();
        } catch (InvalidRecordException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException("Invalid course record " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Build a schedule from its record.
     *
     * @throws com.heronix.enrollment.exception.InvalidScheduleException if the record is malformed
     */
    public Schedule toSchedule(ScheduleRecord record) {
        return Schedule.parse(record.getDays(), record.getTime(), record.getRoom());
    }

    /**
     * Rebuild a registration from its record.
     *
     * @throws InvalidRecordException if a required field is missing or a value is invalid
     */
    public Registration toRegistration(RegistrationRecord record) {
        String id = requireText(record.getId(), "id", "registration", "?");
        RegistrationStatus status;
        try {
            status = RegistrationStatus.fromWireValue(requireText(record.getStatus(), "status", "registration", id));
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException("Invalid registration record " + id + ": " + e.getMessage(), e);
        }
        LocalDateTime dropDate = record.getDropDate() != null
                ? parseTimestamp(record.getDropDate(), "drop_date", id)
                : null;
        if (status == RegistrationStatus.DROPPED && dropDate == null) {
            throw new InvalidRecordException("Dropped registration " + id + " has no drop_date");
        }

        return Registration.builder()
                .id(id)
                .studentId(requireText(record.getStudentId(), "student_id", "registration", id))
                .courseId(requireText(record.getCourseId(), "course_id", "registration", id))
                .status(status)
                .enrollmentDate(parseTimestamp(
                        requireText(record.getEnrollmentDate(), "enrollment_date", "registration", id), "enrollment_date", id))
                .dropDate(dropDate)
                .grade(record.getGrade())
                .notes(record.getNotes() != null ? record.getNotes() : "")
                .clock(clock)
                .build();
    }

    private static <T> T require(T value, String field, String kind, String id) {
        if (value == null) {
            throw new InvalidRecordException("Missing required field '" + field + "' in " + kind + " record " + id);
        }
        return value;
    }

    private static String requireText(String value, String field, String kind, String id) {
        if (value == null || value.isBlank()) {
            throw new InvalidRecordException("Missing required field '" + field + "' in " + kind + " record " + id);
        }
        return value;
    }

    private static LocalDateTime parseTimestamp(String value, String field, String id) {
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException("Invalid " + field + " '" + value + "' in record " + id, e);
        }
    }
}
