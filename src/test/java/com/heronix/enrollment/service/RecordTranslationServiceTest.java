package com.heronix.enrollment.service;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.enrollment.exception.InvalidRecordException;
import com.heronix.enrollment.exception.InvalidScheduleException;
import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.domain.Registration;
import com.heronix.enrollment.model.domain.Schedule;
import com.heronix.enrollment.model.dto.CourseRecord;
import com.heronix.enrollment.model.dto.RegistrationRecord;
import com.heronix.enrollment.model.dto.ScheduleRecord;
import com.heronix.enrollment.model.enums.RegistrationStatus;
import com.heronix.enrollment.support.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

class RecordTranslationServiceTest {

    private MutableClock clock;
    private RecordTranslationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(LocalDateTime.of(2024, 3, 1, 10, 0));
        service = new RecordTranslationService(clock);
    }

    private static CourseRecord.CourseRecordBuilder courseRecord() {
        return CourseRecord.builder()
                .id("CS101")
                .name("Intro to CS")
                .description("Basics")
                .credits(3)
                .instructor("Dr. Smith")
                .capacity(30)
                .enrolled(12)
                .prerequisites(List.of())
                .schedule(ScheduleRecord.builder()
                        .days(List.of("Monday", "Wednesday"))
                        .time("10:00-11:30")
                        .room("Room 101")
                        .build())
                .active(true)
                .createdAt("2024-01-01T09:00")
                .updatedAt("2024-01-02T09:00");
    }

    private static RegistrationRecord.RegistrationRecordBuilder registrationRecord() {
        return RegistrationRecord.builder()
                .id("r-1")
                .studentId("S1")
                .courseId("CS101")
                .status("enrolled")
                .enrollmentDate("2024-01-05T08:30")
                .notes("");
    }

    @Test
    void courseRecordCarriesEveryField() {
        Course course = Course.builder()
                .id("CS101").name("Intro").credits(3).capacity(20)
                .prerequisites(List.of("MATH100"))
                .schedule(Schedule.parse(List.of("Friday", "Monday"), "08:05-09:00", "Lab"))
                .clock(clock)
                .build();
        course.enroll();

        CourseRecord record = service.toRecord(course);

        assertEquals("CS101", record.getId());
        assertEquals(1, record.getEnrolled());
        assertEquals(List.of("MATH100"), record.getPrerequisites());
        assertEquals(List.of("Monday", "Friday"), record.getSchedule().getDays());
        assertEquals("08:05-09:00", record.getSchedule().getTime());
        assertTrue(record.getActive());
        assertEquals("2024-03-01T10:00", record.getCreatedAt());
    }

    @Test
    void courseWithoutScheduleHasNullScheduleRecord() {
        Course course = Course.builder().id("X").name("X").credits(1).capacity(1).clock(clock).build();
        assertNull(service.toRecord(course).getSchedule());
    }

    @Test
    void courseRecordIsRebuiltFaithfully() {
        Course course = service.toCourse(courseRecord().build());

        assertEquals("CS101", course.getId());
        assertEquals(12, course.getEnrolled());
        assertEquals(LocalDateTime.of(2024, 1, 2, 9, 0), course.getUpdatedAt());
        assertEquals("10:00-11:30", course.getSchedule().formatTime());
        assertEquals(courseRecord().build(), service.toRecord(course));
    }

    @Test
    void courseRecordMissingFieldsIsRejected() {
        assertThrows(InvalidRecordException.class, () -> service.toCourse(courseRecord().id(null).build()));
        assertThrows(InvalidRecordException.class, () -> service.toCourse(courseRecord().credits(null).build()));
        assertThrows(InvalidRecordException.class, () -> service.toCourse(courseRecord().active(null).build()));
        assertThrows(InvalidRecordException.class, () -> service.toCourse(courseRecord().createdAt(null).build()));
    }

    @Test
    void courseRecordWithInvalidValuesIsRejected() {
        assertThrows(InvalidRecordException.class, () -> service.toCourse(courseRecord().enrolled(31).build()));
        assertThrows(InvalidRecordException.class, () -> service.toCourse(courseRecord().capacity(0).build()));
        assertThrows(InvalidRecordException.class,
                () -> service.toCourse(courseRecord().updatedAt("not-a-date").build()));
    }

    @Test
    void courseRecordWithMalformedTimeIsRejected() {
        CourseRecord record = courseRecord()
                .schedule(ScheduleRecord.builder().days(List.of("Monday")).time("10-11").room("R").build())
                .build();
        assertThrows(InvalidRecordException.class, () -> service.toCourse(record));
    }

    @Test
    void scheduleRecordWithMalformedTimeIsRejected() {
        ScheduleRecord record = ScheduleRecord.builder().days(List.of("Monday")).time("9am-10am").room("R").build();
        assertThrows(InvalidScheduleException.class, () -> service.toSchedule(record));
    }

    @Test
    void registrationRecordIsRebuilt() {
        Registration registration = service.toRegistration(registrationRecord().grade("B+").build());

        assertEquals("r-1", registration.getId());
        assertEquals(RegistrationStatus.ENROLLED, registration.getStatus());
        assertEquals(LocalDateTime.of(2024, 1, 5, 8, 30), registration.getEnrollmentDate());
        assertEquals("B+", registration.getGrade());
        assertEquals("enrolled", service.toRecord(registration).getStatus());
    }

    @Test
    void droppedRegistrationKeepsDropDate() {
        Registration registration = service.toRegistration(
                registrationRecord().status("dropped").dropDate("2024-02-01T00:00").build());

        assertTrue(registration.isDropped());
        assertEquals("2024-02-01T00:00", service.toRecord(registration).getDropDate());
    }

    @Test
    void reservedStatusesAreAccepted() {
        assertEquals(RegistrationStatus.WAITLISTED,
                service.toRegistration(registrationRecord().status("waitlisted").build()).getStatus());
        assertEquals(RegistrationStatus.PENDING,
                service.toRegistration(registrationRecord().status("pending").build()).getStatus());
    }

    @Test
    void invalidRegistrationRecordsAreRejected() {
        assertThrows(InvalidRecordException.class,
                () -> service.toRegistration(registrationRecord().status("graduated").build()));
        assertThrows(InvalidRecordException.class,
                () -> service.toRegistration(registrationRecord().studentId(null).build()));
        assertThrows(InvalidRecordException.class,
                () -> service.toRegistration(registrationRecord().enrollmentDate(null).build()));
        assertThrows(InvalidRecordException.class,
                () -> service.toRegistration(registrationRecord().status("dropped").build()));
    }

    @Test
    void missingNotesBecomeEmpty() {
        assertEquals("", service.toRegistration(registrationRecord().notes(null).build()).getNotes());
    }
}
