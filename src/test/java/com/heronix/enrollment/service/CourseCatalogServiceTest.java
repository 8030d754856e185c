package com.heronix.enrollment.service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.enrollment.config.EnrollmentProperties;
import com.heronix.enrollment.exception.CourseNotFoundException;
import com.heronix.enrollment.exception.DuplicateCourseException;
import com.heronix.enrollment.exception.InvalidScheduleException;
import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.dto.CatalogStatsDTO;
import com.heronix.enrollment.model.dto.CourseRequestDTO;
import com.heronix.enrollment.model.dto.ScheduleRecord;
import com.heronix.enrollment.registry.CourseRegistry;
import com.heronix.enrollment.registry.RegistrationRegistry;
import com.heronix.enrollment.support.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

class CourseCatalogServiceTest {

    private MutableClock clock;
    private CourseRegistry courseRegistry;
    private EnrollmentProperties properties;
    private CourseCatalogService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(LocalDateTime.of(2024, 1, 2, 8, 0));
        courseRegistry = new CourseRegistry();
        RegistrationRegistry registrationRegistry = new RegistrationRegistry(courseRegistry, clock);
        RecordTranslationService translationService = new RecordTranslationService(clock);
        EnrollmentSnapshotService snapshotService = new EnrollmentSnapshotService(
                courseRegistry, registrationRegistry, translationService, Optional.empty());
        properties = new EnrollmentProperties();
        service = new CourseCatalogService(courseRegistry, translationService, snapshotService, properties, clock);
    }

    private static ScheduleRecord schedule(String time, String room) {
        return ScheduleRecord.builder().days(List.of("Tuesday", "Thursday")).time(time).room(room).build();
    }

    private static CourseRequestDTO.CourseRequestDTOBuilder request(String id) {
        return CourseRequestDTO.builder()
                .id(id)
                .name(id + " course")
                .credits(3)
                .instructor("Dr. Smith");
    }

    @Test
    void createUsesDefaultCapacityAndClock() {
        Course course = service.createCourse(request("CS101").build());

        assertEquals(30, course.getCapacity());
        assertEquals(clock.now(), course.getCreatedAt());
        assertSame(course, service.getCourse("CS101"));
    }

    @Test
    void createWithSchedule() {
        Course course = service.createCourse(request("CS101").capacity(5).schedule(schedule("14:00-15:15", "B12")).build());

        assertEquals("14:00-15:15", course.getSchedule().formatTime());
        assertEquals(5, course.getCapacity());
    }

    @Test
    void createRejectsDuplicateAndMissingId() {
        service.createCourse(request("CS101").build());

        assertThrows(DuplicateCourseException.class, () -> service.createCourse(request("CS101").build()));
        assertThrows(IllegalArgumentException.class, () -> service.createCourse(request(" ").build()));
    }

    @Test
    void createRejectsIdsThatShadowReportPaths() {
        assertThrows(IllegalArgumentException.class, () -> service.createCourse(request("stats").build()));
        assertThrows(IllegalArgumentException.class, () -> service.createCourse(request(" search ").build()));

        assertEquals(0, courseRegistry.size());
        assertEquals("Stats", service.createCourse(request("Stats").build()).getId());
    }

    @Test
    void roomCatalogIsEnforcedWhenConfigured() {
        properties.getCatalog().setRooms(List.of("A1", "B12"));

        assertThrows(InvalidScheduleException.class,
                () -> service.createCourse(request("CS101").schedule(schedule("09:00-10:00", "Z9")).build()));
        assertNotNull(service.createCourse(request("CS102").schedule(schedule("09:00-10:00", "A1")).build()));
    }

    @Test
    void updateReplacesDetailsAndBumpsUpdatedAt() {
        service.createCourse(request("CS101").build());
        clock.advance(Duration.ofHours(1));

        Course updated = service.updateCourse("CS101", CourseRequestDTO.builder()
                .name("Intro to Computing").credits(4).capacity(40).prerequisites(List.of("MATH100")).build());

        assertEquals("Intro to Computing", updated.getName());
        assertEquals(4, updated.getCredits());
        assertEquals(40, updated.getCapacity());
        assertEquals("", updated.getInstructor());
        assertEquals(clock.now(), updated.getUpdatedAt());
    }

    @Test
    void scheduleCanBeSetAndCleared() {
        service.createCourse(request("CS101").build());

        assertTrue(service.updateSchedule("CS101", schedule("09:00-10:00", "A1")).findSchedule().isPresent());
        assertTrue(service.clearSchedule("CS101").findSchedule().isEmpty());
        assertThrows(InvalidScheduleException.class,
                () -> service.updateSchedule("CS101", schedule("10:00-09:00", "A1")));
    }

    @Test
    void deactivateIsSoftAndReportsRepeat() {
        service.createCourse(request("CS101").build());

        assertTrue(service.deactivateCourse("CS101"));
        assertFalse(service.deactivateCourse("CS101"));
        assertThrows(CourseNotFoundException.class, () -> service.deactivateCourse("NOPE"));

        assertTrue(service.listCourses(false).isEmpty());
        assertEquals(1, service.listCourses(true).size());
    }

    @Test
    void creditRangeValidatesBounds() {
        service.createCourse(request("CS101").build());

        assertEquals(1, service.findByCreditRange(1, 3).size());
        assertThrows(IllegalArgumentException.class, () -> service.findByCreditRange(4, 2));
    }

    @Test
    void catalogStatsCoverActiveCourses() {
        Course small = service.createCourse(request("CS101").capacity(2).build());
        service.createCourse(request("MATH101").capacity(8).credits(4).build());
        service.createCourse(request("OLD101").capacity(50).build());
        service.deactivateCourse("OLD101");
        small.enroll();
        small.enroll();

        CatalogStatsDTO stats = service.getCatalogStats();

        assertEquals(3, stats.getTotalCourses());
        assertEquals(2, stats.getActiveCourses());
        assertEquals(1, stats.getFullCourses());
        assertEquals(1, stats.getAvailableCourses());
        assertEquals(10, stats.getTotalSeats());
        assertEquals(2, stats.getEnrolledSeats());
        assertEquals(20.0, stats.getAverageCapacityUtilization(), 0.001);
        assertEquals(7, stats.getTotalCreditsOffered());
        assertEquals(clock.now(), stats.getGeneratedAt());
    }
}
