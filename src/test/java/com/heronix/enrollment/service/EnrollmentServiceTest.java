package com.heronix.enrollment.service;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.heronix.enrollment.config.EnrollmentProperties;
import com.heronix.enrollment.exception.EnrollmentStoreException;
import com.heronix.enrollment.exception.RegistrationNotFoundException;
import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.domain.Registration;
import com.heronix.enrollment.model.domain.Schedule;
import com.heronix.enrollment.model.dto.CourseConflictDTO;
import com.heronix.enrollment.model.dto.CourseHistoryEntryDTO;
import com.heronix.enrollment.model.dto.CourseRecord;
import com.heronix.enrollment.model.dto.EnrollmentRequestDTO;
import com.heronix.enrollment.model.dto.EnrollmentResultDTO;
import com.heronix.enrollment.model.dto.StudentSummaryDTO;
import com.heronix.enrollment.model.dto.StudentTimetableDTO;
import com.heronix.enrollment.model.enums.EnrollmentOutcome;
import com.heronix.enrollment.model.enums.RegistrationStatus;
import com.heronix.enrollment.persistence.EnrollmentStore;
import com.heronix.enrollment.registry.CourseRegistry;
import com.heronix.enrollment.registry.RegistrationRegistry;
import com.heronix.enrollment.support.MutableClock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EnrollmentServiceTest {

    @Mock
    private EnrollmentStore store;

    private CourseRegistry courseRegistry;
    private RegistrationRegistry registrationRegistry;
    private EnrollmentSnapshotService snapshotService;
    private EnrollmentProperties properties;
    private EnrollmentService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(LocalDateTime.of(2024, 1, 8, 9, 0));
        courseRegistry = new CourseRegistry();
        registrationRegistry = new RegistrationRegistry(courseRegistry, clock);
        RecordTranslationService translationService = new RecordTranslationService(clock);
        snapshotService = new EnrollmentSnapshotService(
                courseRegistry, registrationRegistry, translationService, Optional.of(store));
        properties = new EnrollmentProperties();
        service = new EnrollmentService(
                courseRegistry, registrationRegistry, translationService, snapshotService, properties);

        courseRegistry.add(course("CS101", 3, 2, "Monday", "10:00-11:30"));
        courseRegistry.add(course("MATH101", 4, 30, "Monday", "11:00-12:00"));
        courseRegistry.add(course("ENG101", 3, 30, "Monday", "11:30-13:00"));
    }

    private static Course course(String id, int credits, int capacity, String day, String time) {
        return Course.builder()
                .id(id)
                .name(id + " course")
                .credits(credits)
                .capacity(capacity)
                .schedule(day != null ? Schedule.parse(List.of(day), time, "Room " + id) : null)
                .build();
    }

    private static EnrollmentRequestDTO request(String studentId, String courseId, String... completed) {
        return EnrollmentRequestDTO.builder()
                .studentId(studentId)
                .courseId(courseId)
                .completedCourseIds(Set.of(completed))
                .build();
    }

    // ========================================================================
    // ENROLL
    // ========================================================================

    @Test
    void enrollSucceedsAndWritesSnapshots() {
        EnrollmentResultDTO result = service.enroll(request("S1", "CS101"));

        assertTrue(result.isEnrolled());
        assertEquals("S1", result.registration().getStudentId());
        assertEquals("enrolled", result.registration().getStatus());
        assertEquals(1, courseRegistry.get("CS101").orElseThrow().getEnrolled());
        verify(store).saveCourses(anyList());
        verify(store).saveRegistrations(anyList());
    }

    @Test
    void unknownCourseIsReported() {
        EnrollmentResultDTO result = service.enroll(request("S1", "NOPE"));

        assertEquals(EnrollmentOutcome.COURSE_NOT_FOUND, result.outcome());
        assertNull(result.registration());
        verify(store, never()).saveRegistrations(anyList());
    }

    @Test
    void duplicateEnrollmentIsRefused() {
        service.enroll(request("S1", "CS101"));

        EnrollmentResultDTO result = service.enroll(request("S1", "CS101"));

        assertEquals(EnrollmentOutcome.ALREADY_ENROLLED, result.outcome());
        assertEquals(1, courseRegistry.get("CS101").orElseThrow().getEnrolled());
    }

    @Test
    void fullOrInactiveCourseIsUnavailable() {
        service.enroll(request("S1", "CS101"));
        service.enroll(request("S2", "CS101"));

        assertEquals(EnrollmentOutcome.COURSE_UNAVAILABLE, service.enroll(request("S3", "CS101")).outcome());

        courseRegistry.remove("ENG101");
        assertEquals(EnrollmentOutcome.COURSE_UNAVAILABLE, service.enroll(request("S3", "ENG101")).outcome());
    }

    @Test
    void missingPrerequisitesAreNamed() {
        courseRegistry.add(Course.builder().id("CS201").name("Data Structures").credits(3).capacity(10)
                .prerequisites(List.of("CS101", "MATH101")).build());

        EnrollmentResultDTO refused = service.enroll(request("S1", "CS201", "CS101"));
        assertEquals(EnrollmentOutcome.PREREQUISITES_NOT_MET, refused.outcome());
        assertTrue(refused.message().contains("MATH101"));

        assertTrue(service.enroll(request("S1", "CS201", "CS101", "MATH101")).isEnrolled());
    }

    @Test
    void prerequisiteCheckCanBeDisabled() {
        properties.getPolicy().setEnforcePrerequisites(false);
        courseRegistry.add(Course.builder().id("CS201").name("Data Structures").credits(3).capacity(10)
                .prerequisites(List.of("CS101")).build());

        assertTrue(service.enroll(request("S1", "CS201")).isEnrolled());
    }

    @Test
    void overlappingCourseIsRefusedWithConflicts() {
        service.enroll(request("S1", "CS101"));

        EnrollmentResultDTO result = service.enroll(request("S1", "MATH101"));

        assertEquals(EnrollmentOutcome.SCHEDULE_CONFLICT, result.outcome());
        assertEquals(List.of(CourseConflictDTO.schedule("MATH101", "CS101")), result.conflicts());
        assertTrue(registrationRegistry.findByStudentAndCourse("S1", "MATH101").isEmpty());
    }

    @Test
    void adjacentCourseIsAccepted() {
        service.enroll(request("S1", "CS101"));

        assertTrue(service.enroll(request("S1", "ENG101")).isEnrolled());
    }

    @Test
    void courseLimitIsEnforced() {
        properties.getPolicy().setMaxCoursesPerStudent(1);
        service.enroll(request("S1", "CS101"));

        assertEquals(EnrollmentOutcome.COURSE_LIMIT_REACHED, service.enroll(request("S1", "ENG101")).outcome());
    }

    @Test
    void creditLimitIsEnforced() {
        properties.getPolicy().setMaxCreditsPerSemester(6);
        service.enroll(request("S1", "CS101"));

        EnrollmentResultDTO result = service.enroll(request("S1", "ENG101"));
        assertTrue(result.isEnrolled());

        courseRegistry.add(course("ART101", 1, 10, null, null));
        assertEquals(EnrollmentOutcome.CREDIT_LIMIT_REACHED, service.enroll(request("S1", "ART101")).outcome());
    }

    // ========================================================================
    // DROP / RE-ENROLL / GRADES
    // ========================================================================

    @Test
    void dropAndReEnroll() {
        String id = service.enroll(request("S1", "CS101")).registration().getId();

        assertTrue(service.drop("S1", "CS101"));
        assertFalse(service.drop("S1", "CS101"));
        assertEquals(0, courseRegistry.get("CS101").orElseThrow().getEnrolled());

        EnrollmentResultDTO reEnrolled = service.reEnroll(id, Set.of());
        assertTrue(reEnrolled.isEnrolled());
        assertEquals(id, reEnrolled.registration().getId());
        assertEquals(EnrollmentOutcome.ALREADY_ENROLLED, service.reEnroll(id, Set.of()).outcome());
        assertEquals(RegistrationStatus.ENROLLED, service.getRegistration(id).getStatus());
        assertEquals(1, courseRegistry.get("CS101").orElseThrow().getEnrolled());
    }

    @Test
    void reEnrollIsRefusedWhenCourseNowOverlaps() {
        String id = service.enroll(request("S1", "CS101")).registration().getId();
        service.drop("S1", "CS101");
        assertTrue(service.enroll(request("S1", "MATH101")).isEnrolled());

        EnrollmentResultDTO result = service.reEnroll(id, Set.of());

        assertEquals(EnrollmentOutcome.SCHEDULE_CONFLICT, result.outcome());
        assertEquals(List.of(CourseConflictDTO.schedule("CS101", "MATH101")), result.conflicts());
        assertEquals(RegistrationStatus.DROPPED, service.getRegistration(id).getStatus());
        assertEquals(0, courseRegistry.get("CS101").orElseThrow().getEnrolled());
        assertTrue(service.getStudentConflicts("S1").isEmpty());
    }

    @Test
    void reEnrollRespectsCourseAndCreditLimits() {
        properties.getPolicy().setMaxCoursesPerStudent(1);
        String id = service.enroll(request("S1", "CS101")).registration().getId();
        service.drop("S1", "CS101");
        assertTrue(service.enroll(request("S1", "ENG101")).isEnrolled());

        assertEquals(EnrollmentOutcome.COURSE_LIMIT_REACHED, service.reEnroll(id, Set.of()).outcome());
        assertEquals(1, registrationRegistry.findActiveByStudent("S1").size());

        properties.getPolicy().setMaxCoursesPerStudent(6);
        properties.getPolicy().setMaxCreditsPerSemester(5);
        assertEquals(EnrollmentOutcome.CREDIT_LIMIT_REACHED, service.reEnroll(id, Set.of()).outcome());

        properties.getPolicy().setMaxCreditsPerSemester(18);
        assertTrue(service.reEnroll(id, Set.of()).isEnrolled());
        assertEquals(2, registrationRegistry.findActiveByStudent("S1").size());
    }

    @Test
    void reEnrollChecksPrerequisitesAgain() {
        courseRegistry.add(Course.builder().id("CS201").name("Data Structures").credits(3).capacity(10)
                .prerequisites(List.of("CS101")).build());
        String id = service.enroll(request("S1", "CS201", "CS101")).registration().getId();
        service.drop("S1", "CS201");

        assertEquals(EnrollmentOutcome.PREREQUISITES_NOT_MET, service.reEnroll(id, null).outcome());
        assertTrue(service.reEnroll(id, Set.of("CS101")).isEnrolled());
    }

    @Test
    void reEnrollIntoFullCourseIsUnavailable() {
        String id = service.enroll(request("S1", "CS101")).registration().getId();
        service.drop("S1", "CS101");
        service.enroll(request("S2", "CS101"));
        service.enroll(request("S3", "CS101"));

        assertEquals(EnrollmentOutcome.COURSE_UNAVAILABLE, service.reEnroll(id, Set.of()).outcome());
        verify(store, times(4)).saveRegistrations(anyList());
    }

    @Test
    void studentLocksAreBoundedStripes() {
        courseRegistry.add(Course.builder().id("CS201").name("Data Structures").credits(3).capacity(10)
                .prerequisites(List.of("CS101")).build());
        Set<Object> locks = Collections.newSetFromMap(new IdentityHashMap<>());

        for (int i = 0; i < 5000; i++) {
            String studentId = "S" + i;
            assertEquals(EnrollmentOutcome.PREREQUISITES_NOT_MET, service.enroll(request(studentId, "CS201")).outcome());
            locks.add(service.lockFor(studentId));
        }

        assertTrue(locks.size() <= EnrollmentService.LOCK_STRIPES);
        assertSame(service.lockFor("S42"), service.lockFor("S42"));
    }

    @Test
    void unknownRegistrationIsNotFound() {
        assertThrows(RegistrationNotFoundException.class, () -> service.reEnroll("missing", Set.of()));
        assertThrows(RegistrationNotFoundException.class, () -> service.setGrade("missing", "A"));
        assertThrows(RegistrationNotFoundException.class, () -> service.addNote("missing", "note"));
    }

    @Test
    void gradeAndNotesAreRecorded() {
        String id = service.enroll(request("S1", "CS101")).registration().getId();

        Registration graded = service.setGrade(id, "A");
        Registration noted = service.addNote(id, "Dean's list");

        assertEquals("A", graded.getGrade());
        assertEquals("Dean's list", noted.getNotes());
    }

    @Test
    void failedSnapshotWriteSurfacesButKeepsChange() {
        doThrow(new EnrollmentStoreException("disk full")).when(store).saveCourses(anyList());

        assertThrows(EnrollmentStoreException.class, () -> service.enroll(request("S1", "CS101")));

        assertTrue(snapshotService.isLastWriteFailed());
        assertEquals(1, registrationRegistry.findActiveByStudent("S1").size());
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Test
    void historyResolvesCourseNames() {
        service.enroll(request("S1", "CS101"));
        service.drop("S1", "CS101");
        service.enroll(request("S1", "ENG101"));

        List<CourseHistoryEntryDTO> history = service.getStudentHistory("S1");

        assertEquals(2, history.size());
        assertEquals("CS101 course", history.get(0).getCourseName());
        assertEquals(RegistrationStatus.DROPPED, history.get(0).getStatus());
        assertNotNull(history.get(0).getDropDate());
        assertEquals(RegistrationStatus.ENROLLED, history.get(1).getStatus());
    }

    @Test
    void studentConflictsCoverActiveCoursesOnly() {
        properties.getPolicy().setRejectScheduleConflicts(false);
        service.enroll(request("S1", "CS101"));
        service.enroll(request("S1", "MATH101"));

        assertEquals(List.of(CourseConflictDTO.schedule("CS101", "MATH101")), service.getStudentConflicts("S1"));

        service.drop("S1", "MATH101");
        assertTrue(service.getStudentConflicts("S1").isEmpty());
    }

    @Test
    void registrationListsAndReports() {
        service.enroll(request("S1", "CS101"));
        service.enroll(request("S2", "CS101"));
        service.drop("S2", "CS101");

        assertEquals(2, service.getCourseRegistrations("CS101", false).size());
        assertEquals(1, service.getCourseRegistrations("CS101", true).size());
        assertEquals(1, service.getStudentRegistrations("S2", false).size());
        assertTrue(service.getStudentRegistrations("S2", true).isEmpty());
        assertEquals(50.0, service.getCourseSummary("CS101").getRetentionRate(), 0.001);
        assertEquals(2, service.getStatistics().getTotalRegistrations());
    }

    @Test
    void studentSummaryTotalsActiveCredits() {
        service.enroll(request("S1", "CS101"));
        service.enroll(request("S1", "ENG101"));
        service.drop("S1", "ENG101");
        courseRegistry.add(course("ART101", 2, 10, null, null));
        service.enroll(request("S1", "ART101"));

        StudentSummaryDTO summary = service.getStudentSummary("S1");

        assertEquals("S1", summary.getStudentId());
        assertEquals(2, summary.getEnrolledCourses());
        assertEquals(5, summary.getTotalCredits());
        assertEquals(List.of("CS101", "ART101"),
                summary.getCourses().stream().map(CourseRecord::getId).collect(Collectors.toList()));

        StudentSummaryDTO empty = service.getStudentSummary("S9");
        assertEquals(0, empty.getEnrolledCourses());
        assertEquals(0, empty.getTotalCredits());
    }

    @Test
    void timetableGroupsScheduledCoursesByDayAndSlot() {
        courseRegistry.add(Course.builder().id("BIO101").name("Biology").credits(4).capacity(10)
                .schedule(Schedule.parse(List.of("Wednesday", "Monday"), "14:00-15:30", "Lab 1")).build());
        courseRegistry.add(course("ART101", 2, 10, null, null));
        service.enroll(request("S1", "CS101"));
        service.enroll(request("S1", "BIO101"));
        service.enroll(request("S1", "ART101"));

        StudentTimetableDTO timetable = service.getStudentTimetable("S1");

        assertEquals(2, timetable.getTotalCourses());
        assertEquals(7, timetable.getTotalCredits());
        assertEquals(2, timetable.getDaysPerWeek());
        assertEquals(1, timetable.getMorningCourses());
        assertEquals(1, timetable.getAfternoonCourses());
        assertEquals(List.of("Monday", "Wednesday"), List.copyOf(timetable.getSlots().keySet()));
        assertEquals(List.of("10:00-11:30", "14:00-15:30"), List.copyOf(timetable.getSlots().get("Monday").keySet()));
        assertEquals(List.of("BIO101"), timetable.getSlots().get("Wednesday").get("14:00-15:30"));
        assertEquals(List.of("ART101"), timetable.getUnscheduledCourseIds());
        assertTrue(timetable.getConflicts().isEmpty());
    }

    @Test
    void timetableOfStudentWithoutCoursesIsEmpty() {
        StudentTimetableDTO timetable = service.getStudentTimetable("S9");

        assertEquals(0, timetable.getTotalCourses());
        assertEquals(0, timetable.getDaysPerWeek());
        assertTrue(timetable.getSlots().isEmpty());
        assertTrue(timetable.getUnscheduledCourseIds().isEmpty());
    }
}
