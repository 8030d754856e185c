package com.heronix.enrollment.service;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.heronix.enrollment.config.EnrollmentProperties;
import com.heronix.enrollment.exception.RegistrationNotFoundException;
import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.domain.Registration;
import com.heronix.enrollment.model.domain.Schedule;
import com.heronix.enrollment.model.dto.CourseConflictDTO;
import com.heronix.enrollment.model.dto.CourseEnrollmentSummaryDTO;
import com.heronix.enrollment.model.dto.CourseHistoryEntryDTO;
import com.heronix.enrollment.model.dto.EnrollmentRequestDTO;
import com.heronix.enrollment.model.dto.EnrollmentResultDTO;
import com.heronix.enrollment.model.dto.RegistrationStatsDTO;
import com.heronix.enrollment.model.dto.StudentSummaryDTO;
import com.heronix.enrollment.model.dto.StudentTimetableDTO;
import com.heronix.enrollment.model.enums.EnrollmentOutcome;
import com.heronix.enrollment.registry.CourseRegistry;
import com.heronix.enrollment.registry.RegistrationRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Student-facing enrollment on top of the registries.
 *
 * Before asking the registration registry for a seat, an enrollment is
 * checked against the configured policy:
 * - prerequisites completed
 * - per-student course and credit limits
 * - no schedule overlap with the student's active courses
 *
 * Re-enrollment goes through the same checks. Policy checks for one
 * student are serialized on a fixed set of lock stripes so that two
 * concurrent requests cannot both pass a limit check. Seat and duplicate checks are
 * enforced again, atomically, by the registries.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

    /**
     * Number of lock stripes shared by all students.
     */
    static final int LOCK_STRIPES = 64;

    private static final int NOON_MINUTE = 12 * 60;

    private final CourseRegistry courseRegistry;
    private final RegistrationRegistry registrationRegistry;
    private final RecordTranslationService translationService;
    private final EnrollmentSnapshotService snapshotService;
    private final EnrollmentProperties properties;

    private final Object[] studentLocks = newLockStripes();

    // ========================================================================
    // ENROLL / DROP
    // ========================================================================

    /**
     * Enroll a student in a course after checking the enrollment policy.
     * Refusals are reported in the result, not thrown.
     */
    public EnrollmentResultDTO enroll(EnrollmentRequestDTO request) {
        String studentId = request.getStudentId();
        String courseId = request.getCourseId();

        Optional<Course> found = courseRegistry.get(courseId);
        if (found.isEmpty()) {
            return refuse(studentId, EnrollmentOutcome.COURSE_NOT_FOUND, "Course not found: " + courseId);
        }
        Course course = found.get();

        EnrollmentResultDTO result;
        synchronized (lockFor(studentId)) {
            result = checkPolicy(studentId, course, request.getCompletedCourseIds());
            if (result == null) {
                result = registrationRegistry.create(studentId, courseId)
                        .map(registration -> EnrollmentResultDTO.enrolled(translationService.toRecord(registration)))
                        .orElseGet(() -> refuseAfterRace(studentId, course));
            }
        }

        if (result.isEnrolled()) {
            snapshotService.saveAll();
        }
        return result;
    }

    /**
     * Drop the student's active registration for the course.
     *
     * @return false if the student is not enrolled in the course
     */
    public boolean drop(String studentId, String courseId) {
        boolean dropped = registrationRegistry.dropFor(studentId, courseId);
        if (dropped) {
            snapshotService.saveAll();
        }
        return dropped;
    }

    /**
     * Re-enroll a dropped registration after checking the enrollment policy,
     * exactly as a fresh enrollment in the same course would be checked.
     * Refusals are reported in the result, not thrown.
     *
     * @throws RegistrationNotFoundException if the id is unknown
     */
    public EnrollmentResultDTO reEnroll(String registrationId, Set<String> completedCourseIds) {
        Registration registration = getRegistration(registrationId);
        String studentId = registration.getStudentId();
        String courseId = registration.getCourseId();
        if (!registration.isDropped()) {
            return refuse(studentId,
                    registration.isActive() ? EnrollmentOutcome.ALREADY_ENROLLED : EnrollmentOutcome.COURSE_UNAVAILABLE,
                    "Registration " + registrationId + " is not dropped");
        }

        Optional<Course> found = courseRegistry.get(courseId);
        if (found.isEmpty()) {
            return refuse(studentId, EnrollmentOutcome.COURSE_NOT_FOUND, "Course not found: " + courseId);
        }
        Course course = found.get();

        EnrollmentResultDTO result;
        synchronized (lockFor(studentId)) {
            result = checkPolicy(studentId, course, completedCourseIds);
            if (result == null) {
                result = registrationRegistry.reEnroll(registrationId)
                        ? EnrollmentResultDTO.enrolled(translationService.toRecord(registration))
                        : refuseAfterRace(studentId, course);
            }
        }

        if (result.isEnrolled()) {
            snapshotService.saveAll();
        }
        return result;
    }

    public Registration setGrade(String registrationId, String grade) {
        Registration registration = getRegistration(registrationId);
        registrationRegistry.setGrade(registrationId, grade);
        log.info("Recorded grade for registration {}", registrationId);
        snapshotService.saveRegistrations();
        return registration;
    }

    public Registration addNote(String registrationId, String note) {
        Registration registration = getRegistration(registrationId);
        registrationRegistry.addNote(registrationId, note);
        snapshotService.saveRegistrations();
        return registration;
    }

    /**
     * Remove dropped registrations older than the given number of days.
     */
    public int cleanup(int daysOld) {
        int removed = registrationRegistry.cleanup(daysOld);
        if (removed > 0) {
            snapshotService.saveRegistrations();
        }
        return removed;
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public Registration getRegistration(String registrationId) {
        return registrationRegistry.get(registrationId)
                .orElseThrow(() -> new RegistrationNotFoundException(registrationId));
    }

    public List<Registration> getStudentRegistrations(String studentId, boolean activeOnly) {
        return activeOnly
                ? registrationRegistry.findActiveByStudent(studentId)
                : registrationRegistry.findByStudent(studentId);
    }

    public List<Registration> getCourseRegistrations(String courseId, boolean activeOnly) {
        return activeOnly
                ? registrationRegistry.findActiveByCourse(courseId)
                : registrationRegistry.findByCourse(courseId);
    }

    /**
     * Every registration the student holds, with course names resolved from the catalog.
     */
    public List<CourseHistoryEntryDTO> getStudentHistory(String studentId) {
        return registrationRegistry.findByStudent(studentId).stream()
                .map(registration -> CourseHistoryEntryDTO.builder()
                        .registrationId(registration.getId())
                        .courseId(registration.getCourseId())
                        .courseName(courseRegistry.get(registration.getCourseId()).map(Course::getName).orElse(null))
                        .status(registration.getStatus())
                        .enrollmentDate(registration.getEnrollmentDate())
                        .dropDate(registration.getDropDate())
                        .grade(registration.getGrade())
                        .notes(registration.getNotes())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Schedule conflicts among the student's active courses.
     */
    public List<CourseConflictDTO> getStudentConflicts(String studentId) {
        List<String> courseIds = registrationRegistry.findActiveByStudent(studentId).stream()
                .map(Registration::getCourseId)
                .collect(Collectors.toList());
        return courseRegistry.findConflicts(courseIds);
    }

    /**
     * The student's active courses with their total credits.
     * Registrations whose course is missing from the catalog are skipped.
     */
    public StudentSummaryDTO getStudentSummary(String studentId) {
        List<Course> courses = activeCoursesOf(studentId);
        return StudentSummaryDTO.builder()
                .studentId(studentId)
                .enrolledCourses(courses.size())
                .totalCredits(courses.stream().mapToInt(Course::getCredits).sum())
                .courses(translationService.toCourseRecords(courses))
                .build();
    }

    /**
     * Weekly timetable of the student's active courses, grouped by day and time slot.
     */
    public StudentTimetableDTO getStudentTimetable(String studentId) {
        List<Course> active = activeCoursesOf(studentId);

        Map<DayOfWeek, Map<String, List<String>>> byDay = new EnumMap<>(DayOfWeek.class);
        List<String> unscheduled = new ArrayList<>();
        int scheduled = 0;
        int credits = 0;
        int morning = 0;
        for (Course course : active) {
            Optional<Schedule> found = course.findSchedule();
            if (found.isEmpty()) {
                unscheduled.add(course.getId());
                continue;
            }
            Schedule schedule = found.get();
            for (DayOfWeek day : schedule.days()) {
                byDay.computeIfAbsent(day, d -> new TreeMap<>())
                        .computeIfAbsent(schedule.formatTime(), t -> new ArrayList<>())
                        .add(course.getId());
            }
            scheduled++;
            credits += course.getCredits();
            if (schedule.startMinute() < NOON_MINUTE) {
                morning++;
            }
        }

        Map<String, Map<String, List<String>>> slots = new LinkedHashMap<>();
        byDay.forEach((day, times) -> slots.put(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), times));

        return StudentTimetableDTO.builder()
                .studentId(studentId)
                .totalCourses(scheduled)
                .totalCredits(credits)
                .daysPerWeek(byDay.size())
                .morningCourses(morning)
                .afternoonCourses(scheduled - morning)
                .slots(slots)
                .unscheduledCourseIds(unscheduled)
                .conflicts(getStudentConflicts(studentId))
                .build();
    }

    public RegistrationStatsDTO getStatistics() {
        return registrationRegistry.statistics();
    }

    public CourseEnrollmentSummaryDTO getCourseSummary(String courseId) {
        return registrationRegistry.courseEnrollmentSummary(courseId);
    }

    // ========================================================================
    // POLICY
    // ========================================================================

    /**
     * @return a refusal, or null when the enrollment may proceed
     */
    private EnrollmentResultDTO checkPolicy(String studentId, Course course, Set<String> completedCourseIds) {
        EnrollmentProperties.PolicyConfig policy = properties.getPolicy();
        String courseId = course.getId();

        if (registrationRegistry.findByStudentAndCourse(studentId, courseId)
                .filter(Registration::isActive).isPresent()) {
            return refuse(studentId, EnrollmentOutcome.ALREADY_ENROLLED, "Already enrolled in " + courseId);
        }
        if (!course.canEnroll()) {
            return refuse(studentId, EnrollmentOutcome.COURSE_UNAVAILABLE,
                    course.isActive() ? "Course " + courseId + " is full" : "Course " + courseId + " is not available");
        }
        if (policy.isEnforcePrerequisites() && !course.meetsPrerequisites(completedCourseIds)) {
            List<String> missing = course.getPrerequisites().stream()
                    .filter(p -> completedCourseIds == null || !completedCourseIds.contains(p))
                    .collect(Collectors.toList());
            return refuse(studentId, EnrollmentOutcome.PREREQUISITES_NOT_MET,
                    "Missing prerequisites for " + courseId + ": " + String.join(", ", missing));
        }

        List<Course> activeCourses = activeCoursesOf(studentId);

        if (activeCourses.size() >= policy.getMaxCoursesPerStudent()) {
            return refuse(studentId, EnrollmentOutcome.COURSE_LIMIT_REACHED,
                    "Course limit of " + policy.getMaxCoursesPerStudent() + " reached");
        }
        int credits = activeCourses.stream().mapToInt(Course::getCredits).sum();
        if (credits + course.getCredits() > policy.getMaxCreditsPerSemester()) {
            return refuse(studentId, EnrollmentOutcome.CREDIT_LIMIT_REACHED,
                    "Enrolling in " + courseId + " would bring credits to " + (credits + course.getCredits())
                            + " (limit " + policy.getMaxCreditsPerSemester() + ")");
        }
        if (policy.isRejectScheduleConflicts()) {
            List<CourseConflictDTO> conflicts = new ArrayList<>();
            for (Course enrolledCourse : activeCourses) {
                if (course.conflictsWith(enrolledCourse)) {
                    conflicts.add(CourseConflictDTO.schedule(courseId, enrolledCourse.getId()));
                }
            }
            if (!conflicts.isEmpty()) {
                log.debug("Student {} refused {}: {} schedule conflicts", studentId, courseId, conflicts.size());
                return EnrollmentResultDTO.conflict("Course " + courseId + " overlaps an enrolled course", conflicts);
            }
        }
        return null;
    }

    private List<Course> activeCoursesOf(String studentId) {
        return registrationRegistry.findActiveByStudent(studentId).stream()
                .map(r -> courseRegistry.get(r.getCourseId()))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    Object lockFor(String studentId) {
        return studentLocks[Math.floorMod(studentId.hashCode(), LOCK_STRIPES)];
    }

    private static Object[] newLockStripes() {
        Object[] stripes = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new Object();
        }
        return stripes;
    }

    private EnrollmentResultDTO refuseAfterRace(String studentId, Course course) {
        if (registrationRegistry.findByStudentAndCourse(studentId, course.getId())
                .filter(Registration::isActive).isPresent()) {
            return refuse(studentId, EnrollmentOutcome.ALREADY_ENROLLED, "Already enrolled in " + course.getId());
        }
        return refuse(studentId, EnrollmentOutcome.COURSE_UNAVAILABLE, "Course " + course.getId() + " has no open seat");
    }

    private EnrollmentResultDTO refuse(String studentId, EnrollmentOutcome outcome, String message) {
        log.debug("Enrollment refused for student {}: {} ({})", studentId, outcome, message);
        return EnrollmentResultDTO.refused(outcome, message);
    }
}
