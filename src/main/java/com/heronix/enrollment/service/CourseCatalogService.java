package com.heronix.enrollment.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.heronix.enrollment.config.EnrollmentProperties;
import com.heronix.enrollment.exception.CourseNotFoundException;
import com.heronix.enrollment.exception.DuplicateCourseException;
import com.heronix.enrollment.exception.InvalidScheduleException;
import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.domain.Schedule;
import com.heronix.enrollment.model.dto.CatalogStatsDTO;
import com.heronix.enrollment.model.dto.CourseConflictDTO;
import com.heronix.enrollment.model.dto.CourseRequestDTO;
import com.heronix.enrollment.model.dto.ScheduleRecord;
import com.heronix.enrollment.registry.CourseRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Administrative operations on the course catalog.
 *
 * Provides functionality for administrators to:
 * - Create and edit courses
 * - Set or clear a course's weekly schedule
 * - Remove courses from the catalog (soft delete)
 * - Search the catalog and report on capacity
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourseCatalogService {

    /**
     * Ids that collide with the catalog API's report paths.
     */
    private static final Set<String> RESERVED_COURSE_IDS = Set.of("search", "stats");

    private final CourseRegistry courseRegistry;
    private final RecordTranslationService translationService;
    private final EnrollmentSnapshotService snapshotService;
    private final EnrollmentProperties properties;
    private final Clock clock;

    // ========================================================================
    // ADMINISTRATION
    // ========================================================================

    /**
     * Create a course in the catalog.
     *
     * @throws DuplicateCourseException if the id is already used
     * @throws IllegalArgumentException if the request values are invalid or the id is reserved
     */
    public Course createCourse(CourseRequestDTO request) {
        if (request.getId() == null || request.getId().isBlank()) {
            throw new IllegalArgumentException("Course id is required");
        }
        if (RESERVED_COURSE_IDS.contains(request.getId().trim())) {
            throw new IllegalArgumentException("Course id '" + request.getId().trim() + "' is reserved");
        }
        int capacity = request.getCapacity() != null
                ? request.getCapacity()
                : properties.getCatalog().getDefaultCapacity();

        Course course = Course.builder()
                .id(request.getId())
                .name(request.getName())
                .description(request.getDescription())
                .credits(request.getCredits() != null ? request.getCredits() : 0)
                .instructor(request.getInstructor())
                .capacity(capacity)
                .prerequisites(request.getPrerequisites())
                .schedule(request.getSchedule() != null ? buildSchedule(request.getSchedule()) : null)
                .clock(clock)
                .build();

        if (!courseRegistry.add(course)) {
            throw new DuplicateCourseException(course.getId());
        }
        snapshotService.saveCourses();
        return course;
    }

    /**
     * Replace a course's editable details. A schedule in the request replaces
     * the current one; an absent schedule leaves it unchanged.
     */
    public Course updateCourse(String courseId, CourseRequestDTO request) {
        Course course = getCourse(courseId);
        Schedule schedule = request.getSchedule() != null ? buildSchedule(request.getSchedule()) : null;
        course.updateDetails(
                request.getName(),
                request.getDescription(),
                request.getCredits() != null ? request.getCredits() : 0,
                request.getInstructor(),
                request.getCapacity() != null ? request.getCapacity() : course.getCapacity(),
                request.getPrerequisites());
        if (schedule != null) {
            course.updateSchedule(schedule);
        }
        log.info("Updated course {}", courseId);
        snapshotService.saveCourses();
        return course;
    }

    public Course updateSchedule(String courseId, ScheduleRecord scheduleRecord) {
        Course course = getCourse(courseId);
        Schedule schedule = buildSchedule(scheduleRecord);
        course.updateSchedule(schedule);
        log.info("Scheduled course {} at {}", courseId, schedule);
        snapshotService.saveCourses();
        return course;
    }

    public Course clearSchedule(String courseId) {
        Course course = getCourse(courseId);
        course.clearSchedule();
        log.info("Cleared schedule of course {}", courseId);
        snapshotService.saveCourses();
        return course;
    }

    /**
     * Remove a course from the catalog. The course and its history are kept, marked inactive.
     *
     * @return false if the course was already inactive
     */
    public boolean deactivateCourse(String courseId) {
        getCourse(courseId);
        boolean deactivated = courseRegistry.remove(courseId);
        if (deactivated) {
            snapshotService.saveCourses();
        }
        return deactivated;
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public Course getCourse(String courseId) {
        return courseRegistry.get(courseId).orElseThrow(() -> new CourseNotFoundException(courseId));
    }

    public List<Course> listCourses(boolean includeInactive) {
        return includeInactive ? courseRegistry.listAll() : courseRegistry.listActive();
    }

    public List<Course> findByInstructor(String instructor) {
        return courseRegistry.findByInstructor(instructor);
    }

    public List<Course> findByCreditRange(int minCredits, Integer maxCredits) {
        if (maxCredits != null && maxCredits < minCredits) {
            throw new IllegalArgumentException("max credits " + maxCredits + " is below min credits " + minCredits);
        }
        return courseRegistry.findByCreditRange(minCredits, maxCredits);
    }

    public List<CourseConflictDTO> findConflicts(List<String> courseIds) {
        return courseRegistry.findConflicts(courseIds);
    }

    /**
     * Capacity report over the catalog. Seat figures cover active courses only.
     */
    public CatalogStatsDTO getCatalogStats() {
        List<Course> all = courseRegistry.listAll();
        List<Course> active = courseRegistry.listActive();

        long full = active.stream().filter(Course::isFull).count();
        long totalSeats = active.stream().mapToLong(Course::getCapacity).sum();
        long enrolledSeats = active.stream().mapToLong(Course::getEnrolled).sum();

        return CatalogStatsDTO.builder()
                .totalCourses(all.size())
                .activeCourses(active.size())
                .availableCourses(active.size() - full)
                .fullCourses(full)
                .totalSeats(totalSeats)
                .enrolledSeats(enrolledSeats)
                .averageCapacityUtilization(totalSeats == 0 ? 0.0 : (double) enrolledSeats / totalSeats * 100)
                .totalCreditsOffered(active.stream().mapToLong(Course::getCredits).sum())
                .generatedAt(LocalDateTime.now(clock))
                .build();
    }

    private Schedule buildSchedule(ScheduleRecord scheduleRecord) {
        Schedule schedule = translationService.toSchedule(scheduleRecord);
        List<String> rooms = properties.getCatalog().getRooms();
        if (!rooms.isEmpty() && !rooms.contains(schedule.room())) {
            throw new InvalidScheduleException("Room '" + schedule.room() + "' is not in the room catalog");
        }
        return schedule;
    }
}
