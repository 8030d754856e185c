package com.heronix.enrollment.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.dto.CourseConflictDTO;

import lombok.extern.slf4j.Slf4j;

/**
 * In-memory catalog of courses, keyed by course id.
 *
 * Iteration follows insertion order. Course ids are never overwritten
 * and courses are never removed, only deactivated.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Slf4j
public class CourseRegistry {

    private final Map<String, Course> courses = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Add a course to the catalog.
     *
     * @return false if a course with the same id already exists
     */
    public boolean add(Course course) {
        lock.writeLock().lock();
        try {
            if (courses.containsKey(course.getId())) {
                log.debug("Course {} already in catalog, not added", course.getId());
                return false;
            }
            courses.put(course.getId(), course);
            log.info("Added course {} ({}) with capacity {}", course.getId(), course.getName(), course.getCapacity());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Course> get(String courseId) {
        if (courseId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(courses.get(courseId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String courseId) {
        return get(courseId).isPresent();
    }

    public List<Course> listAll() {
        return filter(course -> true);
    }

    public List<Course> listActive() {
        return filter(Course::isActive);
    }

    /**
     * Courses taught by the instructor (case-insensitive exact match).
     */
    public List<Course> findByInstructor(String instructor) {
        if (instructor == null) {
            return List.of();
        }
        String wanted = instructor.toLowerCase(Locale.ROOT);
        return filter(course -> course.getInstructor().toLowerCase(Locale.ROOT).equals(wanted));
    }

    /**
     * Courses whose credits fall in [minCredits, maxCredits].
     *
     * @param maxCredits upper bound, or null for no upper bound
     */
    public List<Course> findByCreditRange(int minCredits, Integer maxCredits) {
        return filter(course -> course.getCredits() >= minCredits
                && (maxCredits == null || course.getCredits() <= maxCredits));
    }

    /**
     * Find schedule conflicts among the given courses.
     *
     * Ids that do not resolve are skipped. Each conflicting pair is reported
     * once, in the order of the input list (first index before second).
     */
    public List<CourseConflictDTO> findConflicts(List<String> courseIds) {
        List<Course> resolved = courseIds.stream()
                .map(this::get)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());

        List<CourseConflictDTO> conflicts = new ArrayList<>();
        for (int i = 0; i < resolved.size(); i++) {
            for (int j = i + 1; j < resolved.size(); j++) {
                Course first = resolved.get(i);
                Course second = resolved.get(j);
                if (first.conflictsWith(second)) {
                    conflicts.add(CourseConflictDTO.schedule(first.getId(), second.getId()));
                }
            }
        }
        return conflicts;
    }

    /**
     * Soft delete: mark the course inactive. Unknown ids are ignored.
     *
     * @return true if an active course was deactivated
     */
    public boolean remove(String courseId) {
        Optional<Course> course = get(courseId);
        if (course.isEmpty()) {
            log.debug("Remove ignored, course {} not in catalog", courseId);
            return false;
        }
        boolean deactivated = course.get().deactivate();
        if (deactivated) {
            log.info("Deactivated course {}", courseId);
        }
        return deactivated;
    }

    /**
     * Replace the catalog with courses from a snapshot.
     *
     * @throws IllegalArgumentException if the snapshot repeats a course id
     */
    public void load(Collection<Course> snapshot) {
        Map<String, Course> replacement = new LinkedHashMap<>();
        for (Course course : snapshot) {
            if (replacement.putIfAbsent(course.getId(), course) != null) {
                throw new IllegalArgumentException("Duplicate course id in snapshot: " + course.getId());
            }
        }
        lock.writeLock().lock();
        try {
            courses.clear();
            courses.putAll(replacement);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} courses into catalog", replacement.size());
    }

    public int size() {
        lock.readLock().lock();
        try {
            return courses.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Course> filter(Predicate<Course> predicate) {
        lock.readLock().lock();
        try {
            return courses.values().stream()
                    .filter(predicate)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
}
