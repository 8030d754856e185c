package com.heronix.enrollment.model.domain;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * Course offering in the catalog.
 *
 * Owns the seat counter for the offering. {@code enrolled} only changes
 * through {@link #enroll()} and {@link #drop()}, which run under the
 * course's monitor so that concurrent callers can never push the counter
 * past capacity or below zero.
 *
 * Removal from the catalog is a soft delete ({@link #deactivate()}); an
 * inactive course is never reactivated.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Getter
public class Course {

    /**
     * Stable catalog key (e.g., "CS101").
     */
    private final String id;

    private volatile String name;

    private volatile String description;

    private volatile int credits;

    private volatile String instructor;

    /**
     * Maximum number of simultaneously enrolled students.
     */
    private volatile int capacity;

    /**
     * Current number of enrolled students, always within [0, capacity].
     */
    private volatile int enrolled;

    /**
     * Course ids that must be completed first. Not validated against the catalog.
     */
    private volatile Set<String> prerequisites;

    private volatile Schedule schedule;

    private volatile boolean active;

    private final LocalDateTime createdAt;

    private volatile LocalDateTime updatedAt;

    @Getter(AccessLevel.NONE)
    private final Clock clock;

    @Builder
    private Course(String id, String name, String description, int credits, String instructor,
                   int capacity, Collection<String> prerequisites, Schedule schedule,
                   int enrolled, Boolean active, LocalDateTime createdAt, LocalDateTime updatedAt,
                   Clock clock) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Course id is required");
        }
        validateDetails(name, credits, capacity);
        if (enrolled < 0 || enrolled > capacity) {
            throw new IllegalArgumentException(
                    "Enrolled count " + enrolled + " outside [0, " + capacity + "] for course " + id);
        }

        this.clock = clock != null ? clock : Clock.systemDefaultZone();
        this.id = id.trim();
        this.name = name;
        this.description = description != null ? description : "";
        this.credits = credits;
        this.instructor = instructor != null ? instructor : "";
        this.capacity = capacity;
        this.enrolled = enrolled;
        this.prerequisites = copyPrerequisites(prerequisites);
        this.schedule = schedule;
        this.active = active == null || active;
        this.createdAt = createdAt != null ? createdAt : LocalDateTime.now(this.clock);
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;

        if (this.updatedAt.isBefore(this.createdAt)) {
            throw new IllegalArgumentException("updatedAt precedes createdAt for course " + id);
        }
    }

    // ========================================================================
    // SEATS
    // ========================================================================

    public synchronized boolean canEnroll() {
        return active && enrolled < capacity;
    }

    /**
     * Take a seat if the course is active and not full.
     *
     * @return true if a seat was taken
     */
    public synchronized boolean enroll() {
        if (!canEnroll()) {
            return false;
        }
        enrolled++;
        touch();
        return true;
    }

    /**
     * Release a seat.
     *
     * @return false if no seat was taken
     */
    public synchronized boolean drop() {
        if (enrolled <= 0) {
            return false;
        }
        enrolled--;
        touch();
        return true;
    }

    public synchronized int availableSeats() {
        return Math.max(0, capacity - enrolled);
    }

    public synchronized boolean isFull() {
        return enrolled >= capacity;
    }

    // ========================================================================
    // SCHEDULING & PREREQUISITES
    // ========================================================================

    /**
     * Check whether this course meets at the same time as another.
     * Courses without a schedule never conflict.
     */
    public boolean conflictsWith(Course other) {
        Schedule mine = this.schedule;
        Schedule theirs = other.schedule;
        if (mine == null || theirs == null) {
            return false;
        }
        return mine.overlaps(theirs);
    }

    public boolean meetsPrerequisites(Set<String> completedCourseIds) {
        Set<String> required = this.prerequisites;
        if (required.isEmpty()) {
            return true;
        }
        return completedCourseIds != null && completedCourseIds.containsAll(required);
    }

    public Optional<Schedule> findSchedule() {
        return Optional.ofNullable(schedule);
    }

    public synchronized void updateSchedule(Schedule newSchedule) {
        if (newSchedule == null) {
            throw new IllegalArgumentException("Schedule is required; use clearSchedule() to remove it");
        }
        this.schedule = newSchedule;
        touch();
    }

    public synchronized void clearSchedule() {
        this.schedule = null;
        touch();
    }

    // ========================================================================
    // ADMINISTRATION
    // ========================================================================

    /**
     * Replace the editable catalog details.
     *
     * @throws IllegalArgumentException if a value is invalid or capacity
     *                                  would drop below the enrolled count
     */
    public synchronized void updateDetails(String newName, String newDescription, int newCredits,
                                           String newInstructor, int newCapacity,
                                           Collection<String> newPrerequisites) {
        validateDetails(newName, newCredits, newCapacity);
        if (newCapacity < enrolled) {
            throw new IllegalArgumentException(
                    "Capacity " + newCapacity + " is below current enrollment " + enrolled + " for course " + id);
        }
        this.name = newName;
        this.description = newDescription != null ? newDescription : "";
        this.credits = newCredits;
        this.instructor = newInstructor != null ? newInstructor : "";
        this.capacity = newCapacity;
        this.prerequisites = copyPrerequisites(newPrerequisites);
        touch();
    }

    /**
     * Soft delete. Returns false if the course was already inactive.
     */
    public synchronized boolean deactivate() {
        if (!active) {
            return false;
        }
        active = false;
        touch();
        return true;
    }

    private void touch() {
        LocalDateTime now = LocalDateTime.now(clock);
        if (now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    private static void validateDetails(String name, int credits, int capacity) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Course name is required");
        }
        if (credits <= 0) {
            throw new IllegalArgumentException("Credits must be positive: " + credits);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
    }

    private static Set<String> copyPrerequisites(Collection<String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String prerequisite : source) {
            if (prerequisite != null && !prerequisite.isBlank()) {
                copy.add(prerequisite.trim());
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    @Override
    public String toString() {
        return "Course(" + id + ": " + name + ")";
    }
}
