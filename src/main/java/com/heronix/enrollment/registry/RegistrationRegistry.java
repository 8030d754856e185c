package com.heronix.enrollment.registry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.heronix.enrollment.exception.InvalidRecordException;
import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.domain.Registration;
import com.heronix.enrollment.model.dto.CourseEnrollmentSummaryDTO;
import com.heronix.enrollment.model.dto.RegistrationStatsDTO;

import lombok.extern.slf4j.Slf4j;

/**
 * In-memory store of registrations with the cross-entity invariants:
 * <ul>
 *   <li>at most one ENROLLED registration per (student, course) pair</li>
 *   <li>a registration is only created when the course grants a seat</li>
 * </ul>
 *
 * All mutations run under one registry-wide write lock, so the
 * "look up active registration, then insert" sequence is atomic.
 * Lock order is registry lock, then course monitor.
 *
 * History is append-only: dropped registrations stay alongside newer
 * ones for the same pair until {@link #cleanup(int)} retires them.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Slf4j
public class RegistrationRegistry {

    private final CourseRegistry courseRegistry;
    private final Clock clock;

    private final Map<String, Registration> byId = new LinkedHashMap<>();
    private final Map<PairKey, List<Registration>> byPair = new HashMap<>();
    private final Map<String, List<Registration>> byStudent = new HashMap<>();
    private final Map<String, List<Registration>> byCourse = new HashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public RegistrationRegistry(CourseRegistry courseRegistry, Clock clock) {
        this.courseRegistry = courseRegistry;
        this.clock = clock;
    }

    private record PairKey(String studentId, String courseId) {
    }

    // ========================================================================
    // TRANSITIONS
    // ========================================================================

    /**
     * Enroll a student in a course.
     *
     * @return the new ENROLLED registration, or empty if the student already
     *         holds an active registration for the course, the course is
     *         unknown, or the course refused the seat (inactive or full)
     */
    public Optional<Registration> create(String studentId, String courseId) {
        return write(() -> {
            if (findActive(studentId, courseId).isPresent()) {
                log.debug("Student {} already enrolled in {}", studentId, courseId);
                return Optional.empty();
            }

            Optional<Course> course = courseRegistry.get(courseId);
            if (course.isEmpty()) {
                log.debug("Cannot enroll student {}: course {} not found", studentId, courseId);
                return Optional.empty();
            }
            if (!course.get().enroll()) {
                log.debug("Course {} refused a seat to student {} (inactive or full)", courseId, studentId);
                return Optional.empty();
            }

            Registration registration = Registration.enroll(studentId, courseId, clock);
            index(registration);
            log.info("Registered student {} in course {} ({})", studentId, courseId, registration.getId());
            return Optional.of(registration);
        });
    }

    /**
     * Drop the student's active registration for the course and release the seat.
     *
     * @return false if the student holds no active registration for the course
     */
    public boolean dropFor(String studentId, String courseId) {
        return write(() -> {
            Optional<Registration> active = findActive(studentId, courseId);
            if (active.isEmpty() || !active.get().drop()) {
                log.debug("No active registration for student {} in course {}", studentId, courseId);
                return false;
            }
            releaseSeat(courseId);
            log.info("Student {} dropped course {} ({})", studentId, courseId, active.get().getId());
            return true;
        });
    }

    /**
     * Return a DROPPED registration to ENROLLED, taking a seat in the course.
     *
     * @return false if the registration is unknown or not dropped, the
     *         student already holds another active registration for the
     *         course, or the course refused the seat
     */
    public boolean reEnroll(String registrationId) {
        return write(() -> {
            Registration registration = byId.get(registrationId);
            if (registration == null || !registration.isDropped()) {
                log.debug("Registration {} is not a dropped registration", registrationId);
                return false;
            }
            String studentId = registration.getStudentId();
            String courseId = registration.getCourseId();
            if (findActive(studentId, courseId).isPresent()) {
                log.debug("Student {} already enrolled in {}, cannot re-enroll {}", studentId, courseId, registrationId);
                return false;
            }
            Optional<Course> course = courseRegistry.get(courseId);
            if (course.isEmpty() || !course.get().enroll()) {
                log.debug("Course {} refused a seat for re-enrollment {}", courseId, registrationId);
                return false;
            }
            registration.reEnroll();
            log.info("Re-enrolled student {} in course {} ({})", studentId, courseId, registrationId);
            return true;
        });
    }

    public boolean setGrade(String registrationId, String grade) {
        Optional<Registration> registration = get(registrationId);
        registration.ifPresent(r -> r.setGrade(grade));
        return registration.isPresent();
    }

    public boolean addNote(String registrationId, String note) {
        Optional<Registration> registration = get(registrationId);
        registration.ifPresent(r -> r.addNote(note));
        return registration.isPresent();
    }

    /**
     * Delete DROPPED registrations dropped more than {@code daysOld} days ago.
     * Registrations in any other status are kept regardless of age.
     *
     * @return number of registrations removed
     */
    public int cleanup(int daysOld) {
        if (daysOld < 0) {
            throw new IllegalArgumentException("daysOld must not be negative: " + daysOld);
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(daysOld);
        int removed = write(() -> {
            List<Registration> stale = byId.values().stream()
                    .filter(r -> r.droppedBefore(cutoff))
                    .collect(Collectors.toList());
            stale.forEach(this::unindex);
            return stale.size();
        });
        log.info("Cleanup removed {} dropped registrations older than {} days", removed, daysOld);
        return removed;
    }

    /**
     * Replace the registry content with registrations from a snapshot.
     * Course seat counters are not touched; they are restored with the catalog.
     *
     * @throws InvalidRecordException if the snapshot repeats an id or holds
     *                                two active registrations for one pair
     */
    public void load(Collection<Registration> snapshot) {
        Set<String> ids = new HashSet<>();
        Set<PairKey> activePairs = new HashSet<>();
        for (Registration registration : snapshot) {
            if (!ids.add(registration.getId())) {
                throw new InvalidRecordException("Duplicate registration id in snapshot: " + registration.getId());
            }
            if (registration.isActive()
                    && !activePairs.add(new PairKey(registration.getStudentId(), registration.getCourseId()))) {
                throw new InvalidRecordException("Snapshot holds two active registrations for student "
                        + registration.getStudentId() + " in course " + registration.getCourseId());
            }
        }
        write(() -> {
            byId.clear();
            byPair.clear();
            byStudent.clear();
            byCourse.clear();
            snapshot.forEach(this::index);
            return null;
        });
        log.info("Loaded {} registrations", snapshot.size());
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public Optional<Registration> get(String registrationId) {
        return read(() -> Optional.ofNullable(byId.get(registrationId)));
    }

    /**
     * The pair's active registration if there is one, otherwise its most recent one.
     */
    public Optional<Registration> findByStudentAndCourse(String studentId, String courseId) {
        return read(() -> {
            List<Registration> history = byPair.getOrDefault(new PairKey(studentId, courseId), List.of());
            Optional<Registration> active = history.stream().filter(Registration::isActive).findFirst();
            if (active.isPresent() || history.isEmpty()) {
                return active;
            }
            return Optional.of(history.get(history.size() - 1));
        });
    }

    public List<Registration> findAll() {
        return read(() -> new ArrayList<>(byId.values()));
    }

    public List<Registration> findByStudent(String studentId) {
        return read(() -> new ArrayList<>(byStudent.getOrDefault(studentId, List.of())));
    }

    public List<Registration> findByCourse(String courseId) {
        return read(() -> new ArrayList<>(byCourse.getOrDefault(courseId, List.of())));
    }

    public List<Registration> findActiveByStudent(String studentId) {
        return findByStudent(studentId).stream().filter(Registration::isActive).collect(Collectors.toList());
    }

    public List<Registration> findActiveByCourse(String courseId) {
        return findByCourse(courseId).stream().filter(Registration::isActive).collect(Collectors.toList());
    }

    public RegistrationStatsDTO statistics() {
        return read(() -> {
            long total = byId.size();
            long active = byId.values().stream().filter(Registration::isActive).count();
            long dropped = byId.values().stream().filter(Registration::isDropped).count();
            return RegistrationStatsDTO.builder()
                    .totalRegistrations(total)
                    .activeRegistrations(active)
                    .droppedRegistrations(dropped)
                    .enrollmentRate(percentage(active, total))
                    .build();
        });
    }

    public CourseEnrollmentSummaryDTO courseEnrollmentSummary(String courseId) {
        List<Registration> registrations = findByCourse(courseId);
        long total = registrations.size();
        long active = registrations.stream().filter(Registration::isActive).count();
        long dropped = registrations.stream().filter(Registration::isDropped).count();
        return CourseEnrollmentSummaryDTO.builder()
                .courseId(courseId)
                .totalEnrollments(total)
                .activeEnrollments(active)
                .droppedEnrollments(dropped)
                .retentionRate(percentage(active, total))
                .build();
    }

    public int size() {
        return read(byId::size);
    }

    // ========================================================================
    // INTERNALS (callers hold the lock)
    // ========================================================================

    private Optional<Registration> findActive(String studentId, String courseId) {
        return byPair.getOrDefault(new PairKey(studentId, courseId), List.of()).stream()
                .filter(Registration::isActive)
                .findFirst();
    }

    private void releaseSeat(String courseId) {
        Optional<Course> course = courseRegistry.get(courseId);
        if (course.isEmpty()) {
            log.warn("Course {} missing from catalog while releasing a seat", courseId);
        } else if (!course.get().drop()) {
            log.warn("Course {} had no seat to release", courseId);
        }
    }

    private void index(Registration registration) {
        byId.put(registration.getId(), registration);
        byPair.computeIfAbsent(new PairKey(registration.getStudentId(), registration.getCourseId()),
                k -> new ArrayList<>()).add(registration);
        byStudent.computeIfAbsent(registration.getStudentId(), k -> new ArrayList<>()).add(registration);
        byCourse.computeIfAbsent(registration.getCourseId(), k -> new ArrayList<>()).add(registration);
    }

    private void unindex(Registration registration) {
        byId.remove(registration.getId());
        removeFrom(byPair, new PairKey(registration.getStudentId(), registration.getCourseId()), registration);
        removeFrom(byStudent, registration.getStudentId(), registration);
        removeFrom(byCourse, registration.getCourseId(), registration);
    }

    private static <K> void removeFrom(Map<K, List<Registration>> index, K key, Registration registration) {
        List<Registration> bucket = index.get(key);
        if (bucket == null) {
            return;
        }
        bucket.remove(registration);
        if (bucket.isEmpty()) {
            index.remove(key);
        }
    }

    private static double percentage(long part, long whole) {
        return whole == 0 ? 0.0 : (double) part / whole * 100;
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
