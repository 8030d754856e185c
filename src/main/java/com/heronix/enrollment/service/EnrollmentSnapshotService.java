package com.heronix.enrollment.service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.heronix.enrollment.exception.EnrollmentStoreException;
import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.domain.Registration;
import com.heronix.enrollment.persistence.EnrollmentStore;
import com.heronix.enrollment.registry.CourseRegistry;
import com.heronix.enrollment.registry.RegistrationRegistry;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the registries in sync with the persistence collaborator.
 *
 * Loads both collections while the application context starts, before
 * any request is served, and writes the whole collection back after every
 * change. Without a store (storage disabled) loads and saves are no-ops.
 */
@Service
@Slf4j
public class EnrollmentSnapshotService {

    private final CourseRegistry courseRegistry;
    private final RegistrationRegistry registrationRegistry;
    private final RecordTranslationService translationService;
    private final Optional<EnrollmentStore> store;

    private volatile boolean lastWriteFailed = false;

    public EnrollmentSnapshotService(
            CourseRegistry courseRegistry,
            RegistrationRegistry registrationRegistry,
            RecordTranslationService translationService,
            Optional<EnrollmentStore> store) {
        this.courseRegistry = courseRegistry;
        this.registrationRegistry = registrationRegistry;
        this.translationService = translationService;
        this.store = store;
    }

    /**
     * Load the catalog, then the registrations.
     *
     * @throws EnrollmentStoreException if the snapshot cannot be read
     * @throws com.heronix.enrollment.exception.InvalidRecordException if a record is invalid
     */
    @PostConstruct
    public void loadSnapshots() {
        if (store.isEmpty()) {
            log.info("Snapshot storage disabled, starting with empty registries");
            return;
        }

        List<Course> courses = store.get().loadCourses().stream()
                .map(translationService::toCourse)
                .collect(Collectors.toList());
        courseRegistry.load(courses);

        List<Registration> registrations = store.get().loadRegistrations().stream()
                .map(translationService::toRegistration)
                .collect(Collectors.toList());
        registrationRegistry.load(registrations);

        long orphaned = registrations.stream()
                .filter(r -> !courseRegistry.contains(r.getCourseId()))
                .count();
        if (orphaned > 0) {
            log.warn("{} registrations reference courses missing from the catalog", orphaned);
        }
        log.info("Loaded snapshot: {} courses, {} registrations", courses.size(), registrations.size());
    }

    public synchronized void saveCourses() {
        store.ifPresent(s -> guarded(() -> s.saveCourses(
                translationService.toCourseRecords(courseRegistry.listAll()))));
    }

    public synchronized void saveRegistrations() {
        store.ifPresent(s -> guarded(() -> s.saveRegistrations(
                translationService.toRegistrationRecords(registrationRegistry.findAll()))));
    }

    /**
     * Save both collections; used after operations that change seats and registrations together.
     */
    public synchronized void saveAll() {
        saveCourses();
        saveRegistrations();
    }

    // ========================================================================
    // BACKUPS
    // ========================================================================

    /**
     * Save the current state, then copy the snapshot files into a new backup.
     *
     * @return the backup name
     */
    public synchronized String createBackup() {
        EnrollmentStore target = requireStore();
        saveAll();
        return target.createBackup();
    }

    public List<String> listBackups() {
        return store.map(EnrollmentStore::listBackups).orElse(List.of());
    }

    /**
     * Replace the snapshot files with a backup and reload both registries from it.
     */
    public synchronized void restoreBackup(String backupName) {
        requireStore().restoreBackup(backupName);
        loadSnapshots();
        log.info("Registries restored from backup {}", backupName);
    }

    public boolean isLastWriteFailed() {
        return lastWriteFailed;
    }

    public boolean isStorageEnabled() {
        return store.isPresent();
    }

    private EnrollmentStore requireStore() {
        return store.orElseThrow(() -> new IllegalStateException("Snapshot storage is disabled"));
    }

    private void guarded(Runnable write) {
        try {
            write.run();
            lastWriteFailed = false;
        } catch (EnrollmentStoreException e) {
            lastWriteFailed = true;
            log.error("Snapshot write failed; in-memory state is ahead of storage", e);
            throw e;
        }
    }
}
