package com.heronix.enrollment.persistence;

import java.util.List;

import com.heronix.enrollment.model.dto.CourseRecord;
import com.heronix.enrollment.model.dto.RegistrationRecord;

/**
 * Persistence collaborator for the catalog and registrations.
 *
 * Each save overwrites the whole collection; no multi-record transactions
 * are assumed.
 */
public interface EnrollmentStore {

    /**
     * Load all course records. Returns an empty list when nothing was saved yet.
     *
     * @throws com.heronix.enrollment.exception.EnrollmentStoreException if the data cannot be read
     */
    List<CourseRecord> loadCourses();

    /**
     * Replace the stored course records.
     */
    void saveCourses(List<CourseRecord> courses);

    /**
     * Load all registration records. Returns an empty list when nothing was saved yet.
     */
    List<RegistrationRecord> loadRegistrations();

    /**
     * Replace the stored registration records.
     */
    void saveRegistrations(List<RegistrationRecord> registrations);

    /**
     * Copy the current snapshot files into a new backup.
     *
     * @return the backup name, usable with {@link #restoreBackup(String)}
     */
    String createBackup();

    /**
     * Names of the available backups, oldest first.
     */
    List<String> listBackups();

    /**
     * Replace the current snapshot files with those of a backup.
     * Files missing from the backup are left as they are.
     *
     * @throws com.heronix.enrollment.exception.BackupNotFoundException if no such backup exists
     */
    void restoreBackup(String backupName);
}
