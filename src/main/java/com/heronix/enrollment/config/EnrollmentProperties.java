package com.heronix.enrollment.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for Heronix Enrollment.
 */
@Data
@ConfigurationProperties(prefix = "heronix.enrollment")
public class EnrollmentProperties {

    /**
     * Student-facing enrollment rules
     */
    private PolicyConfig policy = new PolicyConfig();

    /**
     * Course catalog configuration
     */
    private CatalogConfig catalog = new CatalogConfig();

    /**
     * Dropped-registration cleanup configuration
     */
    private CleanupConfig cleanup = new CleanupConfig();

    /**
     * Snapshot storage configuration
     */
    private StorageConfig storage = new StorageConfig();

    @Data
    public static class PolicyConfig {
        /**
         * Maximum number of active courses per student
         */
        private int maxCoursesPerStudent = 6;

        /**
         * Maximum credits a student may carry in a semester
         */
        private int maxCreditsPerSemester = 18;

        /**
         * Refuse enrollment when prerequisites are not completed
         */
        private boolean enforcePrerequisites = true;

        /**
         * Refuse enrollment when the course overlaps an active course
         */
        private boolean rejectScheduleConflicts = true;
    }

    @Data
    public static class CatalogConfig {
        /**
         * Capacity used when a new course does not specify one
         */
        private int defaultCapacity = 30;

        /**
         * Rooms available for scheduling. Empty means any room is accepted.
         */
        private List<String> rooms = new ArrayList<>();
    }

    @Data
    public static class CleanupConfig {
        /**
         * Enable the scheduled cleanup job
         */
        private boolean scheduledEnabled = false;

        /**
         * Dropped registrations older than this many days are removed
         */
        private int retentionDays = 365;

        /**
         * Cron expression for the cleanup job (default: daily at 3:30 AM)
         */
        private String scheduleCron = "0 30 3 * * ?";
    }

    @Data
    public static class StorageConfig {
        /**
         * Load snapshots at startup and write through after changes
         */
        private boolean enabled = true;

        /**
         * Directory holding the snapshot files
         */
        private String dataDir = "data";

        private String coursesFile = "courses.json";

        private String registrationsFile = "registrations.json";

        /**
         * Directory for snapshot backups, relative to the data directory unless absolute
         */
        private String backupDir = "backups";
    }
}
