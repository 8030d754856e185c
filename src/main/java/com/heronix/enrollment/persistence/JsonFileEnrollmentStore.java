package com.heronix.enrollment.persistence;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.enrollment.exception.BackupNotFoundException;
import com.heronix.enrollment.exception.EnrollmentStoreException;
import com.heronix.enrollment.model.dto.CourseRecord;
import com.heronix.enrollment.model.dto.RegistrationRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Stores course and registration records as versioned JSON files.
 *
 * File layout:
 * <pre>
 * { "schema_version": 1, "courses": [ ... ] }
 * { "schema_version": 1, "registrations": [ ... ] }
 * </pre>
 *
 * Writes go to a temporary sibling file that is then moved over the
 * target, so a crash mid-write leaves the previous snapshot intact.
 *
 * Backups are directories named {@code backup_yyyyMMdd_HHmmss} under the
 * backup directory, each holding copies of both snapshot files.
 */
@Slf4j
public class JsonFileEnrollmentStore implements EnrollmentStore {

    public static final int SCHEMA_VERSION = 1;

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final Pattern BACKUP_NAME = Pattern.compile("backup_\\d{8}_\\d{6}(_\\d+)?");

    private final Path coursesFile;
    private final Path registrationsFile;
    private final Path backupDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Store with backups in a {@code backups} directory next to the courses file.
     */
    public JsonFileEnrollmentStore(Path coursesFile, Path registrationsFile, ObjectMapper objectMapper) {
        this(coursesFile, registrationsFile, coursesFile.toAbsolutePath().resolveSibling("backups"),
                objectMapper, Clock.systemDefaultZone());
    }

    public JsonFileEnrollmentStore(Path coursesFile, Path registrationsFile, Path backupDir,
                                   ObjectMapper objectMapper, Clock clock) {
        this.coursesFile = coursesFile;
        this.registrationsFile = registrationsFile;
        this.backupDir = backupDir;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public record CourseSnapshot(
            @JsonProperty("schema_version") Integer schemaVersion,
            @JsonProperty("courses") List<CourseRecord> courses) {
    }

    public record RegistrationSnapshot(
            @JsonProperty("schema_version") Integer schemaVersion,
            @JsonProperty("registrations") List<RegistrationRecord> registrations) {
    }

    @Override
    public List<CourseRecord> loadCourses() {
        CourseSnapshot snapshot = read(coursesFile, CourseSnapshot.class);
        if (snapshot == null) {
            return List.of();
        }
        checkVersion(coursesFile, snapshot.schemaVersion());
        return snapshot.courses() != null ? snapshot.courses() : List.of();
    }

    @Override
    public void saveCourses(List<CourseRecord> courses) {
        write(coursesFile, new CourseSnapshot(SCHEMA_VERSION, courses));
        log.debug("Saved {} course records to {}", courses.size(), coursesFile);
    }

    @Override
    public List<RegistrationRecord> loadRegistrations() {
        RegistrationSnapshot snapshot = read(registrationsFile, RegistrationSnapshot.class);
        if (snapshot == null) {
            return List.of();
        }
        checkVersion(registrationsFile, snapshot.schemaVersion());
        return snapshot.registrations() != null ? snapshot.registrations() : List.of();
    }

    @Override
    public void saveRegistrations(List<RegistrationRecord> registrations) {
        write(registrationsFile, new RegistrationSnapshot(SCHEMA_VERSION, registrations));
        log.debug("Saved {} registration records to {}", registrations.size(), registrationsFile);
    }

    @Override
    public String createBackup() {
        String baseName = "backup_" + LocalDateTime.now(clock).format(BACKUP_STAMP);
        try {
            Files.createDirectories(backupDir);
            String name = baseName;
            Path target = backupDir.resolve(name);
            for (int suffix = 1; Files.exists(target); suffix++) {
                name = baseName + "_" + suffix;
                target = backupDir.resolve(name);
            }
            Files.createDirectory(target);
            for (Path file : List.of(coursesFile, registrationsFile)) {
                if (Files.exists(file)) {
                    Files.copy(file, target.resolve(file.getFileName()), StandardCopyOption.COPY_ATTRIBUTES);
                }
            }
            log.info("Created backup {} in {}", name, backupDir);
            return name;
        } catch (IOException e) {
            throw new EnrollmentStoreException("Failed to create backup in " + backupDir, e);
        }
    }

    @Override
    public List<String> listBackups() {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(backupDir)) {
            return entries
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> BACKUP_NAME.matcher(name).matches())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new EnrollmentStoreException("Failed to list backups in " + backupDir, e);
        }
    }

    @Override
    public void restoreBackup(String backupName) {
        if (backupName == null || !BACKUP_NAME.matcher(backupName).matches()) {
            throw new IllegalArgumentException("Invalid backup name: " + backupName);
        }
        Path source = backupDir.resolve(backupName);
        if (!Files.isDirectory(source)) {
            throw new BackupNotFoundException(backupName);
        }
        try {
            for (Path file : List.of(coursesFile, registrationsFile)) {
                Path backupFile = source.resolve(file.getFileName());
                if (Files.exists(backupFile)) {
                    Path parent = file.toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
                    Files.copy(backupFile, temp, StandardCopyOption.REPLACE_EXISTING);
                    replace(temp, file);
                }
            }
        } catch (IOException e) {
            throw new EnrollmentStoreException("Failed to restore backup " + backupName, e);
        }
        log.info("Restored snapshot files from backup {}", backupName);
    }

    private <T> T read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            log.info("No snapshot at {}, starting empty", file);
            return null;
        }
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new EnrollmentStoreException("Failed to read snapshot " + file, e);
        }
    }

    private void write(Path file, Object snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            replace(temp, file);
        } catch (IOException e) {
            throw new EnrollmentStoreException("Failed to write snapshot " + file, e);
        }
    }

    private static void replace(Path temp, Path file) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void checkVersion(Path file, Integer version) {
        if (version == null) {
            throw new EnrollmentStoreException("Snapshot " + file + " has no schema_version");
        }
        if (version != SCHEMA_VERSION) {
            throw new EnrollmentStoreException(
                    "Unsupported schema_version " + version + " in " + file + " (expected " + SCHEMA_VERSION + ")");
        }
    }
}
