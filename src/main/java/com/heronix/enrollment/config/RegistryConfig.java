package com.heronix.enrollment.config;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.enrollment.persistence.EnrollmentStore;
import com.heronix.enrollment.persistence.JsonFileEnrollmentStore;
import com.heronix.enrollment.registry.CourseRegistry;
import com.heronix.enrollment.registry.RegistrationRegistry;

/**
 * Wires the registries and their collaborators.
 *
 * The registries are plain objects built here once and injected wherever
 * they are needed; tests build their own instances directly.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Configuration
public class RegistryConfig {

    @Bean
    public Clock enrollmentClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CourseRegistry courseRegistry() {
        return new CourseRegistry();
    }

    @Bean
    public RegistrationRegistry registrationRegistry(CourseRegistry courseRegistry, Clock enrollmentClock) {
        return new RegistrationRegistry(courseRegistry, enrollmentClock);
    }

    /**
     * File-backed snapshot store under {@code heronix.enrollment.storage.data-dir}.
     */
    @Bean
    @ConditionalOnProperty(prefix = "heronix.enrollment.storage", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public EnrollmentStore enrollmentStore(EnrollmentProperties properties, ObjectMapper objectMapper,
                                           Clock enrollmentClock) {
        EnrollmentProperties.StorageConfig storage = properties.getStorage();
        Path dataDir = Path.of(storage.getDataDir());
        return new JsonFileEnrollmentStore(
                dataDir.resolve(storage.getCoursesFile()),
                dataDir.resolve(storage.getRegistrationsFile()),
                dataDir.resolve(storage.getBackupDir()),
                objectMapper,
                enrollmentClock);
    }
}
