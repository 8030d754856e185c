package com.heronix.enrollment.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.enrollment.registry.CourseRegistry;
import com.heronix.enrollment.registry.RegistrationRegistry;
import com.heronix.enrollment.service.EnrollmentSnapshotService;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the registries.
 *
 * Reports DOWN when the last snapshot write failed, since in-memory
 * changes since then would be lost on restart.
 */
@Component
@RequiredArgsConstructor
public class RegistryHealthIndicator implements HealthIndicator {

    private final CourseRegistry courseRegistry;
    private final RegistrationRegistry registrationRegistry;
    private final EnrollmentSnapshotService snapshotService;

    @Override
    public Health health() {
        Health.Builder builder = snapshotService.isLastWriteFailed() ? Health.down() : Health.up();
        return builder
                .withDetail("courses", courseRegistry.size())
                .withDetail("registrations", registrationRegistry.size())
                .withDetail("storage", snapshotService.isStorageEnabled() ? "file" : "disabled")
                .build();
    }
}
