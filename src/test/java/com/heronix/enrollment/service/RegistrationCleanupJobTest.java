package com.heronix.enrollment.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.heronix.enrollment.config.EnrollmentProperties;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistrationCleanupJobTest {

    @Mock
    private EnrollmentService enrollmentService;

    private EnrollmentProperties properties;
    private RegistrationCleanupJob job;

    @BeforeEach
    void setUp() {
        properties = new EnrollmentProperties();
        job = new RegistrationCleanupJob(enrollmentService, properties);
    }

    @Test
    void disabledJobDoesNothing() {
        job.run();

        verify(enrollmentService, never()).cleanup(anyInt());
    }

    @Test
    void enabledJobUsesRetention() {
        properties.getCleanup().setScheduledEnabled(true);
        properties.getCleanup().setRetentionDays(90);
        when(enrollmentService.cleanup(90)).thenReturn(3);

        job.run();

        verify(enrollmentService).cleanup(90);
    }
}
