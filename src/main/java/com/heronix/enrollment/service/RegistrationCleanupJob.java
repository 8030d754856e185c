package com.heronix.enrollment.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.heronix.enrollment.config.EnrollmentProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Scheduled removal of stale dropped registrations.
 *
 * Runs on {@code heronix.enrollment.cleanup.schedule-cron} when
 * {@code heronix.enrollment.cleanup.scheduled-enabled} is true.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistrationCleanupJob {

    private final EnrollmentService enrollmentService;
    private final EnrollmentProperties properties;

    @Scheduled(cron = "${heronix.enrollment.cleanup.schedule-cron:0 30 3 * * ?}")
    public void run() {
        EnrollmentProperties.CleanupConfig cleanup = properties.getCleanup();
        if (!cleanup.isScheduledEnabled()) {
            return;
        }
        log.info("Starting scheduled cleanup (retention {} days)", cleanup.getRetentionDays());
        int removed = enrollmentService.cleanup(cleanup.getRetentionDays());
        log.info("Scheduled cleanup finished, {} registrations removed", removed);
    }
}
