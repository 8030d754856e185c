package com.heronix.enrollment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.heronix.enrollment.config.EnrollmentProperties;

/**
 * Heronix Enrollment - Course Catalog and Registration Engine
 *
 * Students enroll in scheduled course offerings under capacity and
 * prerequisite constraints; administrators manage the catalog.
 *
 * Core Principle: a seat is only ever granted once, and only while it exists.
 */
@SpringBootApplication
@EnableConfigurationProperties(EnrollmentProperties.class)
@EnableScheduling
public class EnrollmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnrollmentApplication.class, args);
    }
}
