package com.heronix.enrollment.model.dto;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog-wide capacity report.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CatalogStatsDTO {

    private long totalCourses;

    private long activeCourses;

    /**
     * Active courses with at least one open seat.
     */
    private long availableCourses;

    /**
     * Active courses with no open seat.
     */
    private long fullCourses;

    private long totalSeats;

    private long enrolledSeats;

    /**
     * Enrolled seats as a percentage of total seats across active courses.
     */
    private double averageCapacityUtilization;

    private long totalCreditsOffered;

    private LocalDateTime generatedAt;
}
