package com.heronix.enrollment.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registration counts for a single course.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CourseEnrollmentSummaryDTO {

    private String courseId;

    private long totalEnrollments;

    private long activeEnrollments;

    private long droppedEnrollments;

    /**
     * Active registrations as a percentage of the course's registrations (0 when there are none).
     */
    private double retentionRate;
}
