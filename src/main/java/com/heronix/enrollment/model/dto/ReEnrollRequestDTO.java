package com.heronix.enrollment.model.dto;

import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for re-enrolling a dropped registration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReEnrollRequestDTO {

    /**
     * Courses the student has completed, checked against the course's prerequisites.
     */
    private Set<String> completedCourseIds;
}
