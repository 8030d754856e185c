package com.heronix.enrollment.model.dto;

import java.util.Set;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for enrolling a student in (or dropping a student from) a course.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnrollmentRequestDTO {

    @NotBlank
    private String studentId;

    @NotBlank
    private String courseId;

    /**
     * Courses the student has completed, as known to the identity service.
     */
    private Set<String> completedCourseIds;
}
