package com.heronix.enrollment.model.dto;

import java.time.LocalDateTime;

import com.heronix.enrollment.model.enums.RegistrationStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of a student's course history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CourseHistoryEntryDTO {

    private String registrationId;

    private String courseId;

    /**
     * Course name, or null when the course is no longer in the catalog.
     */
    private String courseName;

    private RegistrationStatus status;

    private LocalDateTime enrollmentDate;

    private LocalDateTime dropDate;

    private String grade;

    private String notes;
}
