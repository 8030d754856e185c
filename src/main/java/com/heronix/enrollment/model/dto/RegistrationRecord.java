package com.heronix.enrollment.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registration record exchanged with the persistence collaborator and API callers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
public class RegistrationRecord {

    private String id;

    @JsonProperty("student_id")
    private String studentId;

    @JsonProperty("course_id")
    private String courseId;

    /**
     * "enrolled", "dropped", "waitlisted" or "pending"
     */
    private String status;

    @JsonProperty("enrollment_date")
    private String enrollmentDate;

    @JsonProperty("drop_date")
    private String dropDate;

    private String grade;

    /**
     * Semicolon-joined notes, empty when there are none
     */
    private String notes;
}
