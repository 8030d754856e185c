package com.heronix.enrollment.model.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or editing a course.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CourseRequestDTO {

    /**
     * Catalog key; required on create, ignored on edit.
     */
    private String id;

    @NotBlank
    private String name;

    private String description;

    @NotNull
    @Positive
    private Integer credits;

    private String instructor;

    /**
     * Defaults to the configured catalog capacity when omitted.
     */
    @Positive
    private Integer capacity;

    private List<String> prerequisites;

    @Valid
    private ScheduleRecord schedule;
}
