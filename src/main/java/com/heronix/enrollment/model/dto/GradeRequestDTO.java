package com.heronix.enrollment.model.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for recording a grade.
 */
public record GradeRequestDTO(@NotBlank String grade) {
}
