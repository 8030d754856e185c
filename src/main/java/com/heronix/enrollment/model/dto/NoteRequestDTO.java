package com.heronix.enrollment.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for appending a note to a registration.
 */
public record NoteRequestDTO(@NotBlank @Size(max = 500) String note) {
}
