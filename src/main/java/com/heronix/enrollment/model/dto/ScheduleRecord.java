package com.heronix.enrollment.model.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Schedule part of a course record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleRecord {

    /**
     * Day names (e.g., ["Monday", "Wednesday"])
     */
    @NotEmpty
    private List<String> days;

    /**
     * Time range in 24-hour "HH:MM-HH:MM" form
     */
    @NotBlank
    private String time;

    @NotBlank
    private String room;
}
