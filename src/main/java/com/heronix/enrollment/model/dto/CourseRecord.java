package com.heronix.enrollment.model.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Course record exchanged with the persistence collaborator and API callers.
 *
 * Timestamps are ISO-8601 strings. Boxed types distinguish a missing
 * field from a zero value so the codec can reject incomplete records.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
public class CourseRecord {

    private String id;

    private String name;

    private String description;

    private Integer credits;

    private String instructor;

    private Integer capacity;

    private Integer enrolled;

    private List<String> prerequisites;

    /**
     * Null when the course has no schedule
     */
    private ScheduleRecord schedule;

    private Boolean active;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;
}
