package com.heronix.enrollment.model.dto;

/**
 * A pair of courses whose schedules overlap.
 */
public record CourseConflictDTO(String firstCourseId, String secondCourseId, String conflictType) {

    public static CourseConflictDTO schedule(String firstCourseId, String secondCourseId) {
        return new CourseConflictDTO(firstCourseId, secondCourseId, "schedule");
    }
}
