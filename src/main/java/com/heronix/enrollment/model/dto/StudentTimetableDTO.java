package com.heronix.enrollment.model.dto;

import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Weekly timetable of a student's active, scheduled courses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentTimetableDTO {

    private String studentId;

    /**
     * Active courses that have a schedule.
     */
    private int totalCourses;

    /**
     * Credits of the scheduled courses.
     */
    private int totalCredits;

    /**
     * Distinct weekdays with at least one meeting.
     */
    private int daysPerWeek;

    /**
     * Scheduled courses starting before noon.
     */
    private int morningCourses;

    /**
     * Scheduled courses starting at or after noon.
     */
    private int afternoonCourses;

    /**
     * Day name to "HH:MM-HH:MM" slot to course ids, days in week order and slots in time order.
     */
    private Map<String, Map<String, List<String>>> slots;

    /**
     * Active courses without a schedule; they do not appear in {@code slots}.
     */
    private List<String> unscheduledCourseIds;

    private List<CourseConflictDTO> conflicts;
}
