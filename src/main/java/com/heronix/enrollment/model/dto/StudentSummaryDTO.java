package com.heronix.enrollment.model.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A student's current load: active courses and the credits they carry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentSummaryDTO {

    private String studentId;

    private int enrolledCourses;

    private int totalCredits;

    private List<CourseRecord> courses;
}
