package com.heronix.enrollment.controller.api;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.enrollment.model.domain.Registration;
import com.heronix.enrollment.model.dto.CourseConflictDTO;
import com.heronix.enrollment.model.dto.CourseEnrollmentSummaryDTO;
import com.heronix.enrollment.model.dto.CourseHistoryEntryDTO;
import com.heronix.enrollment.model.dto.EnrollmentRequestDTO;
import com.heronix.enrollment.model.dto.EnrollmentResultDTO;
import com.heronix.enrollment.model.dto.GradeRequestDTO;
import com.heronix.enrollment.model.dto.NoteRequestDTO;
import com.heronix.enrollment.model.dto.ReEnrollRequestDTO;
import com.heronix.enrollment.model.dto.RegistrationRecord;
import com.heronix.enrollment.model.dto.RegistrationStatsDTO;
import com.heronix.enrollment.model.dto.StudentSummaryDTO;
import com.heronix.enrollment.model.dto.StudentTimetableDTO;
import com.heronix.enrollment.model.enums.EnrollmentOutcome;
import com.heronix.enrollment.service.EnrollmentService;
import com.heronix.enrollment.service.RecordTranslationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for student registrations.
 */
@RestController
@RequestMapping("/api/v1/registrations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Registrations", description = "APIs for enrolling, dropping and reporting on registrations")
public class RegistrationController {

    private final EnrollmentService enrollmentService;
    private final RecordTranslationService translationService;

    @PostMapping("/enroll")
    @Operation(summary = "Enroll a student", description = "Checks prerequisites, limits, conflicts and capacity")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Student enrolled"),
        @ApiResponse(responseCode = "404", description = "Course not found"),
        @ApiResponse(responseCode = "409", description = "Enrollment refused; see outcome")
    })
    public ResponseEntity<EnrollmentResultDTO> enroll(@Valid @RequestBody EnrollmentRequestDTO request) {
        log.info("Enrollment request: student {} -> course {}", request.getStudentId(), request.getCourseId());
        EnrollmentResultDTO result = enrollmentService.enroll(request);
        return ResponseEntity.status(statusOf(result, HttpStatus.CREATED)).body(result);
    }

    @PostMapping("/drop")
    @Operation(summary = "Drop a course")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Course dropped"),
        @ApiResponse(responseCode = "409", description = "Student is not enrolled in the course")
    })
    public ResponseEntity<Map<String, Object>> drop(@Valid @RequestBody EnrollmentRequestDTO request) {
        boolean dropped = enrollmentService.drop(request.getStudentId(), request.getCourseId());
        Map<String, Object> body = Map.of(
                "studentId", request.getStudentId(),
                "courseId", request.getCourseId(),
                "dropped", dropped);
        return ResponseEntity.status(dropped ? HttpStatus.OK : HttpStatus.CONFLICT).body(body);
    }

    @PostMapping("/{registrationId}/re-enroll")
    @Operation(summary = "Re-enroll a dropped registration", description = "Applies the same checks as a new enrollment")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Registration re-enrolled"),
        @ApiResponse(responseCode = "404", description = "Registration or course not found"),
        @ApiResponse(responseCode = "409", description = "Re-enrollment refused; see outcome")
    })
    public ResponseEntity<EnrollmentResultDTO> reEnroll(
            @PathVariable String registrationId,
            @RequestBody(required = false) ReEnrollRequestDTO request) {
        Set<String> completed = request != null ? request.getCompletedCourseIds() : null;
        EnrollmentResultDTO result = enrollmentService.reEnroll(registrationId, completed);
        return ResponseEntity.status(statusOf(result, HttpStatus.OK)).body(result);
    }

    @PutMapping("/{registrationId}/grade")
    @Operation(summary = "Record a grade")
    public ResponseEntity<RegistrationRecord> setGrade(
            @PathVariable String registrationId,
            @Valid @RequestBody GradeRequestDTO request) {
        return ResponseEntity.ok(translationService.toRecord(
                enrollmentService.setGrade(registrationId, request.grade())));
    }

    @PostMapping("/{registrationId}/notes")
    @Operation(summary = "Append a note")
    public ResponseEntity<RegistrationRecord> addNote(
            @PathVariable String registrationId,
            @Valid @RequestBody NoteRequestDTO request) {
        return ResponseEntity.ok(translationService.toRecord(
                enrollmentService.addNote(registrationId, request.note())));
    }

    @GetMapping("/{registrationId}")
    @Operation(summary = "Get a registration")
    public ResponseEntity<RegistrationRecord> getRegistration(@PathVariable String registrationId) {
        return ResponseEntity.ok(translationService.toRecord(enrollmentService.getRegistration(registrationId)));
    }

    @GetMapping("/students/{studentId}")
    @Operation(summary = "List a student's registrations")
    public ResponseEntity<List<RegistrationRecord>> getStudentRegistrations(
            @PathVariable String studentId,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(toRecords(enrollmentService.getStudentRegistrations(studentId, activeOnly)));
    }

    @GetMapping("/students/{studentId}/history")
    @Operation(summary = "A student's course history")
    public ResponseEntity<List<CourseHistoryEntryDTO>> getStudentHistory(@PathVariable String studentId) {
        return ResponseEntity.ok(enrollmentService.getStudentHistory(studentId));
    }

    @GetMapping("/students/{studentId}/conflicts")
    @Operation(summary = "Schedule conflicts among a student's active courses")
    public ResponseEntity<List<CourseConflictDTO>> getStudentConflicts(@PathVariable String studentId) {
        return ResponseEntity.ok(enrollmentService.getStudentConflicts(studentId));
    }

    @GetMapping("/students/{studentId}/summary")
    @Operation(summary = "A student's active courses and credit load")
    public ResponseEntity<StudentSummaryDTO> getStudentSummary(@PathVariable String studentId) {
        return ResponseEntity.ok(enrollmentService.getStudentSummary(studentId));
    }

    @GetMapping("/students/{studentId}/timetable")
    @Operation(summary = "A student's weekly timetable", description = "Active scheduled courses grouped by day and time slot")
    public ResponseEntity<StudentTimetableDTO> getStudentTimetable(@PathVariable String studentId) {
        return ResponseEntity.ok(enrollmentService.getStudentTimetable(studentId));
    }

    @GetMapping("/courses/{courseId}")
    @Operation(summary = "List a course's registrations")
    public ResponseEntity<List<RegistrationRecord>> getCourseRegistrations(
            @PathVariable String courseId,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(toRecords(enrollmentService.getCourseRegistrations(courseId, activeOnly)));
    }

    @GetMapping("/courses/{courseId}/summary")
    @Operation(summary = "Enrollment summary for a course")
    public ResponseEntity<CourseEnrollmentSummaryDTO> getCourseSummary(@PathVariable String courseId) {
        return ResponseEntity.ok(enrollmentService.getCourseSummary(courseId));
    }

    @GetMapping("/stats")
    @Operation(summary = "Registration statistics")
    public ResponseEntity<RegistrationStatsDTO> getStatistics() {
        return ResponseEntity.ok(enrollmentService.getStatistics());
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Remove old dropped registrations")
    public ResponseEntity<Map<String, Object>> cleanup(@RequestParam(defaultValue = "365") int daysOld) {
        log.info("Manual cleanup of dropped registrations older than {} days", daysOld);
        int removed = enrollmentService.cleanup(daysOld);
        return ResponseEntity.ok(Map.of("daysOld", daysOld, "removed", removed));
    }

    private static HttpStatus statusOf(EnrollmentResultDTO result, HttpStatus success) {
        if (result.isEnrolled()) {
            return success;
        }
        return result.outcome() == EnrollmentOutcome.COURSE_NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
    }

    private List<RegistrationRecord> toRecords(List<Registration> registrations) {
        return registrations.stream().map(translationService::toRecord).collect(Collectors.toList());
    }
}
