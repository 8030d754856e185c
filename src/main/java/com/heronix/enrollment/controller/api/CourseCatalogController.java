package com.heronix.enrollment.controller.api;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.enrollment.model.domain.Course;
import com.heronix.enrollment.model.dto.CatalogStatsDTO;
import com.heronix.enrollment.model.dto.CourseConflictDTO;
import com.heronix.enrollment.model.dto.CourseRecord;
import com.heronix.enrollment.model.dto.CourseRequestDTO;
import com.heronix.enrollment.model.dto.ScheduleRecord;
import com.heronix.enrollment.service.CourseCatalogService;
import com.heronix.enrollment.service.RecordTranslationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for the course catalog.
 */
@RestController
@RequestMapping("/api/v1/courses")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Course Catalog", description = "APIs for browsing and administering the course catalog")
public class CourseCatalogController {

    private final CourseCatalogService catalogService;
    private final RecordTranslationService translationService;

    @GetMapping
    @Operation(summary = "List courses", description = "Active courses, or all courses when includeInactive is set")
    public ResponseEntity<List<CourseRecord>> listCourses(
            @RequestParam(defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(toRecords(catalogService.listCourses(includeInactive)));
    }

    @GetMapping("/{courseId}")
    @Operation(summary = "Get a course")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Course found"),
        @ApiResponse(responseCode = "404", description = "Course not found")
    })
    public ResponseEntity<CourseRecord> getCourse(
            @Parameter(description = "Course id (e.g., CS101)") @PathVariable String courseId) {
        return ResponseEntity.ok(translationService.toRecord(catalogService.getCourse(courseId)));
    }

    @PostMapping
    @Operation(summary = "Create a course")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Course created"),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "409", description = "Course id already in use")
    })
    public ResponseEntity<CourseRecord> createCourse(@Valid @RequestBody CourseRequestDTO request) {
        log.info("Creating course {}", request.getId());
        Course course = catalogService.createCourse(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(translationService.toRecord(course));
    }

    @PutMapping("/{courseId}")
    @Operation(summary = "Edit a course", description = "Replace name, description, credits, instructor, capacity and prerequisites")
    public ResponseEntity<CourseRecord> updateCourse(
            @PathVariable String courseId,
            @Valid @RequestBody CourseRequestDTO request) {
        return ResponseEntity.ok(translationService.toRecord(catalogService.updateCourse(courseId, request)));
    }

    @PutMapping("/{courseId}/schedule")
    @Operation(summary = "Set a course's weekly schedule")
    public ResponseEntity<CourseRecord> updateSchedule(
            @PathVariable String courseId,
            @Valid @RequestBody ScheduleRecord schedule) {
        return ResponseEntity.ok(translationService.toRecord(catalogService.updateSchedule(courseId, schedule)));
    }

    @DeleteMapping("/{courseId}/schedule")
    @Operation(summary = "Clear a course's schedule")
    public ResponseEntity<CourseRecord> clearSchedule(@PathVariable String courseId) {
        return ResponseEntity.ok(translationService.toRecord(catalogService.clearSchedule(courseId)));
    }

    @DeleteMapping("/{courseId}")
    @Operation(summary = "Remove a course", description = "Soft delete: the course is kept and marked inactive")
    public ResponseEntity<Map<String, Object>> deactivateCourse(@PathVariable String courseId) {
        log.info("Removing course {} from catalog", courseId);
        boolean deactivated = catalogService.deactivateCourse(courseId);
        return ResponseEntity.ok(Map.of("courseId", courseId, "deactivated", deactivated));
    }

    @GetMapping("/search")
    @Operation(summary = "Find courses by instructor", description = "Case-insensitive exact match")
    public ResponseEntity<List<CourseRecord>> findByInstructor(@RequestParam String instructor) {
        return ResponseEntity.ok(toRecords(catalogService.findByInstructor(instructor)));
    }

    @GetMapping("/search/credits")
    @Operation(summary = "Find courses by credit range", description = "Inclusive bounds; omit max for no upper bound")
    public ResponseEntity<List<CourseRecord>> findByCreditRange(
            @RequestParam(defaultValue = "0") int min,
            @RequestParam(required = false) Integer max) {
        return ResponseEntity.ok(toRecords(catalogService.findByCreditRange(min, max)));
    }

    @PostMapping("/conflicts")
    @Operation(summary = "Find schedule conflicts", description = "Pairwise conflicts among the given course ids")
    public ResponseEntity<List<CourseConflictDTO>> findConflicts(@RequestBody List<String> courseIds) {
        return ResponseEntity.ok(catalogService.findConflicts(courseIds));
    }

    @GetMapping("/stats")
    @Operation(summary = "Catalog capacity report")
    public ResponseEntity<CatalogStatsDTO> getCatalogStats() {
        return ResponseEntity.ok(catalogService.getCatalogStats());
    }

    private List<CourseRecord> toRecords(List<Course> courses) {
        return courses.stream().map(translationService::toRecord).collect(Collectors.toList());
    }
}
