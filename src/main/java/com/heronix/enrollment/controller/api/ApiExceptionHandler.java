package com.heronix.enrollment.controller.api;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.heronix.enrollment.exception.BackupNotFoundException;
import com.heronix.enrollment.exception.CourseNotFoundException;
import com.heronix.enrollment.exception.DuplicateCourseException;
import com.heronix.enrollment.exception.EnrollmentStoreException;
import com.heronix.enrollment.exception.InvalidRecordException;
import com.heronix.enrollment.exception.InvalidScheduleException;
import com.heronix.enrollment.exception.RegistrationNotFoundException;
import com.heronix.enrollment.model.dto.ErrorResponse;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps exceptions raised by the enrollment API to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({CourseNotFoundException.class, RegistrationNotFoundException.class,
            BackupNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(DuplicateCourseException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateCourseException ex) {
        log.warn("Duplicate course: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("DUPLICATE_COURSE", ex.getMessage()));
    }

    @ExceptionHandler(InvalidScheduleException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSchedule(InvalidScheduleException ex) {
        log.warn("Invalid schedule: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_SCHEDULE", ex.getMessage()));
    }

    @ExceptionHandler({InvalidRecordException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleInvalidInput(RuntimeException ex) {
        log.warn("Invalid input: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_INPUT", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex) {
        log.warn("Operation not available: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("INVALID_STATE", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        log.warn("Validation failed: {}", errors);
        return ResponseEntity.badRequest().body(ErrorResponse.of("VALIDATION_ERROR", "Validation failed", errors));
    }

    @ExceptionHandler(EnrollmentStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(EnrollmentStoreException ex) {
        log.error("Storage failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("STORAGE_ERROR", "The change was applied but could not be saved"));
    }
}
