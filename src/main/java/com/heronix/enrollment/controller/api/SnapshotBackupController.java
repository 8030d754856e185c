package com.heronix.enrollment.controller.api;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.enrollment.service.EnrollmentSnapshotService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for snapshot backups.
 */
@RestController
@RequestMapping("/api/v1/backups")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Backups", description = "APIs for backing up and restoring the snapshot files")
public class SnapshotBackupController {

    private final EnrollmentSnapshotService snapshotService;

    @GetMapping
    @Operation(summary = "List backups", description = "Backup names, oldest first")
    public ResponseEntity<List<String>> listBackups() {
        return ResponseEntity.ok(snapshotService.listBackups());
    }

    @PostMapping
    @Operation(summary = "Create a backup", description = "Saves the current state and copies it into a new backup")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Backup created"),
        @ApiResponse(responseCode = "409", description = "Snapshot storage is disabled")
    })
    public ResponseEntity<Map<String, Object>> createBackup() {
        String backupName = snapshotService.createBackup();
        log.info("Backup {} created through API", backupName);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("backup", backupName));
    }

    @PostMapping("/{backupName}/restore")
    @Operation(summary = "Restore a backup", description = "Replaces the snapshot files and reloads the registries")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Backup restored"),
        @ApiResponse(responseCode = "400", description = "Invalid backup name"),
        @ApiResponse(responseCode = "404", description = "Backup not found")
    })
    public ResponseEntity<Map<String, Object>> restoreBackup(@PathVariable String backupName) {
        log.info("Restoring backup {}", backupName);
        snapshotService.restoreBackup(backupName);
        return ResponseEntity.ok(Map.of("backup", backupName, "restored", true));
    }
}
