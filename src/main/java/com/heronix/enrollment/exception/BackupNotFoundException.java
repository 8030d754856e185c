package com.heronix.enrollment.exception;

/**
 * Exception thrown when a named snapshot backup does not exist.
 */
public class BackupNotFoundException extends RuntimeException {

    public BackupNotFoundException(String backupName) {
        super("Backup not found: " + backupName);
    }
}
