package com.courseportal.common.exception;

import java.nio.file.Path;

/**
 * Thrown when the backing catalog file cannot be read or written.
 */
public class CatalogStorageException extends CoursePortalException {

    private final Path catalogFile;
    private final String operation;

    public CatalogStorageException(String message, Path catalogFile, String operation, Throwable cause) {
        super(message, cause);
        this.catalogFile = catalogFile;
        this.operation = operation;
    }

    public Path getCatalogFile() {
        return catalogFile;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String getErrorCode() {
        return "catalog_storage";
    }
}
