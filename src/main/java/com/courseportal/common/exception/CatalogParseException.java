package com.courseportal.common.exception;

import java.nio.file.Path;

/**
 * Thrown when the backing catalog file exists but does not hold a JSON array of courses.
 */
public class CatalogParseException extends CatalogStorageException {

    public CatalogParseException(Path catalogFile, Throwable cause) {
        super("Catalog file is not valid JSON: " + catalogFile, catalogFile, "load", cause);
    }

    @Override
    public String getErrorCode() {
        return "catalog_parse";
    }
}
