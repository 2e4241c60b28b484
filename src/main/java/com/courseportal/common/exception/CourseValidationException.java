package com.courseportal.common.exception;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Thrown when a course submission is missing one or more required fields.
 * Nothing is persisted when this is raised.
 */
public class CourseValidationException extends CoursePortalException {

    private final Map<String, String> fieldErrors;

    public CourseValidationException(Map<String, String> fieldErrors) {
        super("All fields are required!");
        this.fieldErrors = Collections.unmodifiableMap(new TreeMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    @Override
    public String getErrorCode() {
        return "missing_fields";
    }
}
