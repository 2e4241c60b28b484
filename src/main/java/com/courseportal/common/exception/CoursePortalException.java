package com.courseportal.common.exception;

/**
 * Base exception for all course portal exceptions.
 */
public class CoursePortalException extends RuntimeException {

    public CoursePortalException(String message) {
        super(message);
    }

    public CoursePortalException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable code, recorded on the {@code exceptions} counter.
     */
    public String getErrorCode() {
        return "internal_error";
    }
}
