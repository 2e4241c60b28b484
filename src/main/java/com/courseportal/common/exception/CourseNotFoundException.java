package com.courseportal.common.exception;

/**
 * Thrown when no course in the catalog has the requested code.
 */
public class CourseNotFoundException extends CoursePortalException {

    private final String code;

    public CourseNotFoundException(String code) {
        super(String.format("No course found with code '%s'.", code));
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String getErrorCode() {
        return "course_not_found";
    }
}
