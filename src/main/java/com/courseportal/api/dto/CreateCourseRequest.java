package com.courseportal.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for submitting a new course.
 *
 * Aliases accept the short field names used by the HTML submission form (grade, des, class, pre).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCourseRequest {

    @NotEmpty(message = "Course code is required")
    private String code;

    @NotEmpty(message = "Course name is required")
    private String name;

    @NotEmpty(message = "Instructor is required")
    private String instructor;

    @NotEmpty(message = "Semester is required")
    private String semester;

    @NotEmpty(message = "Schedule is required")
    private String schedule;

    @NotEmpty(message = "Classroom is required")
    @JsonAlias("class")
    private String classroom;

    @JsonAlias("pre")
    private String prerequisites;

    @NotEmpty(message = "Grading is required")
    @JsonAlias("grade")
    private String grading;

    @JsonAlias("des")
    private String description;
}
