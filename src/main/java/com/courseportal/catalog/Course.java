package com.courseportal.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the course catalog.
 *
 * All fields are free text. The catalog does not enforce uniqueness of {@code code}
 * or the presence of any field; submissions are validated before they reach the store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"code", "name", "instructor", "semester", "schedule",
    "classroom", "prerequisites", "grading", "description"})
public class Course {

    /**
     * Informal key of the course, e.g. "CS101".
     */
    private String code;

    private String name;

    private String instructor;

    private String semester;

    /**
     * Meeting pattern, e.g. "MWF 10:00".
     */
    private String schedule;

    private String classroom;

    private String prerequisites;

    /**
     * Grading scheme, e.g. "Letter" or "Pass/Fail".
     */
    private String grading;

    private String description;
}
