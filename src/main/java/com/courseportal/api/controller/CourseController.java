package com.courseportal.api.controller;

import com.courseportal.api.dto.CreateCourseRequest;
import com.courseportal.catalog.Course;
import com.courseportal.catalog.CourseService;
import com.courseportal.telemetry.PortalTelemetry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the course catalog.
 */
@RestController
@RequestMapping("/api/v1/courses")
@RequiredArgsConstructor
@Tag(name = "Courses", description = "Course catalog API")
public class CourseController {

    static final String CATALOG_ROUTE = "GET /api/v1/courses";
    static final String DETAILS_ROUTE = "GET /api/v1/courses/{code}";
    static final String ADD_ROUTE = "POST /api/v1/courses";

    private final CourseService courseService;
    private final PortalTelemetry telemetry;

    @GetMapping
    @Operation(summary = "List all courses in the catalog")
    public ResponseEntity<List<Course>> listCourses(HttpServletRequest request) {
        List<Course> courses = telemetry.instrument("view_catalog", CATALOG_ROUTE, request, span -> {
            List<Course> catalog = courseService.listCourses();
            span.setAttribute("view_catalog.count", catalog.size());
            span.addEvent("Rendering Course Catalog");
            return catalog;
        });
        return ResponseEntity.ok(courses);
    }

    @GetMapping("/{code}")
    @Operation(summary = "Get course details by code")
    public ResponseEntity<Course> getCourse(@PathVariable String code, HttpServletRequest request) {
        Course course = telemetry.instrument("view_course_details", DETAILS_ROUTE, request, span -> {
            span.setAttribute("course_code", code);
            Course found = courseService.getCourse(code);
            span.addEvent("Displaying details for course: " + code);
            return found;
        });
        return ResponseEntity.ok(course);
    }

    @PostMapping
    @Operation(summary = "Submit a new course")
    public ResponseEntity<Course> addCourse(@RequestBody CreateCourseRequest body, HttpServletRequest request) {
        Course course = telemetry.instrument("add_course", ADD_ROUTE, request, span -> {
            Course added = courseService.addCourse(body);
            span.setAttribute("course.code", added.getCode());
            span.setAttribute("course.name", added.getName());
            span.setAttribute("course.instructor", added.getInstructor());
            span.setAttribute("course.semester", added.getSemester());
            span.addEvent("Course " + added.getName() + " added successfully.");
            return added;
        });
        return ResponseEntity.status(HttpStatus.CREATED).body(course);
    }
}
