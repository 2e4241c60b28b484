package com.courseportal.catalog;

import com.courseportal.api.dto.CreateCourseRequest;
import com.courseportal.common.exception.CourseNotFoundException;
import com.courseportal.common.exception.CourseValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service for browsing and submitting catalog courses.
 */
@Service
@Slf4j
public class CourseService {

    private final CourseCatalogRepository catalogRepository;
    private final Validator validator;
    private final String defaultPrerequisites;

    public CourseService(
            CourseCatalogRepository catalogRepository,
            Validator validator,
            @Value("${course-portal.catalog.default-prerequisites:}") String defaultPrerequisites) {
        this.catalogRepository = catalogRepository;
        this.validator = validator;
        this.defaultPrerequisites = defaultPrerequisites;
    }

    public List<Course> listCourses() {
        return catalogRepository.load();
    }

    /**
     * Find a course by code. If several courses share the code, the one added first wins.
     */
    public Course getCourse(String code) {
        return catalogRepository.load().stream()
            .filter(course -> code.equals(course.getCode()))
            .findFirst()
            .orElseThrow(() -> new CourseNotFoundException(code));
    }

    /**
     * Validate a submission and append it to the catalog.
     *
     * @return the course as stored
     * @throws CourseValidationException if a required field is missing or empty
     */
    public Course addCourse(CreateCourseRequest request) {
        validate(request);

        Course course = Course.builder()
            .code(request.getCode())
            .name(request.getName())
            .instructor(request.getInstructor())
            .semester(request.getSemester())
            .schedule(request.getSchedule())
            .classroom(request.getClassroom())
            .prerequisites(request.getPrerequisites() != null
                ? request.getPrerequisites() : defaultPrerequisites)
            .grading(request.getGrading())
            .description(request.getDescription() != null ? request.getDescription() : "")
            .build();

        catalogRepository.append(course);

        log.info("New course added: {}, Instructor: {}, Semester: {}",
            course.getName(), course.getInstructor(), course.getSemester());

        return course;
    }

    private void validate(CreateCourseRequest request) {
        Set<ConstraintViolation<CreateCourseRequest>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return;
        }

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (ConstraintViolation<CreateCourseRequest> violation : violations) {
            fieldErrors.put(violation.getPropertyPath().toString(), violation.getMessage());
        }
        log.error("Course creation failed. Missing fields: {}", fieldErrors.keySet());
        throw new CourseValidationException(fieldErrors);
    }
}
