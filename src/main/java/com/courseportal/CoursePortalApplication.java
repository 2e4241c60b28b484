package com.courseportal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Course Portal.
 *
 * Course Portal lists and accepts university course listings, stored in a single
 * JSON catalog file, with OpenTelemetry tracing and metrics around each route.
 */
@SpringBootApplication
public class CoursePortalApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoursePortalApplication.class, args);
    }
}
