package com.heronix.registrar.exception;

/**
 * Exception thrown when a course does not exist.
 */
public class CourseNotFoundException extends RuntimeException {

    public CourseNotFoundException(Long courseId) {
        super("Course not found: " + courseId);
    }

    public CourseNotFoundException(String courseCode) {
        super("Course not found: " + courseCode);
    }
}
