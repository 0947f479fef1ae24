package com.heronix.registrar.exception;

/**
 * Exception thrown when a student roll number does not resolve.
 */
public class StudentNotFoundException extends RuntimeException {

    public StudentNotFoundException(String rollNo) {
        super("Student not found: " + rollNo);
    }
}
