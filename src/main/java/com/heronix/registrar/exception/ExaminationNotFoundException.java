package com.heronix.registrar.exception;

/**
 * Exception thrown when an examination record does not exist.
 */
public class ExaminationNotFoundException extends RuntimeException {

    public ExaminationNotFoundException(Long examinationId) {
        super("Examination not found: " + examinationId);
    }
}
