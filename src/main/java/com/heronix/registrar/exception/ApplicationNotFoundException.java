package com.heronix.registrar.exception;

/**
 * Exception thrown when an admission application does not exist.
 */
public class ApplicationNotFoundException extends RuntimeException {

    public ApplicationNotFoundException(String applicationId) {
        super("Admission application not found: " + applicationId);
    }

    public ApplicationNotFoundException(Long id) {
        super("Admission application not found: id=" + id);
    }
}
