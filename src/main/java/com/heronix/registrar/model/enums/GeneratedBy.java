package com.heronix.registrar.model.enums;

/**
 * Who filed an admission application.
 */
public enum GeneratedBy {
    STUDENT,
    STAFF
}
