package com.heronix.registrar.model.enums;

/**
 * Kinds of examination an attempt can belong to.
 */
public enum ExamType {
    INTERNAL,
    SEMESTER,
    FINAL,
    SUPPLEMENTARY
}
