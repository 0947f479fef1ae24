package com.heronix.registrar.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Letter grades awarded for an examination attempt.
 *
 * Percentage bands are lower-bound inclusive:
 * O 90-100, A+ 80-89, A 70-79, B+ 60-69, B 55-59, C 50-54, P 40-49, F below 40.
 * AB and MP are status grades and never contribute to SGPA/CGPA.
 */
@Getter
@RequiredArgsConstructor
public enum Grade {

    /**
     * Outstanding
     */
    O("O", 10.0),

    /**
     * Excellent
     */
    A_PLUS("A+", 9.0),

    /**
     * Very good
     */
    A("A", 8.0),

    /**
     * Good
     */
    B_PLUS("B+", 7.0),

    /**
     * Above average
     */
    B("B", 6.0),

    /**
     * Average
     */
    C("C", 5.0),

    /**
     * Pass
     */
    P("P", 4.0),

    /**
     * Fail
     */
    F("F", 0.0),

    /**
     * Absent
     */
    AB("AB", 0.0),

    /**
     * Malpractice
     */
    MP("MP", 0.0);

    /**
     * Label printed on mark sheets
     */
    private final String label;

    /**
     * Grade points on the 10-point scale
     */
    private final double gradePoints;

    /**
     * Map a percentage to its band grade.
     *
     * @param percentage score as a percentage of max marks
     * @return the band grade, never AB or MP
     */
    public static Grade forPercentage(double percentage) {
        if (percentage >= 90) {
            return O;
        } else if (percentage >= 80) {
            return A_PLUS;
        } else if (percentage >= 70) {
            return A;
        } else if (percentage >= 60) {
            return B_PLUS;
        } else if (percentage >= 55) {
            return B;
        } else if (percentage >= 50) {
            return C;
        } else if (percentage >= 40) {
            return P;
        }
        return F;
    }

    /**
     * Whether this grade counts towards SGPA/CGPA.
     */
    public boolean countsTowardsGpa() {
        return switch (this) {
            case AB, MP -> false;
            case O, A_PLUS, A, B_PLUS, B, C, P, F -> true;
        };
    }

    /**
     * Resolve a grade from its mark-sheet label (e.g. "A+").
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Grade fromLabel(String label) {
        for (Grade grade : values()) {
            if (grade.label.equalsIgnoreCase(label)) {
                return grade;
            }
        }
        throw new IllegalArgumentException("Unknown grade label: " + label);
    }
}
