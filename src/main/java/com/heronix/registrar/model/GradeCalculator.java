package com.heronix.registrar.model;

import com.heronix.registrar.model.enums.Grade;

/**
 * Maps an examination attempt to its grade, grade points and pass flag.
 *
 * Absence wins over malpractice, which wins over the score. Passing needs
 * 40% of max marks.
 */
public final class GradeCalculator {

    /**
     * Fraction of max marks needed to pass.
     */
    public static final double PASS_FRACTION = 0.4;

    private GradeCalculator() {
    }

    /**
     * Grade, grade points and pass flag for one attempt.
     */
    public record GradeOutcome(Grade grade, double gradePoints, boolean passed) {
    }

    /**
     * Calculate the outcome of an attempt.
     *
     * @param marksObtained marks scored; ignored when absent or malpractice
     * @param maxMarks      maximum marks of the paper
     * @param absent        candidate did not appear
     * @param malpractice   attempt was voided for malpractice
     * @return the outcome, never null
     */
    public static GradeOutcome calculate(int marksObtained, int maxMarks, boolean absent, boolean malpractice) {
        if (absent) {
            return new GradeOutcome(Grade.AB, Grade.AB.getGradePoints(), false);
        }
        if (malpractice) {
            return new GradeOutcome(Grade.MP, Grade.MP.getGradePoints(), false);
        }

        Grade grade = Grade.forPercentage(percentage(marksObtained, maxMarks));
        return new GradeOutcome(grade, grade.getGradePoints(), isPass(marksObtained, maxMarks));
    }

    /**
     * Raw percentage; 0 when max marks is not positive.
     */
    public static double percentage(int marksObtained, int maxMarks) {
        if (maxMarks <= 0) {
            return 0.0;
        }
        return (double) marksObtained / maxMarks * 100.0;
    }

    public static boolean isPass(int marksObtained, int maxMarks) {
        return marksObtained >= maxMarks * PASS_FRACTION;
    }

    /**
     * Round half-up to two decimals.
     */
    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
