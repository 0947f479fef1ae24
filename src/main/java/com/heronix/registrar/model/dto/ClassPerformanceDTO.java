package com.heronix.registrar.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Class-wide result statistics for a course, semester and academic year,
 * optionally narrowed to one subject.
 *
 * When nobody appeared (all absent/malpractice, or nothing declared) only
 * the counts are filled and the mark statistics stay null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClassPerformanceDTO {

    private Long courseId;
    private Integer semester;
    private String academicYear;
    private String subjectCode;

    /**
     * All examination records matching the filter.
     */
    private int totalStudents;

    /**
     * Records with declared marks, not absent, no malpractice.
     */
    private int appearedStudents;

    private int absentStudents;
    private int malpracticeCases;
    private Integer passedStudents;
    private Integer failedStudents;
    private Double passPercentage;
    private Integer highestMarks;
    private Integer lowestMarks;
    private Double averageMarks;

    /**
     * Average as a percentage of max marks.
     */
    private Double classAveragePercentage;

    /**
     * False when the records do not share one max marks value; the class
     * average percentage is then the mean of the individual percentages.
     */
    private Boolean uniformMaxMarks;

    public boolean isEmpty() {
        return totalStudents == 0;
    }
}
