package com.heronix.registrar.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a student stands in their program.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AcademicProgressDTO {
    private String rollNo;
    private int currentSemester;
    private int totalSemesters;
    private double progressPercentage;
    private int yearsCompleted;
    private boolean finalYear;
}
