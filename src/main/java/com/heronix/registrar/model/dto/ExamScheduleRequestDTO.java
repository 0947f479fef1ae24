package com.heronix.registrar.model.dto;

import java.time.LocalDateTime;

import com.heronix.registrar.model.enums.ExamType;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to schedule an examination attempt for a student.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExamScheduleRequestDTO {

    @NotBlank
    private String studentId;

    @NotNull
    private Long courseId;

    private ExamType examType;

    @NotBlank
    private String subjectName;

    @NotBlank
    private String subjectCode;

    @NotNull
    @Min(1)
    private Integer semester;

    @NotBlank
    private String academicYear;

    @NotNull
    private LocalDateTime examDate;

    /**
     * Falls back to the configured default when null.
     */
    @Min(1)
    private Integer maxMarks;
}
