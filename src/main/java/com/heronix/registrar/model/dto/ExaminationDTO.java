package com.heronix.registrar.model.dto;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.heronix.registrar.model.domain.Examination;
import com.heronix.registrar.model.enums.ExamType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serializable view of an examination record.
 *
 * Audit fields are only filled when requested and are left out of the JSON otherwise.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExaminationDTO {

    private Long id;
    private String studentId;

    /**
     * Resolved through the student relation, null when not loaded.
     */
    private String studentName;

    private Long courseId;

    /**
     * Resolved through the course relation, null when not loaded.
     */
    private String courseName;

    private ExamType examType;
    private String subjectName;
    private String subjectCode;
    private Integer semester;
    private String academicYear;
    private LocalDateTime examDate;
    private LocalDateTime resultDeclaredDate;
    private Integer maxMarks;
    private Integer marksObtained;
    private Integer internalMarks;
    private Integer externalMarks;

    /**
     * Mark-sheet label (e.g. "A+"), null while pending.
     */
    private String grade;

    private Double gradePoints;
    private Boolean passed;
    private boolean absent;
    private boolean malpractice;
    private String remarks;
    private LocalDateTime createdOn;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Long resultProcessedBy;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private LocalDateTime updatedOn;

    /**
     * Create from entity.
     *
     * @param includeSensitive also copy the processing staff ID and modification time
     */
    public static ExaminationDTO fromEntity(Examination exam, boolean includeSensitive) {
        ExaminationDTOBuilder builder = ExaminationDTO.builder()
                .id(exam.getId())
                .studentId(exam.getStudentId())
                .studentName(exam.getStudent() != null ? exam.getStudent().getName() : null)
                .courseId(exam.getCourseId())
                .courseName(exam.getCourse() != null ? exam.getCourse().getCourseName() : null)
                .examType(exam.getExamType())
                .subjectName(exam.getSubjectName())
                .subjectCode(exam.getSubjectCode())
                .semester(exam.getSemester())
                .academicYear(exam.getAcademicYear())
                .examDate(exam.getExamDate())
                .resultDeclaredDate(exam.getResultDeclaredDate())
                .maxMarks(exam.getMaxMarks())
                .marksObtained(exam.getMarksObtained())
                .internalMarks(exam.getInternalMarks())
                .externalMarks(exam.getExternalMarks())
                .grade(exam.getGrade() != null ? exam.getGrade().getLabel() : null)
                .gradePoints(exam.getGradePoints())
                .passed(exam.getPassed())
                .absent(exam.isAbsent())
                .malpractice(exam.isMalpractice())
                .remarks(exam.getRemarks())
                .createdOn(exam.getCreatedOn());

        if (includeSensitive) {
            builder.resultProcessedBy(exam.getResultProcessedBy())
                    .updatedOn(exam.getUpdatedOn());
        }
        return builder.build();
    }
}
