package com.heronix.registrar.model.domain;

import java.time.LocalDateTime;

import com.heronix.registrar.model.GradeCalculator;
import com.heronix.registrar.model.GradeCalculator.GradeOutcome;
import com.heronix.registrar.model.OperationResult;
import com.heronix.registrar.model.enums.ExamType;
import com.heronix.registrar.model.enums.Grade;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One examination attempt of a student in a subject.
 *
 * Created when the exam is scheduled (no marks). {@link #declareResult} sets
 * marks, grade and pass flag together; {@link #updateResult} amends a
 * declared result. Grade and grade points are non-null exactly when
 * {@code resultDeclaredDate} is set.
 *
 * Workflow methods only mutate this record; the calling service persists it.
 */
@Entity
@Table(name = "examinations", indexes = {
    @Index(name = "idx_exam_student", columnList = "student_id"),
    @Index(name = "idx_exam_course", columnList = "course_id"),
    @Index(name = "idx_exam_class", columnList = "course_id, semester, academic_year"),
    @Index(name = "idx_exam_declared", columnList = "result_declared_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Examination {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Roll number of the student.
     */
    @NotBlank
    @Column(name = "student_id", nullable = false, length = 20)
    private String studentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "student_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Student student;

    @NotNull
    @Column(name = "course_id", nullable = false)
    private Long courseId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Course course;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "exam_type", nullable = false, length = 15)
    @Builder.Default
    private ExamType examType = ExamType.SEMESTER;

    @NotBlank
    @Column(name = "subject_name", nullable = false, length = 100)
    private String subjectName;

    @NotBlank
    @Column(name = "subject_code", nullable = false, length = 20)
    private String subjectCode;

    @NotNull
    @Min(1)
    @Column(name = "semester", nullable = false)
    private Integer semester;

    /**
     * Academic year, e.g. "2025-26".
     */
    @NotBlank
    @Pattern(regexp = "\\d{4}-\\d{2}")
    @Column(name = "academic_year", nullable = false, length = 10)
    private String academicYear;

    @NotNull
    @Column(name = "exam_date", nullable = false)
    private LocalDateTime examDate;

    @Column(name = "result_declared_date")
    private LocalDateTime resultDeclaredDate;

    @NotNull
    @Min(0)
    @Column(name = "max_marks", nullable = false)
    @Builder.Default
    private Integer maxMarks = 100;

    /**
     * Null until the result is declared.
     */
    @Column(name = "marks_obtained")
    private Integer marksObtained;

    @Enumerated(EnumType.STRING)
    @Column(name = "grade", length = 10)
    private Grade grade;

    @Column(name = "grade_points")
    private Double gradePoints;

    @Column(name = "internal_marks", nullable = false)
    @Builder.Default
    private Integer internalMarks = 0;

    @Column(name = "external_marks", nullable = false)
    @Builder.Default
    private Integer externalMarks = 0;

    /**
     * Null until declared, then pass or fail.
     */
    @Column(name = "is_pass")
    private Boolean passed;

    @Column(name = "is_absent", nullable = false)
    private boolean absent;

    @Column(name = "has_malpractice", nullable = false)
    private boolean malpractice;

    @Column(name = "remarks", length = 2000)
    private String remarks;

    /**
     * Staff member who last processed the result.
     */
    @Column(name = "result_processed_by")
    private Long resultProcessedBy;

    @Column(name = "created_on", nullable = false, updatable = false)
    private LocalDateTime createdOn;

    @Column(name = "updated_on", nullable = false)
    private LocalDateTime updatedOn;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (this.createdOn == null) {
            this.createdOn = now;
        }
        if (this.updatedOn == null) {
            this.updatedOn = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        if (this.updatedOn == null) {
            this.updatedOn = LocalDateTime.now();
        }
    }

    /**
     * Declare the result of this attempt.
     *
     * Absent or malpractice attempts are recorded with zero marks and a fail,
     * whatever marks were supplied. Calling again overwrites the declaration.
     *
     * @param marksObtained total marks; required unless absent or malpractice
     * @param internalMarks internal assessment share, defaults to 0
     * @param externalMarks external share, defaults to marks minus internal
     * @param absent        candidate did not appear
     * @param malpractice   attempt voided for malpractice
     * @param remarks       free text
     * @param staffId       staff member declaring the result
     * @param declaredAt    declaration timestamp
     */
    public OperationResult declareResult(Integer marksObtained, Integer internalMarks, Integer externalMarks,
            boolean absent, boolean malpractice, String remarks, Long staffId, LocalDateTime declaredAt) {
        boolean voided = absent || malpractice;
        if (!voided) {
            String problem = validateMarks(marksObtained);
            if (problem != null) {
                return OperationResult.failure(problem);
            }
        }

        if (voided) {
            this.marksObtained = 0;
            this.internalMarks = 0;
            this.externalMarks = 0;
        } else {
            int internal = internalMarks != null ? internalMarks : 0;
            this.marksObtained = marksObtained;
            this.internalMarks = internal;
            this.externalMarks = externalMarks != null ? externalMarks : marksObtained - internal;
        }
        this.absent = absent;
        this.malpractice = malpractice;
        this.remarks = remarks;
        this.resultProcessedBy = staffId;
        this.resultDeclaredDate = declaredAt;
        this.updatedOn = declaredAt;

        applyGrade();

        return OperationResult.ok("Result declared successfully. Grade: " + grade.getLabel());
    }

    /**
     * Amend an already declared result. Fails without changes when no result was declared.
     */
    public OperationResult updateResult(Integer marksObtained, String remarks, Long staffId, LocalDateTime updatedAt) {
        if (!isResultDeclared()) {
            return OperationResult.failure("Result not yet declared");
        }
        boolean voided = absent || malpractice;
        if (!voided) {
            String problem = validateMarks(marksObtained);
            if (problem != null) {
                return OperationResult.failure(problem);
            }
        }

        this.marksObtained = voided ? 0 : marksObtained;
        this.remarks = remarks;
        this.resultProcessedBy = staffId;
        this.updatedOn = updatedAt;

        applyGrade();

        return OperationResult.ok("Result updated successfully");
    }

    public boolean isResultDeclared() {
        return resultDeclaredDate != null;
    }

    /**
     * Percentage of max marks, two decimals; 0.0 when undeclared or max marks is zero.
     */
    public double getPercentage() {
        if (marksObtained == null || maxMarks == null || maxMarks == 0) {
            return 0.0;
        }
        return GradeCalculator.round2(GradeCalculator.percentage(marksObtained, maxMarks));
    }

    private void applyGrade() {
        GradeOutcome outcome = GradeCalculator.calculate(marksObtained, maxMarks, absent, malpractice);
        this.grade = outcome.grade();
        this.gradePoints = outcome.gradePoints();
        this.passed = outcome.passed();
    }

    private String validateMarks(Integer marks) {
        if (marks == null) {
            return "Marks obtained are required unless the candidate was absent";
        }
        if (marks < 0) {
            return "Marks obtained cannot be negative";
        }
        if (marks > maxMarks) {
            return "Marks obtained cannot exceed maximum marks (" + maxMarks + ")";
        }
        return null;
    }
}
