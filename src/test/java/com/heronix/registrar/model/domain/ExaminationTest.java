package com.heronix.registrar.model.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.heronix.registrar.model.OperationResult;
import com.heronix.registrar.model.enums.Grade;

class ExaminationTest {

    private static final LocalDateTime DECLARED_AT = LocalDateTime.of(2025, 12, 10, 9, 0);
    private static final LocalDateTime AMENDED_AT = LocalDateTime.of(2025, 12, 20, 9, 0);

    private Examination exam;

    @BeforeEach
    void setUp() {
        exam = Examination.builder()
                .id(1L)
                .studentId("2025CS0001")
                .courseId(7L)
                .subjectName("Data Structures")
                .subjectCode("CS201")
                .semester(3)
                .academicYear("2025-26")
                .examDate(LocalDateTime.of(2025, 11, 28, 10, 0))
                .maxMarks(100)
                .build();
    }

    @Nested
    @DisplayName("declareResult")
    class Declare {

        @Test
        @DisplayName("75/100 is an A worth 8.0 and a pass")
        void regularScore() {
            OperationResult result = exam.declareResult(75, 25, null, false, false, "ok", 11L, DECLARED_AT);

            assertThat(result.success()).isTrue();
            assertThat(result.message()).contains("Grade: A");
            assertThat(exam.getGrade()).isEqualTo(Grade.A);
            assertThat(exam.getGradePoints()).isEqualTo(8.0);
            assertThat(exam.getPassed()).isTrue();
            assertThat(exam.getInternalMarks()).isEqualTo(25);
            assertThat(exam.getExternalMarks()).isEqualTo(50);
            assertThat(exam.getResultProcessedBy()).isEqualTo(11L);
            assertThat(exam.getResultDeclaredDate()).isEqualTo(DECLARED_AT);
        }

        @Test
        @DisplayName("explicit external marks are kept as given")
        void explicitExternal() {
            exam.declareResult(70, 20, 50, false, false, null, 11L, DECLARED_AT);

            assertThat(exam.getExternalMarks()).isEqualTo(50);
        }

        @Test
        @DisplayName("absent candidates get zero marks, AB and a fail whatever was supplied")
        void absent() {
            exam.declareResult(88, 20, 68, true, false, null, 11L, DECLARED_AT);

            assertThat(exam.getMarksObtained()).isZero();
            assertThat(exam.getGrade()).isEqualTo(Grade.AB);
            assertThat(exam.getGradePoints()).isZero();
            assertThat(exam.getPassed()).isFalse();
            assertThat(exam.isAbsent()).isTrue();
        }

        @Test
        @DisplayName("absent candidates need no marks at all")
        void absentWithoutMarks() {
            OperationResult result = exam.declareResult(null, null, null, true, false, null, 11L, DECLARED_AT);

            assertThat(result.success()).isTrue();
            assertThat(exam.getMarksObtained()).isZero();
        }

        @Test
        @DisplayName("malpractice gets zero marks and MP")
        void malpractice() {
            exam.declareResult(92, null, null, false, true, "copying", 11L, DECLARED_AT);

            assertThat(exam.getMarksObtained()).isZero();
            assertThat(exam.getGrade()).isEqualTo(Grade.MP);
            assertThat(exam.getPassed()).isFalse();
        }

        @Test
        @DisplayName("declaring again overwrites the earlier declaration")
        void redeclare() {
            exam.declareResult(30, null, null, false, false, null, 11L, DECLARED_AT);
            exam.declareResult(91, null, null, false, false, null, 12L, AMENDED_AT);

            assertThat(exam.getGrade()).isEqualTo(Grade.O);
            assertThat(exam.getPassed()).isTrue();
            assertThat(exam.getResultProcessedBy()).isEqualTo(12L);
            assertThat(exam.getResultDeclaredDate()).isEqualTo(AMENDED_AT);
        }

        @Test
        @DisplayName("missing or out-of-range marks are rejected without changes")
        void invalidMarks() {
            assertThat(exam.declareResult(null, null, null, false, false, null, 11L, DECLARED_AT).success())
                    .isFalse();
            assertThat(exam.declareResult(101, null, null, false, false, null, 11L, DECLARED_AT).success())
                    .isFalse();
            assertThat(exam.declareResult(-1, null, null, false, false, null, 11L, DECLARED_AT).success())
                    .isFalse();

            assertThat(exam.getMarksObtained()).isNull();
            assertThat(exam.getGrade()).isNull();
            assertThat(exam.isResultDeclared()).isFalse();
        }
    }

    @Nested
    @DisplayName("updateResult")
    class Update {

        @Test
        @DisplayName("an undeclared result cannot be updated and stays untouched")
        void undeclared() {
            exam.setRemarks("scheduled");

            OperationResult result = exam.updateResult(80, "late entry", 11L, AMENDED_AT);

            assertThat(result.success()).isFalse();
            assertThat(result.message()).isEqualTo("Result not yet declared");
            assertThat(exam.getMarksObtained()).isNull();
            assertThat(exam.getGrade()).isNull();
            assertThat(exam.getGradePoints()).isNull();
            assertThat(exam.getPassed()).isNull();
            assertThat(exam.getRemarks()).isEqualTo("scheduled");
            assertThat(exam.getResultProcessedBy()).isNull();
            assertThat(exam.getUpdatedOn()).isNull();
        }

        @Test
        @DisplayName("recomputes grade and pass flag from the new marks")
        void recompute() {
            exam.declareResult(75, null, null, false, false, null, 11L, DECLARED_AT);

            OperationResult result = exam.updateResult(35, "re-evaluated", 12L, AMENDED_AT);

            assertThat(result.success()).isTrue();
            assertThat(exam.getMarksObtained()).isEqualTo(35);
            assertThat(exam.getGrade()).isEqualTo(Grade.F);
            assertThat(exam.getPassed()).isFalse();
            assertThat(exam.getUpdatedOn()).isEqualTo(AMENDED_AT);
            assertThat(exam.getResultDeclaredDate()).isEqualTo(DECLARED_AT);
        }

        @Test
        @DisplayName("an absent attempt stays a zero-mark fail")
        void absentStaysAbsent() {
            exam.declareResult(null, null, null, true, false, null, 11L, DECLARED_AT);

            exam.updateResult(90, null, 12L, AMENDED_AT);

            assertThat(exam.getMarksObtained()).isZero();
            assertThat(exam.getGrade()).isEqualTo(Grade.AB);
            assertThat(exam.getPassed()).isFalse();
        }
    }

    @Nested
    @DisplayName("getPercentage")
    class Percentage {

        @Test
        void undeclaredIsZero() {
            assertThat(exam.getPercentage()).isZero();
        }

        @Test
        void zeroMaxMarksIsZero() {
            exam.setMarksObtained(10);
            exam.setMaxMarks(0);

            assertThat(exam.getPercentage()).isZero();
        }

        @Test
        void roundedToTwoDecimals() {
            exam.setMaxMarks(30);
            exam.declareResult(20, null, null, false, false, null, 11L, DECLARED_AT);

            assertThat(exam.getPercentage()).isEqualTo(66.67);
        }
    }

    @Test
    @DisplayName("grade and grade points exist exactly when a result is declared")
    void gradeOnlyWhenDeclared() {
        assertThat(exam.getGrade()).isNull();
        assertThat(exam.getGradePoints()).isNull();

        exam.declareResult(55, null, null, false, false, null, 11L, DECLARED_AT);

        assertThat(exam.isResultDeclared()).isTrue();
        assertThat(exam.getGrade()).isEqualTo(Grade.B);
        assertThat(exam.getGradePoints()).isEqualTo(6.0);
    }
}
