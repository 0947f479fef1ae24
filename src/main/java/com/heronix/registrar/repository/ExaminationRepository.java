package com.heronix.registrar.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.registrar.model.domain.Examination;

/**
 * Repository for Examination entity.
 */
@Repository
public interface ExaminationRepository extends JpaRepository<Examination, Long> {

    /**
     * All attempts of a student, by semester then subject.
     */
    List<Examination> findByStudentIdOrderBySemesterAscSubjectNameAsc(String studentId);

    /**
     * Attempts of a student in one semester.
     */
    List<Examination> findByStudentIdAndSemesterOrderBySubjectNameAsc(String studentId, Integer semester);

    /**
     * Attempts of a class.
     */
    List<Examination> findByCourseIdAndSemesterAndAcademicYear(Long courseId, Integer semester, String academicYear);

    /**
     * Attempts of a class in one subject.
     */
    List<Examination> findByCourseIdAndSemesterAndAcademicYearAndSubjectCode(
            Long courseId, Integer semester, String academicYear, String subjectCode);

    /**
     * Attempts whose result has not been declared yet.
     */
    List<Examination> findByResultDeclaredDateIsNullOrderByExamDateAsc();

    long countByResultDeclaredDateIsNull();
}
