package com.heronix.registrar.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.registrar.model.GradeCalculator;
import com.heronix.registrar.model.domain.Examination;
import com.heronix.registrar.model.dto.ClassPerformanceDTO;
import com.heronix.registrar.repository.ExaminationRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-side reports over examination results: SGPA, CGPA and class performance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ResultReportingService {

    private final ExaminationRepository examinationRepository;

    /**
     * Semester grade point average of a student.
     *
     * @return mean grade points over graded results of the semester, 0.0 if none
     */
    public double calculateSgpa(String studentId, Integer semester) {
        List<Examination> results =
                examinationRepository.findByStudentIdAndSemesterOrderBySubjectNameAsc(studentId, semester);
        double sgpa = averageGradePoints(results);
        log.debug("SGPA for student {} semester {}: {}", studentId, semester, sgpa);
        return sgpa;
    }

    /**
     * Cumulative grade point average of a student across all semesters.
     */
    public double calculateCgpa(String studentId) {
        List<Examination> results = examinationRepository.findByStudentIdOrderBySemesterAscSubjectNameAsc(studentId);
        double cgpa = averageGradePoints(results);
        log.debug("CGPA for student {}: {}", studentId, cgpa);
        return cgpa;
    }

    /**
     * Mean grade points, two decimals. Undeclared, absent and malpractice
     * results are left out; no qualifying result gives 0.0.
     */
    static double averageGradePoints(List<Examination> results) {
        List<Examination> graded = results.stream()
                .filter(r -> r.getGrade() != null && r.getGrade().countsTowardsGpa())
                .collect(Collectors.toList());

        if (graded.isEmpty()) {
            return 0.0;
        }

        double total = graded.stream()
                .mapToDouble(r -> r.getGradePoints() != null ? r.getGradePoints() : 0.0)
                .sum();
        return GradeCalculator.round2(total / graded.size());
    }

    /**
     * Class statistics for a course, semester and academic year, optionally one subject.
     */
    public ClassPerformanceDTO getClassPerformance(Long courseId, Integer semester, String academicYear,
            String subjectCode) {
        List<Examination> results = subjectCode != null
                ? examinationRepository.findByCourseIdAndSemesterAndAcademicYearAndSubjectCode(
                        courseId, semester, academicYear, subjectCode)
                : examinationRepository.findByCourseIdAndSemesterAndAcademicYear(courseId, semester, academicYear);

        ClassPerformanceDTO.ClassPerformanceDTOBuilder stats = ClassPerformanceDTO.builder()
                .courseId(courseId)
                .semester(semester)
                .academicYear(academicYear)
                .subjectCode(subjectCode)
                .totalStudents(results.size());

        if (results.isEmpty()) {
            return stats.build();
        }

        List<Examination> appeared = results.stream()
                .filter(r -> !r.isAbsent() && !r.isMalpractice() && r.getMarksObtained() != null)
                .collect(Collectors.toList());

        stats.appearedStudents(appeared.size())
                .absentStudents((int) results.stream().filter(Examination::isAbsent).count())
                .malpracticeCases((int) results.stream().filter(Examination::isMalpractice).count());

        if (appeared.isEmpty()) {
            return stats.build();
        }

        int passed = (int) appeared.stream().filter(r -> Boolean.TRUE.equals(r.getPassed())).count();
        int failed = appeared.size() - passed;

        int highest = appeared.stream().mapToInt(Examination::getMarksObtained).max().orElse(0);
        int lowest = appeared.stream().mapToInt(Examination::getMarksObtained).min().orElse(0);
        double average = appeared.stream().mapToInt(Examination::getMarksObtained).average().orElse(0.0);

        boolean uniformMaxMarks = appeared.stream().map(Examination::getMaxMarks).distinct().count() == 1;
        double classAverage;
        if (uniformMaxMarks) {
            int maxMarks = appeared.get(0).getMaxMarks();
            classAverage = maxMarks > 0 ? average / maxMarks * 100.0 : 0.0;
        } else {
            log.warn("Mixed max marks in class {} semester {} {} {}; averaging individual percentages",
                    courseId, semester, academicYear, subjectCode != null ? subjectCode : "(all subjects)");
            classAverage = appeared.stream()
                    .mapToDouble(r -> GradeCalculator.percentage(r.getMarksObtained(), r.getMaxMarks()))
                    .average()
                    .orElse(0.0);
        }

        return stats.passedStudents(passed)
                .failedStudents(failed)
                .passPercentage(GradeCalculator.round2((double) passed / appeared.size() * 100.0))
                .highestMarks(highest)
                .lowestMarks(lowest)
                .averageMarks(GradeCalculator.round2(average))
                .classAveragePercentage(GradeCalculator.round2(classAverage))
                .uniformMaxMarks(uniformMaxMarks)
                .build();
    }
}
