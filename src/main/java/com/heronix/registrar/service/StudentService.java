package com.heronix.registrar.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.registrar.exception.StudentNotFoundException;
import com.heronix.registrar.model.GradeCalculator;
import com.heronix.registrar.model.OperationResult;
import com.heronix.registrar.model.domain.Course;
import com.heronix.registrar.model.domain.Student;
import com.heronix.registrar.model.dto.AcademicProgressDTO;
import com.heronix.registrar.repository.StudentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Student roll numbers and semester progression.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudentService {

    private final StudentRepository studentRepository;
    private final CourseService courseService;

    @Transactional(readOnly = true)
    public Student getStudent(String rollNo) {
        return studentRepository.findByRollNoAndActiveTrue(rollNo)
                .orElseThrow(() -> new StudentNotFoundException(rollNo));
    }

    /**
     * Next roll number for a course and admission year: YEAR + COURSE_CODE + 4-digit serial,
     * e.g. 2025CS0001. The serial starts after the students already counted for the
     * course and year and skips numbers that are taken.
     */
    @Transactional(readOnly = true)
    public String generateRollNumber(Course course, int admissionYear) {
        long serial = studentRepository.countByCourseIdAndAdmissionYear(course.getId(), admissionYear) + 1;

        String rollNo = formatRollNumber(admissionYear, course.getCourseCode(), serial);
        while (studentRepository.existsById(rollNo)) {
            log.debug("Roll number {} already taken, trying next serial", rollNo);
            rollNo = formatRollNumber(admissionYear, course.getCourseCode(), ++serial);
        }
        return rollNo;
    }

    private String formatRollNumber(int admissionYear, String courseCode, long serial) {
        return String.format("%d%s%04d", admissionYear, courseCode, serial);
    }

    /**
     * Move a student to the next semester unless already in the final one.
     */
    @Transactional
    public OperationResult promoteSemester(String rollNo) {
        Student student = getStudent(rollNo);
        Course course = courseService.getCourse(student.getCourseId());

        if (student.isInFinalSemester(course.getTotalSemesters())) {
            log.warn("Student {} is already in final semester {}", rollNo, student.getCurrentSemester());
            return OperationResult.failure("Student already in final semester");
        }

        student.setCurrentSemester(student.getCurrentSemester() + 1);
        studentRepository.save(student);

        log.info("Promoted student {} to semester {}", rollNo, student.getCurrentSemester());
        return OperationResult.ok("Promoted to semester " + student.getCurrentSemester());
    }

    @Transactional(readOnly = true)
    public AcademicProgressDTO getAcademicProgress(String rollNo) {
        Student student = getStudent(rollNo);
        Course course = courseService.getCourse(student.getCourseId());

        int totalSemesters = course.getTotalSemesters();
        int current = student.getCurrentSemester();

        return AcademicProgressDTO.builder()
                .rollNo(rollNo)
                .currentSemester(current)
                .totalSemesters(totalSemesters)
                .progressPercentage(GradeCalculator.round2((double) current / totalSemesters * 100.0))
                .yearsCompleted((current - 1) / 2)
                .finalYear(current >= totalSemesters - 1)
                .build();
    }
}
