package com.heronix.registrar.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.registrar.config.RegistrarProperties;
import com.heronix.registrar.exception.ExaminationNotFoundException;
import com.heronix.registrar.model.OperationResult;
import com.heronix.registrar.model.domain.Examination;
import com.heronix.registrar.model.dto.ExamScheduleRequestDTO;
import com.heronix.registrar.model.dto.ResultDeclarationDTO;
import com.heronix.registrar.model.enums.ExamType;
import com.heronix.registrar.repository.ExaminationRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Examination scheduling and the result lifecycle.
 *
 * Each method is one unit of work: load, apply the workflow step on the
 * entity, save only if the step succeeded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExaminationService {

    private final ExaminationRepository examinationRepository;
    private final RegistrarProperties properties;
    private final Clock clock;

    /**
     * Create a pending examination record (no marks yet).
     */
    @Transactional
    public Examination scheduleExamination(ExamScheduleRequestDTO request) {
        Examination exam = Examination.builder()
                .studentId(request.getStudentId())
                .courseId(request.getCourseId())
                .examType(request.getExamType() != null ? request.getExamType() : ExamType.SEMESTER)
                .subjectName(request.getSubjectName())
                .subjectCode(request.getSubjectCode())
                .semester(request.getSemester())
                .academicYear(request.getAcademicYear())
                .examDate(request.getExamDate())
                .maxMarks(request.getMaxMarks() != null
                        ? request.getMaxMarks()
                        : properties.getExamination().getDefaultMaxMarks())
                .build();

        exam = examinationRepository.save(exam);
        log.info("Scheduled {} exam {} for student {} (semester {}, {})",
                exam.getExamType(), exam.getSubjectCode(), exam.getStudentId(),
                exam.getSemester(), exam.getAcademicYear());
        return exam;
    }

    @Transactional(readOnly = true)
    public Examination getExamination(Long examinationId) {
        return examinationRepository.findById(examinationId)
                .orElseThrow(() -> new ExaminationNotFoundException(examinationId));
    }

    /**
     * Declare the result of an examination. Repeated declarations overwrite.
     */
    @Transactional
    public OperationResult declareResult(Long examinationId, ResultDeclarationDTO declaration) {
        Examination exam = getExamination(examinationId);

        OperationResult result = exam.declareResult(
                declaration.getMarksObtained(),
                declaration.getInternalMarks(),
                declaration.getExternalMarks(),
                declaration.isAbsent(),
                declaration.isMalpractice(),
                declaration.getRemarks(),
                declaration.getStaffId(),
                LocalDateTime.now(clock));

        if (!result.success()) {
            log.warn("Rejected result declaration for examination {}: {}", examinationId, result.message());
            return result;
        }

        examinationRepository.save(exam);
        log.info("Declared result for examination {} (student {}, {}): grade {}",
                examinationId, exam.getStudentId(), exam.getSubjectCode(), exam.getGrade().getLabel());
        return result;
    }

    /**
     * Amend a declared result. Undeclared examinations are left untouched.
     */
    @Transactional
    public OperationResult updateResult(Long examinationId, Integer marksObtained, String remarks, Long staffId) {
        Examination exam = getExamination(examinationId);

        OperationResult result = exam.updateResult(marksObtained, remarks, staffId, LocalDateTime.now(clock));

        if (!result.success()) {
            log.warn("Rejected result update for examination {}: {}", examinationId, result.message());
            return result;
        }

        examinationRepository.save(exam);
        log.info("Updated result for examination {}: grade {}", examinationId, exam.getGrade().getLabel());
        return result;
    }

    /**
     * Results of a student ordered by semester and subject; a null semester means all.
     */
    @Transactional(readOnly = true)
    public List<Examination> getStudentResults(String studentId, Integer semester) {
        if (semester != null) {
            return examinationRepository.findByStudentIdAndSemesterOrderBySubjectNameAsc(studentId, semester);
        }
        return examinationRepository.findByStudentIdOrderBySemesterAscSubjectNameAsc(studentId);
    }

    @Transactional(readOnly = true)
    public List<Examination> getSemesterResults(Long courseId, Integer semester, String academicYear) {
        return examinationRepository.findByCourseIdAndSemesterAndAcademicYear(courseId, semester, academicYear);
    }

    @Transactional(readOnly = true)
    public List<Examination> getPendingResults() {
        return examinationRepository.findByResultDeclaredDateIsNullOrderByExamDateAsc();
    }
}
