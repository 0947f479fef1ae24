package com.heronix.registrar.service;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import com.heronix.registrar.model.domain.AdmissionApplication;
import com.heronix.registrar.model.domain.Course;
import com.heronix.registrar.model.domain.Student;
import com.heronix.registrar.model.event.ApplicationApprovedEvent;
import com.heronix.registrar.repository.StudentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the student record for an approved admission application.
 *
 * Runs synchronously in the approval transaction: if the student cannot be
 * saved the approval is rolled back with it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StudentEnrollmentListener {

    private final StudentRepository studentRepository;
    private final StudentService studentService;
    private final CourseService courseService;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @EventListener
    public void onApplicationApproved(ApplicationApprovedEvent event) {
        AdmissionApplication application = event.application();
        Course course = courseService.getCourse(application.getCourseId());
        int admissionYear = LocalDate.now(clock).getYear();

        Student student = Student.builder()
                .rollNo(studentService.generateRollNumber(course, admissionYear))
                .name(application.getName())
                .email(application.getEmail())
                .phone(application.getPhone())
                .dateOfBirth(application.getDateOfBirth())
                .gender(application.getGender())
                .address(application.getAddress())
                .city(application.getCity())
                .state(application.getState())
                .pincode(application.getPincode())
                .fatherName(application.getFatherName())
                .motherName(application.getMotherName())
                .guardianPhone(application.getGuardianPhone())
                .guardianEmail(application.getGuardianEmail())
                .courseId(application.getCourseId())
                .admissionYear(admissionYear)
                .admissionApplicationId(application.getApplicationId())
                .build();
        student.setPassword(event.temporaryPassword(), passwordEncoder);

        student = studentRepository.save(student);
        application.assignStudent(student.getRollNo());

        log.info("Enrolled student {} from application {}", student.getRollNo(), application.getApplicationId());
    }
}
