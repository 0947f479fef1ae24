package com.heronix.registrar.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.registrar.model.domain.Student;

/**
 * Repository for Student entity, keyed by roll number.
 */
@Repository
public interface StudentRepository extends JpaRepository<Student, String> {

    long countByCourseId(Long courseId);

    long countByCourseIdAndAdmissionYear(Long courseId, Integer admissionYear);

    Optional<Student> findByRollNoAndActiveTrue(String rollNo);

    Optional<Student> findByEmail(String email);
}
