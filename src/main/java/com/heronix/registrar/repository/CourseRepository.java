package com.heronix.registrar.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.registrar.model.domain.Course;

/**
 * Repository for Course entity.
 */
@Repository
public interface CourseRepository extends JpaRepository<Course, Long> {

    List<Course> findByActiveTrueOrderByCourseNameAsc();

    Optional<Course> findByCourseCodeAndActiveTrue(String courseCode);
}
