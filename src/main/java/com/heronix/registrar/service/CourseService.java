package com.heronix.registrar.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.registrar.exception.CourseNotFoundException;
import com.heronix.registrar.model.domain.Course;
import com.heronix.registrar.repository.CourseRepository;
import com.heronix.registrar.repository.StudentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Course lookups and seat availability.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class CourseService {

    private final CourseRepository courseRepository;
    private final StudentRepository studentRepository;

    public Course getCourse(Long courseId) {
        return courseRepository.findById(courseId)
                .orElseThrow(() -> new CourseNotFoundException(courseId));
    }

    public Course getByCode(String courseCode) {
        return courseRepository.findByCourseCodeAndActiveTrue(courseCode)
                .orElseThrow(() -> new CourseNotFoundException(courseCode));
    }

    public List<Course> getActiveCourses() {
        return courseRepository.findByActiveTrueOrderByCourseNameAsc();
    }

    public long getEnrollmentCount(Long courseId) {
        return studentRepository.countByCourseId(courseId);
    }

    /**
     * Total seats minus enrolled students. Can go negative if seats were reduced.
     */
    public long getAvailableSeats(Long courseId) {
        Course course = getCourse(courseId);
        long available = course.getTotalSeats() - getEnrollmentCount(courseId);
        log.debug("Course {} has {} available seats", course.getCourseCode(), available);
        return available;
    }

    public boolean hasAvailableSeats(Long courseId) {
        return getAvailableSeats(courseId) > 0;
    }

    public boolean isAcceptingApplications(Long courseId) {
        Course course = getCourse(courseId);
        return Boolean.TRUE.equals(course.getActive()) && hasAvailableSeats(courseId);
    }
}
