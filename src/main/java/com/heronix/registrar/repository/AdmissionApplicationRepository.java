package com.heronix.registrar.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import com.heronix.registrar.model.domain.AdmissionApplication;
import com.heronix.registrar.model.enums.ApplicationStatus;

/**
 * Repository for AdmissionApplication entity.
 */
@Repository
public interface AdmissionApplicationRepository extends JpaRepository<AdmissionApplication, Long> {

    Optional<AdmissionApplication> findByApplicationId(String applicationId);

    boolean existsByApplicationId(String applicationId);

    List<AdmissionApplication> findByStatusOrderByApplicationDateAsc(ApplicationStatus status);

    List<AdmissionApplication> findByStatusInOrderByApplicationDateAsc(Collection<ApplicationStatus> statuses);

    List<AdmissionApplication> findByCourseIdOrderByApplicationDateAsc(Long courseId);

    /**
     * Applications filed in [from, to), used for the yearly serial.
     */
    long countByApplicationDateGreaterThanEqualAndApplicationDateLessThan(LocalDateTime from, LocalDateTime to);

    long countByStatusIn(Collection<ApplicationStatus> statuses);

    /**
     * Count applications by status.
     */
    @Query("SELECT a.status, COUNT(a) FROM AdmissionApplication a GROUP BY a.status")
    List<Object[]> countApplicationsByStatus();
}
