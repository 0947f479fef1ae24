package com.heronix.registrar.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.registrar.repository.ExaminationRepository;
import com.heronix.registrar.service.AdmissionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot Actuator health indicator for the records store.
 *
 * Reports UP with the size of the pending work queues (undeclared results,
 * undecided applications). Reports DOWN when the store cannot be queried.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistrarHealthIndicator implements HealthIndicator {

    private final ExaminationRepository examinationRepository;
    private final AdmissionService admissionService;

    @Override
    public Health health() {
        try {
            return Health.up()
                    .withDetail("pending-results", examinationRepository.countByResultDeclaredDateIsNull())
                    .withDetail("pending-applications", admissionService.countPendingApplications())
                    .build();
        } catch (RuntimeException e) {
            log.warn("Records store health check failed: {}", e.getMessage());
            return Health.down(e).build();
        }
    }
}
