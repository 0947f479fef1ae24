package com.heronix.registrar.model.dto;

import java.util.Map;

import com.heronix.registrar.model.enums.ApplicationStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admission statistics.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdmissionStatsDTO {

    /**
     * Number of applications in each status (every status present).
     */
    private Map<ApplicationStatus, Long> countsByStatus;

    private long totalApplications;

    /**
     * Approved applications as a percentage of all applications.
     */
    private double conversionRate;
}
