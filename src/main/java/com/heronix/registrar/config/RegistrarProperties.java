package com.heronix.registrar.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for Heronix Registrar.
 */
@Data
@ConfigurationProperties(prefix = "heronix.registrar")
public class RegistrarProperties {

    /**
     * Admission workflow configuration
     */
    private AdmissionConfig admission = new AdmissionConfig();

    /**
     * Examination configuration
     */
    private ExaminationConfig examination = new ExaminationConfig();

    @Data
    public static class AdmissionConfig {
        /**
         * Prefix of generated application IDs (ADM2025000001)
         */
        private String idPrefix = "ADM";

        /**
         * Youngest eligible age at the application date
         */
        private int minimumAge = 17;

        /**
         * Oldest eligible age at the application date
         */
        private int maximumAge = 25;

        /**
         * Minimum 10th/12th percentage
         */
        private int minimumPercentage = 60;

        /**
         * Prefix of the temporary password given to newly admitted students
         */
        private String temporaryPasswordPrefix = "temp";

        /**
         * Checklist created when an application is submitted
         */
        private List<String> defaultDocuments = new ArrayList<>(List.of(
                "10th Mark Sheet",
                "12th Mark Sheet",
                "Transfer Certificate",
                "Aadhar Card",
                "Passport Photo",
                "Caste Certificate (if applicable)"));
    }

    @Data
    public static class ExaminationConfig {
        /**
         * Max marks used when an exam is scheduled without one
         */
        private int defaultMaxMarks = 100;
    }
}
