package com.heronix.registrar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.registrar.config.RegistrarProperties;

/**
 * Heronix Registrar - admission and examination records.
 *
 * Handles the admission application workflow (submission, review, approval
 * into a student record) and examination results (declaration, grading,
 * SGPA/CGPA and class performance reporting).
 */
@SpringBootApplication
@EnableConfigurationProperties(RegistrarProperties.class)
public class RegistrarApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegistrarApplication.class, args);
    }
}
