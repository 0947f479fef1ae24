package com.heronix.registrar.model.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Academic program students are admitted into (e.g. B.Tech in Computer Science).
 */
@Entity
@Table(name = "courses", indexes = {
    @Index(name = "idx_course_code", columnList = "course_code", unique = true),
    @Index(name = "idx_course_active", columnList = "is_active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Course {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Diploma, B.Tech, M.Tech, ...
     */
    @NotBlank
    @Column(name = "program_level", nullable = false, length = 50)
    private String programLevel;

    /**
     * Engineering, Computer Applications, ...
     */
    @NotBlank
    @Column(name = "degree_name", nullable = false, length = 100)
    private String degreeName;

    @NotBlank
    @Column(name = "course_name", nullable = false, length = 200)
    private String courseName;

    /**
     * Short code used in roll numbers (CS, ME, CE).
     */
    @NotBlank
    @Column(name = "course_code", nullable = false, unique = true, length = 20)
    private String courseCode;

    @Min(1)
    @Column(name = "duration_years", nullable = false)
    @Builder.Default
    private Integer durationYears = 4;

    @Column(name = "description", length = 2000)
    private String description;

    /**
     * Tuition per semester, in rupees.
     */
    @Column(name = "fees_per_semester", nullable = false)
    @Builder.Default
    private Integer feesPerSemester = 50000;

    @Min(0)
    @Column(name = "total_seats", nullable = false)
    @Builder.Default
    private Integer totalSeats = 60;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "created_on", nullable = false, updatable = false)
    private LocalDateTime createdOn;

    @Column(name = "updated_on", nullable = false)
    private LocalDateTime updatedOn;

    @PrePersist
    protected void onCreate() {
        this.createdOn = LocalDateTime.now();
        this.updatedOn = this.createdOn;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedOn = LocalDateTime.now();
    }

    /**
     * Number of semesters in the program (two per year).
     */
    public int getTotalSemesters() {
        return durationYears * 2;
    }

    /**
     * Display name, e.g. "B.Tech in Computer Science".
     */
    public String getDisplayName() {
        return programLevel + " in " + courseName;
    }
}
