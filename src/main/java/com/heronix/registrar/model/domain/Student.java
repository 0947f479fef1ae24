package com.heronix.registrar.model.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.data.domain.Persistable;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.heronix.registrar.model.enums.Gender;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Enrolled student, keyed by roll number (e.g. 2025CS0001).
 *
 * Created by the enrollment listener when an admission application is approved.
 * The roll number is assigned, so a new student reports {@link #isNew()} and
 * is inserted rather than merged: saving over an existing roll number fails.
 */
@Entity
@Table(name = "students", indexes = {
    @Index(name = "idx_student_course", columnList = "course_id"),
    @Index(name = "idx_student_email", columnList = "email", unique = true),
    @Index(name = "idx_student_course_year", columnList = "course_id, admission_year")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Student implements Persistable<String> {

    @Id
    @Column(name = "roll_no", length = 20)
    private String rollNo;

    @NotBlank
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @NotBlank
    @Email
    @Column(name = "email", nullable = false, unique = true, length = 120)
    private String email;

    @NotBlank
    @Column(name = "phone", nullable = false, length = 15)
    private String phone;

    @NotNull
    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "gender", nullable = false, length = 10)
    private Gender gender;

    @Column(name = "address", length = 500)
    private String address;

    @Column(name = "city", length = 50)
    private String city;

    @Column(name = "state", length = 50)
    private String state;

    @Column(name = "pincode", length = 10)
    private String pincode;

    @Column(name = "father_name", length = 100)
    private String fatherName;

    @Column(name = "mother_name", length = 100)
    private String motherName;

    @Column(name = "guardian_phone", length = 15)
    private String guardianPhone;

    @Column(name = "guardian_email", length = 120)
    private String guardianEmail;

    @NotNull
    @Column(name = "course_id", nullable = false)
    private Long courseId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Course course;

    @NotNull
    @Column(name = "admission_year", nullable = false)
    private Integer admissionYear;

    @Column(name = "current_semester", nullable = false)
    @Builder.Default
    private Integer currentSemester = 1;

    /**
     * Application this student was admitted through, if any.
     */
    @Column(name = "admission_application_id", length = 20)
    private String admissionApplicationId;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "registered_on", nullable = false, updatable = false)
    private LocalDateTime registeredOn;

    @Column(name = "updated_on", nullable = false)
    private LocalDateTime updatedOn;

    @Transient
    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private boolean newRecord = true;

    @PrePersist
    protected void onCreate() {
        this.registeredOn = LocalDateTime.now();
        this.updatedOn = this.registeredOn;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedOn = LocalDateTime.now();
    }

    @PostLoad
    @PostPersist
    protected void markStored() {
        this.newRecord = false;
    }

    @Override
    public String getId() {
        return rollNo;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    /**
     * Store a password. Only the hash is kept.
     */
    public void setPassword(String rawPassword, PasswordEncoder encoder) {
        this.passwordHash = encoder.encode(rawPassword);
    }

    /**
     * Check a raw password against the stored hash.
     *
     * @throws IllegalStateException if no password was ever set
     */
    public boolean checkPassword(String rawPassword, PasswordEncoder encoder) {
        if (passwordHash == null) {
            throw new IllegalStateException("No password set for student " + rollNo);
        }
        return encoder.matches(rawPassword, passwordHash);
    }

    public boolean isInFinalSemester(int totalSemesters) {
        return currentSemester >= totalSemesters;
    }
}
