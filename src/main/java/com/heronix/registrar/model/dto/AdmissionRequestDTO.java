package com.heronix.registrar.model.dto;

import java.time.LocalDate;

import com.heronix.registrar.model.enums.Gender;
import com.heronix.registrar.model.enums.GeneratedBy;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Intake form for a new admission application.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdmissionRequestDTO {

    @NotBlank
    @Size(max = 100)
    private String name;

    @NotBlank
    @Email
    private String email;

    @NotBlank
    @Size(max = 15)
    private String phone;

    @NotNull
    private LocalDate dateOfBirth;

    @NotNull
    private Gender gender;

    private String address;
    private String city;
    private String state;
    private String pincode;
    private String fatherName;
    private String motherName;
    private String guardianName;
    private String guardianPhone;
    private String guardianEmail;
    private String emergencyContact;
    private String medicalConditions;
    private String previousEducation;

    @NotNull
    private Long courseId;

    @Min(0)
    @Max(100)
    private Integer tenthPercentage;

    @Min(0)
    @Max(100)
    private Integer twelfthPercentage;

    private Integer entranceExamScore;

    /**
     * Password the applicant uses to track the application.
     */
    @NotBlank
    @Size(min = 6)
    @ToString.Exclude
    private String password;

    private GeneratedBy generatedBy;
}
