package com.heronix.registrar.model.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.heronix.registrar.model.domain.AdmissionApplication;
import com.heronix.registrar.model.enums.ApplicationStatus;
import com.heronix.registrar.model.enums.GeneratedBy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serializable view of an admission application. Never carries the password hash.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdmissionApplicationDTO {

    private Long id;
    private String applicationId;
    private String name;
    private String email;
    private String phone;
    private LocalDate dateOfBirth;
    private String gender;
    private String address;
    private String city;
    private String state;
    private String pincode;
    private String fatherName;
    private String motherName;
    private String guardianPhone;
    private String guardianEmail;
    private Long courseId;
    private String courseName;
    private Integer tenthPercentage;
    private Integer twelfthPercentage;
    private Integer entranceExamScore;
    private ApplicationStatus status;
    private GeneratedBy generatedBy;
    private Long staffId;
    private String studentId;
    private String remarks;
    private String rejectionReason;
    private LocalDateTime processedOn;
    private Map<String, Boolean> documentsVerified;
    private List<String> documentsRequired;
    private LocalDateTime applicationDate;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private LocalDateTime updatedOn;

    /**
     * Create from entity.
     *
     * @param includeSensitive also copy the modification time
     */
    public static AdmissionApplicationDTO fromEntity(AdmissionApplication app, boolean includeSensitive) {
        return AdmissionApplicationDTO.builder()
                .id(app.getId())
                .applicationId(app.getApplicationId())
                .name(app.getName())
                .email(app.getEmail())
                .phone(app.getPhone())
                .dateOfBirth(app.getDateOfBirth())
                .gender(app.getGender() != null ? app.getGender().getDisplayName() : null)
                .address(app.getAddress())
                .city(app.getCity())
                .state(app.getState())
                .pincode(app.getPincode())
                .fatherName(app.getFatherName())
                .motherName(app.getMotherName())
                .guardianPhone(app.getGuardianPhone())
                .guardianEmail(app.getGuardianEmail())
                .courseId(app.getCourseId())
                .courseName(app.getCourse() != null ? app.getCourse().getCourseName() : null)
                .tenthPercentage(app.getTenthPercentage())
                .twelfthPercentage(app.getTwelfthPercentage())
                .entranceExamScore(app.getEntranceExamScore())
                .status(app.getStatus())
                .generatedBy(app.getGeneratedBy())
                .staffId(app.getStaffId())
                .studentId(app.getStudentId())
                .remarks(app.getRemarks())
                .rejectionReason(app.getRejectionReason())
                .processedOn(app.getProcessedOn())
                .documentsVerified(new LinkedHashMap<>(app.getDocumentsVerified()))
                .documentsRequired(new ArrayList<>(app.getDocumentsRequired()))
                .applicationDate(app.getApplicationDate())
                .updatedOn(includeSensitive ? app.getUpdatedOn() : null)
                .build();
    }
}
