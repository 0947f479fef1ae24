package com.heronix.registrar.model.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.security.crypto.password.PasswordEncoder;

import com.heronix.registrar.model.OperationResult;
import com.heronix.registrar.model.enums.ApplicationStatus;
import com.heronix.registrar.model.enums.Gender;
import com.heronix.registrar.model.enums.GeneratedBy;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Admission application for a course.
 *
 * Application IDs have the form ADM + year + 6-digit serial (ADM2025000001)
 * and are assigned by {@code AdmissionService}. Status moves through
 * {@link ApplicationStatus}; {@code staffId} and {@code processedOn} are only
 * stamped by a staff decision, and {@code studentId} is set only once the
 * application is approved.
 *
 * @author Heronix Development Team
 */
@Entity
@Table(name = "admission_applications", indexes = {
    @Index(name = "idx_adm_application_id", columnList = "application_id", unique = true),
    @Index(name = "idx_adm_email", columnList = "email"),
    @Index(name = "idx_adm_course", columnList = "course_id"),
    @Index(name = "idx_adm_status", columnList = "status"),
    @Index(name = "idx_adm_date", columnList = "application_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdmissionApplication {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "application_id", nullable = false, unique = true, length = 20)
    private String applicationId;

    // ------------------------------------------------------------------
    // Applicant
    // ------------------------------------------------------------------

    @NotBlank
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @NotBlank
    @Email
    @Column(name = "email", nullable = false, length = 120)
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

    @Column(name = "guardian_name", length = 100)
    private String guardianName;

    @Column(name = "guardian_phone", length = 15)
    private String guardianPhone;

    @Column(name = "guardian_email", length = 120)
    private String guardianEmail;

    @Column(name = "emergency_contact", length = 15)
    private String emergencyContact;

    @Column(name = "medical_conditions", length = 1000)
    private String medicalConditions;

    @Column(name = "previous_education", length = 1000)
    private String previousEducation;

    // ------------------------------------------------------------------
    // Academics
    // ------------------------------------------------------------------

    @NotNull
    @Column(name = "course_id", nullable = false)
    private Long courseId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Course course;

    @Min(0)
    @Max(100)
    @Column(name = "tenth_percentage")
    private Integer tenthPercentage;

    @Min(0)
    @Max(100)
    @Column(name = "twelfth_percentage")
    private Integer twelfthPercentage;

    @Column(name = "entrance_exam_score")
    private Integer entranceExamScore;

    // ------------------------------------------------------------------
    // Tracking and processing
    // ------------------------------------------------------------------

    /**
     * Hash of the password the applicant uses to track the application.
     */
    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private ApplicationStatus status = ApplicationStatus.SUBMITTED;

    @Enumerated(EnumType.STRING)
    @Column(name = "generated_by", nullable = false, length = 10)
    @Builder.Default
    private GeneratedBy generatedBy = GeneratedBy.STUDENT;

    /**
     * Staff member who made the last decision.
     */
    @Column(name = "staff_id")
    private Long staffId;

    /**
     * Roll number of the student created on approval.
     */
    @Column(name = "student_id", length = 20)
    private String studentId;

    @Column(name = "remarks", length = 2000)
    private String remarks;

    @Column(name = "rejection_reason", length = 2000)
    private String rejectionReason;

    @Column(name = "processed_on")
    private LocalDateTime processedOn;

    @Convert(converter = DocumentChecklistConverter.class)
    @Column(name = "documents_verified", length = 4000)
    @Builder.Default
    private Map<String, Boolean> documentsVerified = new LinkedHashMap<>();

    @Convert(converter = DocumentListConverter.class)
    @Column(name = "documents_required", length = 4000)
    @Builder.Default
    private List<String> documentsRequired = new ArrayList<>();

    @Column(name = "application_date", nullable = false, updatable = false)
    private LocalDateTime applicationDate;

    @Column(name = "updated_on", nullable = false)
    private LocalDateTime updatedOn;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (this.applicationDate == null) {
            this.applicationDate = now;
        }
        if (this.updatedOn == null) {
            this.updatedOn = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        if (this.updatedOn == null) {
            this.updatedOn = LocalDateTime.now();
        }
    }

    // ========================================================================
    // CREDENTIALS
    // ========================================================================

    public void setPassword(String rawPassword, PasswordEncoder encoder) {
        this.passwordHash = encoder.encode(rawPassword);
    }

    /**
     * @throws IllegalStateException if no tracking password was set
     */
    public boolean checkPassword(String rawPassword, PasswordEncoder encoder) {
        if (passwordHash == null) {
            throw new IllegalStateException("No password set for application " + applicationId);
        }
        return encoder.matches(rawPassword, passwordHash);
    }

    /**
     * Temporary password handed to the student created from this application:
     * the prefix followed by the last four characters of the application ID.
     */
    public String temporaryPassword(String prefix) {
        String suffix = applicationId.length() > 4
                ? applicationId.substring(applicationId.length() - 4)
                : applicationId;
        return prefix + suffix;
    }

    // ========================================================================
    // WORKFLOW
    // ========================================================================

    /**
     * Initialize the document checklist for a freshly submitted application.
     */
    public OperationResult submitApplication(List<String> defaultDocuments) {
        if (status != ApplicationStatus.SUBMITTED || !getDocumentsRequired().isEmpty()) {
            return OperationResult.failure("Application already submitted");
        }
        resetChecklist(defaultDocuments);
        return OperationResult.ok("Application submitted successfully");
    }

    /**
     * Open the application for review. Not a decision: staff and processing
     * stamps are left alone.
     */
    public OperationResult startReview(LocalDateTime now) {
        if (!status.canStartReview()) {
            return OperationResult.failure("Application cannot be reviewed in status " + status);
        }
        this.status = ApplicationStatus.UNDER_REVIEW;
        this.updatedOn = now;
        return OperationResult.ok("Application moved to review");
    }

    /**
     * Approve the application. The caller creates the student record and
     * then calls {@link #assignStudent(String)}.
     *
     * @param seatsAvailable whether the course still has a free seat
     */
    public OperationResult approve(Long staffId, String remarks, boolean seatsAvailable, LocalDateTime now) {
        if (!status.isAwaitingDecision()) {
            return OperationResult.failure("Application is not in pending status");
        }
        if (!seatsAvailable) {
            return OperationResult.failure("No available seats in the selected course");
        }
        this.status = ApplicationStatus.APPROVED;
        this.staffId = staffId;
        this.remarks = remarks;
        this.processedOn = now;
        this.updatedOn = now;
        return OperationResult.ok("Application approved");
    }

    public OperationResult decline(Long staffId, String reason, LocalDateTime now) {
        if (!status.isAwaitingDecision()) {
            return OperationResult.failure("Application is not in pending status");
        }
        this.status = ApplicationStatus.DECLINED;
        this.staffId = staffId;
        this.rejectionReason = reason;
        this.processedOn = now;
        this.updatedOn = now;
        return OperationResult.ok("Application declined successfully");
    }

    public OperationResult waitlist(Long staffId, String remarks, LocalDateTime now) {
        if (!status.isPending()) {
            return OperationResult.failure("Application is not in pending status");
        }
        this.status = ApplicationStatus.WAITLISTED;
        this.staffId = staffId;
        this.remarks = remarks;
        this.processedOn = now;
        this.updatedOn = now;
        return OperationResult.ok("Application waitlisted");
    }

    /**
     * Ask the applicant for documents. Replaces the checklist, every item unverified.
     * Refused once approved, since the application is linked to a student.
     */
    public OperationResult requestDocuments(Long staffId, List<String> documents, String remarks, LocalDateTime now) {
        if (status == ApplicationStatus.APPROVED) {
            return OperationResult.failure("Application already approved");
        }
        this.status = ApplicationStatus.DOCUMENTS_PENDING;
        this.staffId = staffId;
        this.remarks = remarks;
        this.processedOn = now;
        this.updatedOn = now;
        resetChecklist(documents);
        return OperationResult.ok("Document verification request sent");
    }

    public OperationResult verifyDocument(String document) {
        Map<String, Boolean> checklist = getDocumentsVerified();
        if (!checklist.containsKey(document)) {
            return OperationResult.failure("Document not required for this application: " + document);
        }
        checklist.put(document, Boolean.TRUE);
        this.documentsVerified = checklist;
        return OperationResult.ok("Document verified: " + document);
    }

    public boolean allDocumentsVerified() {
        Map<String, Boolean> checklist = getDocumentsVerified();
        return !checklist.isEmpty() && checklist.values().stream().allMatch(Boolean.TRUE::equals);
    }

    /**
     * Manual status override. Approval has to go through {@link #approve},
     * and an approved application keeps its status and student link.
     */
    public OperationResult updateStatus(ApplicationStatus newStatus, String remarks, Long processedBy,
            LocalDateTime now) {
        if (newStatus == ApplicationStatus.APPROVED) {
            return OperationResult.failure("Applications can only be approved through the approval workflow");
        }
        if (status == ApplicationStatus.APPROVED) {
            return OperationResult.failure("Application already approved");
        }
        ApplicationStatus previous = status;
        this.status = newStatus;
        this.remarks = remarks;
        this.processedOn = now;
        this.updatedOn = now;
        if (processedBy != null) {
            this.staffId = processedBy;
        }
        return OperationResult.ok("Status changed from " + previous + " to " + newStatus);
    }

    /**
     * Link the student created from this application.
     *
     * @throws IllegalStateException if the application is not approved
     */
    public void assignStudent(String rollNo) {
        if (status != ApplicationStatus.APPROVED) {
            throw new IllegalStateException("Cannot link a student to application " + applicationId
                    + " in status " + status);
        }
        this.studentId = rollNo;
    }

    // ========================================================================
    // ELIGIBILITY
    // ========================================================================

    /**
     * Completed years of age on the application date.
     */
    public int getAgeAtApplication() {
        LocalDate appDate = applicationDate != null ? applicationDate.toLocalDate() : LocalDate.now();
        return Period.between(dateOfBirth, appDate).getYears();
    }

    /**
     * Basic eligibility: age within [minimumAge, maximumAge] and, where
     * recorded, at least {@code minimumPercentage} in 10th and 12th.
     */
    public OperationResult isEligible(int minimumAge, int maximumAge, int minimumPercentage) {
        int age = getAgeAtApplication();
        if (age < minimumAge || age > maximumAge) {
            return OperationResult.failure(
                    "Age not within eligible range (" + minimumAge + "-" + maximumAge + " years)");
        }
        if (tenthPercentage != null && tenthPercentage < minimumPercentage) {
            return OperationResult.failure("Minimum " + minimumPercentage + "% required in 10th standard");
        }
        if (twelfthPercentage != null && twelfthPercentage < minimumPercentage) {
            return OperationResult.failure("Minimum " + minimumPercentage + "% required in 12th standard");
        }
        return OperationResult.ok("Eligible for admission");
    }

    // ========================================================================
    // CHECKLIST ACCESS
    // ========================================================================

    public Map<String, Boolean> getDocumentsVerified() {
        if (documentsVerified == null) {
            documentsVerified = new LinkedHashMap<>();
        }
        return documentsVerified;
    }

    public List<String> getDocumentsRequired() {
        if (documentsRequired == null) {
            documentsRequired = new ArrayList<>();
        }
        return documentsRequired;
    }

    private void resetChecklist(List<String> documents) {
        List<String> required = documents != null ? new ArrayList<>(documents) : new ArrayList<>();
        Map<String, Boolean> checklist = new LinkedHashMap<>();
        for (String document : required) {
            checklist.put(document, Boolean.FALSE);
        }
        this.documentsRequired = required;
        this.documentsVerified = checklist;
    }
}
