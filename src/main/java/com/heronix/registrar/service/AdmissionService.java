package com.heronix.registrar.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.registrar.config.RegistrarProperties;
import com.heronix.registrar.exception.ApplicationNotFoundException;
import com.heronix.registrar.model.GradeCalculator;
import com.heronix.registrar.model.OperationResult;
import com.heronix.registrar.model.domain.AdmissionApplication;
import com.heronix.registrar.model.dto.AdmissionRequestDTO;
import com.heronix.registrar.model.dto.AdmissionStatsDTO;
import com.heronix.registrar.model.enums.ApplicationStatus;
import com.heronix.registrar.model.enums.GeneratedBy;
import com.heronix.registrar.model.event.ApplicationApprovedEvent;
import com.heronix.registrar.repository.AdmissionApplicationRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Admission application intake and the staff decision workflow.
 *
 * Approval publishes an {@link ApplicationApprovedEvent}; the student record
 * is created by {@link StudentEnrollmentListener} in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdmissionService {

    private static final Set<ApplicationStatus> PENDING_STATUSES = ApplicationStatus.pendingStatuses();

    private final AdmissionApplicationRepository applicationRepository;
    private final CourseService courseService;
    private final ApplicationEventPublisher eventPublisher;
    private final PasswordEncoder passwordEncoder;
    private final RegistrarProperties properties;
    private final Clock clock;

    // ========================================================================
    // INTAKE
    // ========================================================================

    /**
     * File a new application and initialize its document checklist.
     */
    @Transactional
    public AdmissionApplication createApplication(AdmissionRequestDTO request) {
        LocalDateTime now = LocalDateTime.now(clock);

        AdmissionApplication application = AdmissionApplication.builder()
                .applicationId(generateApplicationId(now))
                .name(request.getName())
                .email(request.getEmail())
                .phone(request.getPhone())
                .dateOfBirth(request.getDateOfBirth())
                .gender(request.getGender())
                .address(request.getAddress())
                .city(request.getCity())
                .state(request.getState())
                .pincode(request.getPincode())
                .fatherName(request.getFatherName())
                .motherName(request.getMotherName())
                .guardianName(request.getGuardianName())
                .guardianPhone(request.getGuardianPhone())
                .guardianEmail(request.getGuardianEmail())
                .emergencyContact(request.getEmergencyContact())
                .medicalConditions(request.getMedicalConditions())
                .previousEducation(request.getPreviousEducation())
                .courseId(request.getCourseId())
                .tenthPercentage(request.getTenthPercentage())
                .twelfthPercentage(request.getTwelfthPercentage())
                .entranceExamScore(request.getEntranceExamScore())
                .generatedBy(request.getGeneratedBy() != null ? request.getGeneratedBy() : GeneratedBy.STUDENT)
                .status(ApplicationStatus.SUBMITTED)
                .applicationDate(now)
                .updatedOn(now)
                .build();
        application.setPassword(request.getPassword(), passwordEncoder);
        application.submitApplication(properties.getAdmission().getDefaultDocuments());

        application = applicationRepository.save(application);
        log.info("Received application {} from {} for course {}",
                application.getApplicationId(), application.getEmail(), application.getCourseId());
        return application;
    }

    /**
     * Next application ID for the year of {@code now}: prefix + year + 6-digit serial,
     * the serial being one more than the applications already filed that year.
     */
    String generateApplicationId(LocalDateTime now) {
        int year = now.getYear();
        LocalDateTime from = LocalDateTime.of(year, 1, 1, 0, 0);
        long serial = applicationRepository
                .countByApplicationDateGreaterThanEqualAndApplicationDateLessThan(from, from.plusYears(1)) + 1;

        String applicationId = formatApplicationId(year, serial);
        while (applicationRepository.existsByApplicationId(applicationId)) {
            log.debug("Application ID {} already taken, trying next serial", applicationId);
            applicationId = formatApplicationId(year, ++serial);
        }
        return applicationId;
    }

    private String formatApplicationId(int year, long serial) {
        return String.format("%s%d%06d", properties.getAdmission().getIdPrefix(), year, serial);
    }

    @Transactional
    public OperationResult submitApplication(String applicationId) {
        AdmissionApplication application = getByApplicationId(applicationId);
        OperationResult result = application.submitApplication(properties.getAdmission().getDefaultDocuments());
        if (result.success()) {
            applicationRepository.save(application);
        }
        return result;
    }

    // ========================================================================
    // DECISIONS
    // ========================================================================

    @Transactional
    public OperationResult startReview(String applicationId, Long staffId) {
        AdmissionApplication application = getByApplicationId(applicationId);
        OperationResult result = application.startReview(LocalDateTime.now(clock));
        return saveIfSuccessful(application, result, "review by staff " + staffId);
    }

    /**
     * Approve an application and enroll the applicant.
     *
     * Fails without side effects when the application already has a decision
     * or the course has no free seat.
     */
    @Transactional
    public OperationResult approveApplication(String applicationId, Long staffId, String remarks) {
        AdmissionApplication application = getByApplicationId(applicationId);

        boolean seatsAvailable = application.getStatus().isAwaitingDecision()
                && courseService.hasAvailableSeats(application.getCourseId());

        OperationResult result = application.approve(staffId, remarks, seatsAvailable, LocalDateTime.now(clock));
        if (!result.success()) {
            log.warn("Approval of application {} rejected: {}", applicationId, result.message());
            return result;
        }

        String temporaryPassword = application.temporaryPassword(
                properties.getAdmission().getTemporaryPasswordPrefix());
        eventPublisher.publishEvent(new ApplicationApprovedEvent(application, temporaryPassword));

        applicationRepository.save(application);
        log.info("Approved application {} by staff {}, student {}",
                applicationId, staffId, application.getStudentId());

        return OperationResult.ok("Application approved. Student roll number: " + application.getStudentId()
                + ", Temporary password: " + temporaryPassword);
    }

    @Transactional
    public OperationResult declineApplication(String applicationId, Long staffId, String reason) {
        AdmissionApplication application = getByApplicationId(applicationId);
        OperationResult result = application.decline(staffId, reason, LocalDateTime.now(clock));
        return saveIfSuccessful(application, result, "decline");
    }

    @Transactional
    public OperationResult waitlistApplication(String applicationId, Long staffId, String remarks) {
        AdmissionApplication application = getByApplicationId(applicationId);
        OperationResult result = application.waitlist(staffId, remarks, LocalDateTime.now(clock));
        return saveIfSuccessful(application, result, "waitlist");
    }

    @Transactional
    public OperationResult requestDocuments(String applicationId, Long staffId, List<String> documents,
            String remarks) {
        AdmissionApplication application = getByApplicationId(applicationId);
        OperationResult result = application.requestDocuments(staffId, documents, remarks, LocalDateTime.now(clock));
        return saveIfSuccessful(application, result, "document request");
    }

    @Transactional
    public OperationResult verifyDocument(String applicationId, String document) {
        AdmissionApplication application = getByApplicationId(applicationId);
        OperationResult result = application.verifyDocument(document);
        return saveIfSuccessful(application, result, "document verification");
    }

    /**
     * Manual status override by staff. Refused for APPROVED, which needs
     * {@link #approveApplication}, and for applications already approved.
     */
    @Transactional
    public OperationResult updateStatus(String applicationId, ApplicationStatus status, String remarks,
            Long staffId) {
        AdmissionApplication application = getByApplicationId(applicationId);
        OperationResult result = application.updateStatus(status, remarks, staffId, LocalDateTime.now(clock));
        return saveIfSuccessful(application, result, "status override by staff " + staffId);
    }

    @Transactional(readOnly = true)
    public OperationResult checkEligibility(String applicationId) {
        AdmissionApplication application = getByApplicationId(applicationId);
        RegistrarProperties.AdmissionConfig admission = properties.getAdmission();
        return application.isEligible(
                admission.getMinimumAge(), admission.getMaximumAge(), admission.getMinimumPercentage());
    }

    private OperationResult saveIfSuccessful(AdmissionApplication application, OperationResult result,
            String action) {
        if (result.success()) {
            applicationRepository.save(application);
            log.info("Application {} {}: {}", application.getApplicationId(), action, result.message());
        } else {
            log.warn("Application {} {} rejected: {}", application.getApplicationId(), action, result.message());
        }
        return result;
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Transactional(readOnly = true)
    public AdmissionApplication getByApplicationId(String applicationId) {
        return applicationRepository.findByApplicationId(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }

    @Transactional(readOnly = true)
    public List<AdmissionApplication> getByStatus(ApplicationStatus status) {
        return applicationRepository.findByStatusOrderByApplicationDateAsc(status);
    }

    @Transactional(readOnly = true)
    public List<AdmissionApplication> getByCourse(Long courseId) {
        return applicationRepository.findByCourseIdOrderByApplicationDateAsc(courseId);
    }

    /**
     * Applications still waiting on staff (submitted or under review).
     */
    @Transactional(readOnly = true)
    public List<AdmissionApplication> getPendingApplications() {
        return applicationRepository.findByStatusInOrderByApplicationDateAsc(PENDING_STATUSES);
    }

    @Transactional(readOnly = true)
    public long countPendingApplications() {
        return applicationRepository.countByStatusIn(PENDING_STATUSES);
    }

    /**
     * Per-status counts and the approval conversion rate.
     */
    @Transactional(readOnly = true)
    public AdmissionStatsDTO getStatistics() {
        Map<ApplicationStatus, Long> counts = new EnumMap<>(ApplicationStatus.class);
        for (ApplicationStatus status : ApplicationStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : applicationRepository.countApplicationsByStatus()) {
            counts.put((ApplicationStatus) row[0], (Long) row[1]);
        }

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        long approved = counts.get(ApplicationStatus.APPROVED);
        double conversionRate = total > 0 ? GradeCalculator.round2((double) approved / total * 100.0) : 0.0;

        return AdmissionStatsDTO.builder()
                .countsByStatus(counts)
                .totalApplications(total)
                .conversionRate(conversionRate)
                .build();
    }
}
