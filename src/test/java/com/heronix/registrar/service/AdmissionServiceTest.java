package com.heronix.registrar.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.heronix.registrar.config.RegistrarProperties;
import com.heronix.registrar.exception.ApplicationNotFoundException;
import com.heronix.registrar.model.OperationResult;
import com.heronix.registrar.model.domain.AdmissionApplication;
import com.heronix.registrar.model.dto.AdmissionRequestDTO;
import com.heronix.registrar.model.dto.AdmissionStatsDTO;
import com.heronix.registrar.model.enums.ApplicationStatus;
import com.heronix.registrar.model.enums.Gender;
import com.heronix.registrar.model.enums.GeneratedBy;
import com.heronix.registrar.model.event.ApplicationApprovedEvent;
import com.heronix.registrar.repository.AdmissionApplicationRepository;

@ExtendWith(MockitoExtension.class)
class AdmissionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 10, 0);
    private static final String APPLICATION_ID = "ADM2025000001";

    @Mock
    private AdmissionApplicationRepository applicationRepository;

    @Mock
    private CourseService courseService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private PasswordEncoder passwordEncoder;

    private RegistrarProperties properties;
    private AdmissionService service;

    @BeforeEach
    void setUp() {
        properties = new RegistrarProperties();
        service = new AdmissionService(applicationRepository, courseService, eventPublisher, passwordEncoder,
                properties, CLOCK);
    }

    private static AdmissionApplication pendingApplication() {
        AdmissionApplication application = AdmissionApplication.builder()
                .id(1L)
                .applicationId(APPLICATION_ID)
                .name("Asha Verma")
                .email("asha@example.com")
                .phone("9876543210")
                .dateOfBirth(LocalDate.of(2007, 3, 14))
                .gender(Gender.FEMALE)
                .courseId(7L)
                .applicationDate(NOW.minusDays(3))
                .build();
        application.submitApplication(List.of("10th Mark Sheet", "Aadhar Card"));
        return application;
    }

    @Nested
    @DisplayName("intake")
    class Intake {

        @Test
        @DisplayName("first application of the year gets serial 000001")
        void firstIdOfYear() {
            when(applicationRepository.countByApplicationDateGreaterThanEqualAndApplicationDateLessThan(
                    LocalDateTime.of(2025, 1, 1, 0, 0), LocalDateTime.of(2026, 1, 1, 0, 0)))
                    .thenReturn(0L);
            when(applicationRepository.existsByApplicationId(APPLICATION_ID)).thenReturn(false);

            assertThat(service.generateApplicationId(NOW)).isEqualTo(APPLICATION_ID);
        }

        @Test
        @DisplayName("a taken ID moves on to the next serial")
        void collisionSkipsAhead() {
            when(applicationRepository.countByApplicationDateGreaterThanEqualAndApplicationDateLessThan(
                    any(LocalDateTime.class), any(LocalDateTime.class)))
                    .thenReturn(41L);
            when(applicationRepository.existsByApplicationId("ADM2025000042")).thenReturn(true);
            when(applicationRepository.existsByApplicationId("ADM2025000043")).thenReturn(false);

            assertThat(service.generateApplicationId(NOW)).isEqualTo("ADM2025000043");
        }

        @Test
        @DisplayName("creating an application hashes the password and builds the checklist")
        void create() {
            when(applicationRepository.countByApplicationDateGreaterThanEqualAndApplicationDateLessThan(
                    any(LocalDateTime.class), any(LocalDateTime.class)))
                    .thenReturn(4L);
            when(applicationRepository.existsByApplicationId(anyString())).thenReturn(false);
            when(passwordEncoder.encode("tracking-pw")).thenReturn("{hash}");
            when(applicationRepository.save(any(AdmissionApplication.class))).thenAnswer(inv -> inv.getArgument(0));

            AdmissionApplication application = service.createApplication(AdmissionRequestDTO.builder()
                    .name("Ravi Kumar")
                    .email("ravi@example.com")
                    .phone("9123456780")
                    .dateOfBirth(LocalDate.of(2006, 8, 20))
                    .gender(Gender.MALE)
                    .courseId(7L)
                    .twelfthPercentage(88)
                    .password("tracking-pw")
                    .build());

            assertThat(application.getApplicationId()).isEqualTo("ADM2025000005");
            assertThat(application.getStatus()).isEqualTo(ApplicationStatus.SUBMITTED);
            assertThat(application.getGeneratedBy()).isEqualTo(GeneratedBy.STUDENT);
            assertThat(application.getApplicationDate()).isEqualTo(NOW);
            assertThat(application.getDocumentsRequired())
                    .containsExactlyElementsOf(properties.getAdmission().getDefaultDocuments());
            assertThat(application.getDocumentsVerified()).hasSize(6);
            assertThat(application.getStaffId()).isNull();
            assertThat(application.getProcessedOn()).isNull();
        }
    }

    @Nested
    @DisplayName("approval")
    class Approval {

        @Test
        @DisplayName("no free seat: nothing is published or saved")
        void noSeats() {
            when(applicationRepository.findByApplicationId(APPLICATION_ID))
                    .thenReturn(Optional.of(pendingApplication()));
            when(courseService.hasAvailableSeats(7L)).thenReturn(false);

            OperationResult result = service.approveApplication(APPLICATION_ID, 5L, null);

            assertThat(result.success()).isFalse();
            assertThat(result.message()).isEqualTo("No available seats in the selected course");
            verifyNoInteractions(eventPublisher);
            verify(applicationRepository, never()).save(any());
        }

        @Test
        @DisplayName("an already decided application is not approved and seats are not checked")
        void alreadyDecided() {
            AdmissionApplication application = pendingApplication();
            application.decline(4L, "late", NOW);
            when(applicationRepository.findByApplicationId(APPLICATION_ID)).thenReturn(Optional.of(application));

            OperationResult result = service.approveApplication(APPLICATION_ID, 5L, null);

            assertThat(result.success()).isFalse();
            assertThat(result.message()).isEqualTo("Application is not in pending status");
            verifyNoInteractions(courseService, eventPublisher);
        }

        @Test
        @DisplayName("approval publishes the enrollment event and reports the new credentials")
        void approve() {
            AdmissionApplication application = pendingApplication();
            when(applicationRepository.findByApplicationId(APPLICATION_ID)).thenReturn(Optional.of(application));
            when(courseService.hasAvailableSeats(7L)).thenReturn(true);
            doAnswer(inv -> {
                ApplicationApprovedEvent event = inv.getArgument(0);
                event.application().assignStudent("2025CS0001");
                return null;
            }).when(eventPublisher).publishEvent(any(Object.class));

            OperationResult result = service.approveApplication(APPLICATION_ID, 5L, "merit");

            assertThat(result.success()).isTrue();
            assertThat(result.message()).isEqualTo(
                    "Application approved. Student roll number: 2025CS0001, Temporary password: temp0001");

            ArgumentCaptor<Object> published = ArgumentCaptor.forClass(Object.class);
            verify(eventPublisher).publishEvent(published.capture());
            assertThat(published.getValue()).isInstanceOfSatisfying(ApplicationApprovedEvent.class, event -> {
                assertThat(event.application()).isSameAs(application);
                assertThat(event.temporaryPassword()).isEqualTo("temp0001");
            });

            verify(applicationRepository).save(application);
            assertThat(application.getStatus()).isEqualTo(ApplicationStatus.APPROVED);
            assertThat(application.getProcessedOn()).isEqualTo(NOW);
            assertThat(application.getStaffId()).isEqualTo(5L);
        }
    }

    @Test
    @DisplayName("decline is saved with the reason")
    void decline() {
        AdmissionApplication application = pendingApplication();
        when(applicationRepository.findByApplicationId(APPLICATION_ID)).thenReturn(Optional.of(application));

        OperationResult result = service.declineApplication(APPLICATION_ID, 5L, "Cut-off not met");

        assertThat(result.success()).isTrue();
        assertThat(application.getRejectionReason()).isEqualTo("Cut-off not met");
        verify(applicationRepository).save(application);
    }

    @Test
    @DisplayName("a rejected waitlist request is not saved")
    void waitlistRejected() {
        AdmissionApplication application = pendingApplication();
        application.decline(5L, "no", NOW);
        when(applicationRepository.findByApplicationId(APPLICATION_ID)).thenReturn(Optional.of(application));

        assertThat(service.waitlistApplication(APPLICATION_ID, 5L, null).success()).isFalse();
        verify(applicationRepository, never()).save(any());
    }

    @Test
    @DisplayName("status override cannot approve")
    void updateStatusRefusesApproval() {
        when(applicationRepository.findByApplicationId(APPLICATION_ID))
                .thenReturn(Optional.of(pendingApplication()));

        OperationResult result = service.updateStatus(APPLICATION_ID, ApplicationStatus.APPROVED, null, 5L);

        assertThat(result.success()).isFalse();
        verify(applicationRepository, never()).save(any());
    }

    @Test
    @DisplayName("status override of an approved application is not saved")
    void updateStatusOfApprovedNotSaved() {
        AdmissionApplication application = pendingApplication();
        application.approve(5L, null, true, NOW);
        application.assignStudent("2025CS0001");
        when(applicationRepository.findByApplicationId(APPLICATION_ID)).thenReturn(Optional.of(application));

        OperationResult result = service.updateStatus(APPLICATION_ID, ApplicationStatus.DECLINED, "undo", 6L);

        assertThat(result.success()).isFalse();
        assertThat(application.getStatus()).isEqualTo(ApplicationStatus.APPROVED);
        assertThat(application.getStudentId()).isEqualTo("2025CS0001");
        verify(applicationRepository, never()).save(any());
    }

    @Test
    @DisplayName("starting a review saves without stamping the reviewer as decision maker")
    void startReview() {
        AdmissionApplication application = pendingApplication();
        when(applicationRepository.findByApplicationId(APPLICATION_ID)).thenReturn(Optional.of(application));

        assertThat(service.startReview(APPLICATION_ID, 3L).success()).isTrue();
        assertThat(application.getStatus()).isEqualTo(ApplicationStatus.UNDER_REVIEW);
        assertThat(application.getStaffId()).isNull();
        assertThat(application.getUpdatedOn()).isEqualTo(NOW);
        verify(applicationRepository).save(application);
    }

    @Test
    @DisplayName("eligibility uses the configured bounds")
    void eligibility() {
        AdmissionApplication application = pendingApplication();
        application.setTenthPercentage(65);
        when(applicationRepository.findByApplicationId(APPLICATION_ID)).thenReturn(Optional.of(application));

        assertThat(service.checkEligibility(APPLICATION_ID).success()).isTrue();

        properties.getAdmission().setMinimumPercentage(70);
        assertThat(service.checkEligibility(APPLICATION_ID).success()).isFalse();
    }

    @Test
    void unknownApplicationThrows() {
        when(applicationRepository.findByApplicationId("ADM2025999999")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.approveApplication("ADM2025999999", 5L, null))
                .isInstanceOf(ApplicationNotFoundException.class)
                .hasMessageContaining("ADM2025999999");
    }

    @Test
    @DisplayName("statistics count every status and the approval rate")
    void statistics() {
        when(applicationRepository.countApplicationsByStatus()).thenReturn(List.<Object[]>of(
                new Object[] {ApplicationStatus.APPROVED, 3L},
                new Object[] {ApplicationStatus.DECLINED, 1L}));

        AdmissionStatsDTO stats = service.getStatistics();

        assertThat(stats.getTotalApplications()).isEqualTo(4);
        assertThat(stats.getConversionRate()).isEqualTo(75.0);
        assertThat(stats.getCountsByStatus())
                .hasSize(ApplicationStatus.values().length)
                .containsEntry(ApplicationStatus.SUBMITTED, 0L)
                .containsEntry(ApplicationStatus.APPROVED, 3L);
    }

    @Test
    void statisticsWithoutApplications() {
        when(applicationRepository.countApplicationsByStatus()).thenReturn(List.of());

        AdmissionStatsDTO stats = service.getStatistics();

        assertThat(stats.getTotalApplications()).isZero();
        assertThat(stats.getConversionRate()).isZero();
    }
}
