package com.heronix.registrar.model.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ApplicationStatusTest {

    @Test
    void pendingStatusesFollowThePredicate() {
        assertThat(ApplicationStatus.pendingStatuses())
                .containsExactlyInAnyOrder(ApplicationStatus.SUBMITTED, ApplicationStatus.UNDER_REVIEW);
        for (ApplicationStatus status : ApplicationStatus.values()) {
            assertThat(ApplicationStatus.pendingStatuses().contains(status)).isEqualTo(status.isPending());
        }
    }

    @Test
    void waitlistedAwaitsDecisionButIsNotPending() {
        assertThat(ApplicationStatus.WAITLISTED.isAwaitingDecision()).isTrue();
        assertThat(ApplicationStatus.WAITLISTED.isPending()).isFalse();
        assertThat(ApplicationStatus.APPROVED.canStartReview()).isFalse();
    }
}
