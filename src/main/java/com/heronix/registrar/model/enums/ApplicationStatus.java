package com.heronix.registrar.model.enums;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Status of an admission application.
 *
 * SUBMITTED -> UNDER_REVIEW -> APPROVED | DECLINED | WAITLISTED | DOCUMENTS_PENDING.
 * WAITLISTED and DOCUMENTS_PENDING go back through UNDER_REVIEW.
 */
public enum ApplicationStatus {

    /**
     * Received, checklist initialized
     */
    SUBMITTED,

    /**
     * Picked up by admissions staff
     */
    UNDER_REVIEW,

    /**
     * Accepted, a student record exists
     */
    APPROVED,

    /**
     * Rejected with a reason
     */
    DECLINED,

    /**
     * Held until a seat frees up
     */
    WAITLISTED,

    /**
     * Waiting on the applicant for documents
     */
    DOCUMENTS_PENDING;

    /**
     * Whether approve/decline may be applied from this status.
     */
    public boolean isAwaitingDecision() {
        return switch (this) {
            case SUBMITTED, UNDER_REVIEW, WAITLISTED -> true;
            case APPROVED, DECLINED, DOCUMENTS_PENDING -> false;
        };
    }

    /**
     * Whether the application can be (re)opened for review from this status.
     */
    public boolean canStartReview() {
        return switch (this) {
            case SUBMITTED, DOCUMENTS_PENDING, WAITLISTED -> true;
            case UNDER_REVIEW, APPROVED, DECLINED -> false;
        };
    }

    /**
     * Statuses still waiting on staff.
     */
    public boolean isPending() {
        return switch (this) {
            case SUBMITTED, UNDER_REVIEW -> true;
            case APPROVED, DECLINED, WAITLISTED, DOCUMENTS_PENDING -> false;
        };
    }

    /**
     * All statuses for which {@link #isPending()} holds.
     */
    public static Set<ApplicationStatus> pendingStatuses() {
        return Arrays.stream(values())
                .filter(ApplicationStatus::isPending)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ApplicationStatus.class)));
    }
}
