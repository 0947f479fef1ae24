package com.heronix.registrar.model.event;

import com.heronix.registrar.model.domain.AdmissionApplication;

/**
 * Published inside the approval transaction once an application is approved.
 *
 * The listener creates the student record and links it back with
 * {@link AdmissionApplication#assignStudent(String)}.
 *
 * @param application       the approved application (managed entity)
 * @param temporaryPassword initial password for the new student account
 */
public record ApplicationApprovedEvent(AdmissionApplication application, String temporaryPassword) {
}
