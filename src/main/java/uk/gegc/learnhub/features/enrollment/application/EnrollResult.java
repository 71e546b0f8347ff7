package uk.gegc.learnhub.features.enrollment.application;

import uk.gegc.learnhub.features.enrollment.api.dto.EnrollmentDto;

/**
 * @param created false when the caller was already enrolled
 */
public record EnrollResult(EnrollmentDto enrollment, boolean created) {
}
