package uk.gegc.learnhub.features.analytics.api.dto;

import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;

public record StatusStatsDto(
        EnrollmentStatus status,
        long count,
        double averageCompletion
) {
}
