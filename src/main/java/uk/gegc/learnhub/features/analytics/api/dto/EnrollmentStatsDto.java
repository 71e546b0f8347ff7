package uk.gegc.learnhub.features.analytics.api.dto;

import java.time.Instant;
import java.util.UUID;

public record EnrollmentStatsDto(
        UUID enrollmentId,
        int totalLessons,
        int completedLessons,
        int completionPercentage,
        long totalStudyTimeSeconds,
        Instant enrolledAt,
        Instant lastAccessedAt
) {
}
