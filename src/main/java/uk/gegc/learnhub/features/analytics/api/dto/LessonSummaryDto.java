package uk.gegc.learnhub.features.analytics.api.dto;

import uk.gegc.learnhub.features.catalog.domain.model.LessonType;
import uk.gegc.learnhub.features.progress.domain.model.ProgressStatus;

import java.time.Instant;
import java.util.UUID;

public record LessonSummaryDto(
        UUID lessonId,
        String title,
        int lessonOrder,
        LessonType type,
        ProgressStatus status,
        int completionPercentage,
        int watchTimeSeconds,
        Instant completedAt,
        Instant lastAccessedAt
) {
}
