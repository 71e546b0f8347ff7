package uk.gegc.learnhub.features.analytics.api.dto;

import java.time.LocalDate;

public record DailyLearningDto(
        LocalDate date,
        long totalWatchTimeSeconds,
        int lessonsAccessed,
        int lessonsCompleted
) {
}
