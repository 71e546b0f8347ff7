package uk.gegc.learnhub.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;
import java.util.List;

@Schema(name = "LearningAnalyticsDto", description = "Daily learning activity, bucketed by the day a lesson was last accessed")
public record LearningAnalyticsDto(
        LocalDate from,
        LocalDate to,
        @Schema(description = "Days with activity, ascending")
        List<DailyLearningDto> days
) {
}
