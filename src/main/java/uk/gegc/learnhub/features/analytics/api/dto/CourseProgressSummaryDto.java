package uk.gegc.learnhub.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "CourseProgressSummaryDto", description = "A learner's progress across the published lessons of a course")
public record CourseProgressSummaryDto(
        UUID courseId,
        @Schema(description = "Published lessons in the course")
        int totalLessons,
        int completedLessons,
        int overallPercentage,
        @Schema(description = "Most recent activity in any lesson of the course; null when none")
        Instant lastAccessedAt,
        List<LessonSummaryDto> lessons
) {
}
