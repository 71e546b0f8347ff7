package uk.gegc.learnhub.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "CourseEnrollmentStatsDto", description = "Enrollment counts and ratings of a course")
public record CourseEnrollmentStatsDto(
        UUID courseId,
        long totalEnrollments,
        @Schema(description = "One entry per status that has at least one enrollment")
        List<StatusStatsDto> byStatus,
        long ratingCount,
        @Schema(description = "Average rating, 0 when unrated")
        double averageRating
) {
}
