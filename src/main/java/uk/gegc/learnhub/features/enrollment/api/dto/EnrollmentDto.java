package uk.gegc.learnhub.features.enrollment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "EnrollmentDto", description = "A learner's enrollment in a course")
public record EnrollmentDto(
        UUID id,
        UUID userId,
        UUID courseId,
        EnrollmentStatus status,
        Instant enrolledAt,
        @Schema(description = "Next lesson to take, in course order")
        UUID currentLessonId,
        int completionPercentage,
        Instant lastAccessedAt,
        Instant completedAt,
        boolean certificateIssued,
        String certificateId,
        List<CompletedLessonDto> completedLessons,
        RatingDto rating
) {
}
