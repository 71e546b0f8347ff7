package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "QuizAttemptDto", description = "Graded quiz attempt")
public record QuizAttemptDto(
        UUID id,
        @Schema(description = "1-based attempt number")
        int attemptNumber,
        int score,
        int totalPoints,
        @Schema(description = "Score as a rounded percentage of total points")
        int percentage,
        boolean passed,
        Integer timeSpentSeconds,
        Instant completedAt,
        List<GradedAnswerDto> answers
) {
}
