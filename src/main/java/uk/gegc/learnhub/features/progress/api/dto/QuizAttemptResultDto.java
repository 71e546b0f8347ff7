package uk.gegc.learnhub.features.progress.api.dto;

public record QuizAttemptResultDto(
        QuizAttemptDto attempt,
        LessonProgressDto progress
) {
}
