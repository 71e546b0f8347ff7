package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.learnhub.features.progress.domain.model.ProgressStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "LessonProgressDto", description = "A learner's progress in one lesson")
public record LessonProgressDto(
        UUID id,
        UUID userId,
        UUID lessonId,
        UUID courseId,
        ProgressStatus status,
        @Schema(description = "Furthest playback position reached, in seconds")
        int watchTimeSeconds,
        @Schema(description = "Accumulated seconds watched, including re-watches")
        long totalWatchTimeSeconds,
        int completionPercentage,
        Instant completedAt,
        Instant lastAccessedAt,
        int highestScore,
        Integer bestAttemptNumber,
        boolean quizPassed,
        List<QuizAttemptDto> quizAttempts,
        List<BookmarkDto> bookmarks,
        List<NoteDto> notes,
        PlaybackSettingsDto settings
) {
}
