package uk.gegc.learnhub.features.progress.application;

import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.progress.api.dto.*;
import uk.gegc.learnhub.features.progress.domain.model.InteractionType;
import uk.gegc.learnhub.features.progress.domain.model.ProgressStatus;
import uk.gegc.learnhub.features.progress.domain.model.SubmittedAnswer;

import java.util.List;
import java.util.UUID;

/**
 * Per-lesson progress of the calling user. Every operation creates the record on first
 * access and requires the lesson to be a preview or the user to be enrolled in its course.
 */
public interface LessonProgressService {

    LessonProgressDto getProgress(UUID userId, UUID lessonId);

    LessonProgressDto recordWatchTime(UUID userId, UUID lessonId, int positionSeconds, int elapsedSeconds);

    QuizAttemptResultDto recordQuizAttempt(UUID userId, UUID lessonId, List<SubmittedAnswer> answers, Integer timeSpentSeconds);

    LessonProgressDto updateStatus(UUID userId, UUID lessonId, ProgressStatus status);

    BookmarkDto addBookmark(UUID userId, UUID lessonId, int positionSeconds, String note);

    void removeBookmark(UUID userId, UUID lessonId, UUID bookmarkId);

    NoteDto addNote(UUID userId, UUID lessonId, String content, Integer positionSeconds, Boolean isPrivate);

    NoteDto updateNote(UUID userId, UUID lessonId, UUID noteId, String content);

    void recordInteraction(UUID userId, UUID lessonId, InteractionType type, Integer positionSeconds, String value);

    PlaybackSettingsDto updateSettings(UUID userId, UUID lessonId, PlaybackSettingsRequest settings);

    /**
     * Inserts a fresh record in its own transaction.
     * A concurrent duplicate surfaces as {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    UUID createProgressTx(UUID userId, Lesson lesson);
}
