package uk.gegc.learnhub.features.progress.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.learnhub.features.catalog.domain.model.AnswerValue;
import uk.gegc.learnhub.features.progress.api.dto.*;
import uk.gegc.learnhub.features.progress.domain.model.*;

import java.util.List;

@Component
public class LessonProgressMapper {

    public LessonProgressDto toDto(LessonProgress progress) {
        List<QuizAttemptDto> attempts = progress.getQuizAttempts().stream()
                .map(this::toDto)
                .toList();
        List<BookmarkDto> bookmarks = progress.getBookmarks().stream()
                .map(this::toDto)
                .toList();
        List<NoteDto> notes = progress.getNotes().stream()
                .map(this::toDto)
                .toList();

        return new LessonProgressDto(
                progress.getId(),
                progress.getUserId(),
                progress.getLessonId(),
                progress.getCourseId(),
                progress.getStatus(),
                progress.getWatchTimeSeconds(),
                progress.getTotalWatchTimeSeconds(),
                progress.getCompletionPercentage(),
                progress.getCompletedAt(),
                progress.getLastAccessedAt(),
                progress.getHighestScore(),
                progress.getBestAttemptNumber(),
                progress.isQuizPassed(),
                attempts,
                bookmarks,
                notes,
                toDto(progress.getSettings())
        );
    }

    public QuizAttemptDto toDto(QuizAttempt attempt) {
        List<GradedAnswerDto> answers = attempt.getAnswers().stream()
                .map(a -> new GradedAnswerDto(a.questionId(), toDto(a.answer()), a.correct(), a.pointsAwarded()))
                .toList();
        return new QuizAttemptDto(
                attempt.getId(),
                attempt.getAttemptNumber(),
                attempt.getScore(),
                attempt.getTotalPoints(),
                attempt.getPercentage(),
                attempt.isPassed(),
                attempt.getTimeSpentSeconds(),
                attempt.getCompletedAt(),
                answers
        );
    }

    public BookmarkDto toDto(LessonBookmark bookmark) {
        return new BookmarkDto(bookmark.getId(), bookmark.getPositionSeconds(), bookmark.getNote(), bookmark.getCreatedAt());
    }

    public NoteDto toDto(LessonNote note) {
        return new NoteDto(
                note.getId(),
                note.getContent(),
                note.getPositionSeconds(),
                note.isPrivateNote(),
                note.getCreatedAt(),
                note.getUpdatedAt()
        );
    }

    public PlaybackSettingsDto toDto(PlaybackSettings settings) {
        PlaybackSettings s = settings != null ? settings : new PlaybackSettings();
        return new PlaybackSettingsDto(
                s.getPlaybackSpeed(),
                s.getVolume(),
                s.getQuality(),
                s.isSubtitlesEnabled(),
                s.getSubtitlesLanguage()
        );
    }

    public AnswerValueDto toDto(AnswerValue answer) {
        return answer == null ? null : new AnswerValueDto(answer.kind(), answer.values());
    }

    public List<SubmittedAnswer> toSubmittedAnswers(QuizAttemptRequest request) {
        return request.answers().stream()
                .map(a -> new SubmittedAnswer(a.questionId(), toAnswerValue(a.answer())))
                .toList();
    }

    private AnswerValue toAnswerValue(AnswerValueDto dto) {
        return dto == null ? null : new AnswerValue(dto.kind(), dto.values());
    }
}
