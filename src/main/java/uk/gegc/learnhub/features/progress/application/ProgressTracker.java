package uk.gegc.learnhub.features.progress.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.catalog.domain.model.LessonType;
import uk.gegc.learnhub.features.progress.domain.model.*;
import uk.gegc.learnhub.shared.config.ProgressProperties;
import uk.gegc.learnhub.shared.exception.InvalidOperationException;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;
import uk.gegc.learnhub.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * State transitions of a single {@link LessonProgress} record.
 * <p>
 * Works on an already loaded record and never touches storage. Status only moves
 * forward (NOT_STARTED, IN_PROGRESS, COMPLETED), {@code completedAt} is written once,
 * and the watch-time high-water mark and completion percentage never decrease.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressTracker {

    private static final double MIN_PLAYBACK_SPEED = 0.25d;
    private static final double MAX_PLAYBACK_SPEED = 4.0d;

    private final QuizGrader quizGrader;
    private final ProgressProperties properties;
    private final Clock clock;

    public LessonProgress newRecord(UUID userId, Lesson lesson) {
        LessonProgress progress = new LessonProgress();
        progress.setUserId(userId);
        progress.setLessonId(lesson.getId());
        progress.setCourseId(lesson.getCourseId());
        progress.setLastAccessedAt(clock.instant());
        return progress;
    }

    /**
     * Records playback up to {@code positionSeconds}, having watched {@code elapsedSeconds} since the last report.
     *
     * @return true when this call completed the lesson
     */
    public boolean recordWatchTime(LessonProgress progress, Lesson lesson, int positionSeconds, int elapsedSeconds) {
        if (positionSeconds < 0 || elapsedSeconds < 0) {
            throw new ValidationException("Watch time values must not be negative");
        }
        Instant now = clock.instant();
        progress.setLastAccessedAt(now);

        progress.setWatchTimeSeconds(Math.max(progress.getWatchTimeSeconds(), positionSeconds));
        long total = progress.getTotalWatchTimeSeconds() + elapsedSeconds;
        progress.setTotalWatchTimeSeconds(Math.max(total, progress.getWatchTimeSeconds()));

        if (!lesson.hasVideoDuration()) {
            return false;
        }

        int watchedPercent = (int) Math.min(100L,
                Math.round(100.0 * progress.getWatchTimeSeconds() / lesson.getVideoDurationSeconds()));
        progress.setCompletionPercentage(Math.max(progress.getCompletionPercentage(), watchedPercent));

        int percentage = progress.getCompletionPercentage();
        if (percentage >= requiredWatchPercent(lesson) && !progress.isCompleted()) {
            markCompleted(progress, now);
            log.info("Lesson completed by watch time userId={} lessonId={} percentage={}",
                    progress.getUserId(), progress.getLessonId(), percentage);
            return true;
        }
        if (percentage > 0 && progress.getStatus() == ProgressStatus.NOT_STARTED) {
            progress.setStatus(ProgressStatus.IN_PROGRESS);
        }
        return false;
    }

    /**
     * Grades and appends a quiz attempt. A passing attempt completes the lesson; a later
     * failing attempt never undoes that.
     */
    public QuizAttempt recordQuizAttempt(LessonProgress progress,
                                         Lesson lesson,
                                         List<SubmittedAnswer> answers,
                                         Integer timeSpentSeconds) {
        if (lesson.getType() != LessonType.QUIZ) {
            throw new InvalidOperationException("Lesson " + lesson.getId() + " is not a quiz");
        }
        if (timeSpentSeconds != null && timeSpentSeconds < 0) {
            throw new ValidationException("timeSpentSeconds must not be negative");
        }
        QuizGrade grade = quizGrader.grade(lesson, answers);
        Instant now = clock.instant();
        boolean passed = grade.percentage() >= passingScorePercent(lesson);

        QuizAttempt attempt = new QuizAttempt();
        attempt.setProgress(progress);
        attempt.setAttemptNumber(progress.getQuizAttempts().size() + 1);
        attempt.setAnswers(grade.answers());
        attempt.setScore(grade.score());
        attempt.setTotalPoints(grade.totalPoints());
        attempt.setPercentage(grade.percentage());
        attempt.setTimeSpentSeconds(timeSpentSeconds);
        attempt.setPassed(passed);
        attempt.setCompletedAt(now);
        progress.getQuizAttempts().add(attempt);
        progress.setLastAccessedAt(now);

        if (grade.score() > progress.getHighestScore()) {
            progress.setHighestScore(grade.score());
            progress.setBestAttemptNumber(attempt.getAttemptNumber());
        }

        if (passed) {
            progress.setQuizPassed(true);
            progress.setCompletionPercentage(100);
            if (!progress.isCompleted()) {
                markCompleted(progress, now);
                log.info("Quiz passed userId={} lessonId={} attempt={} percentage={}",
                        progress.getUserId(), progress.getLessonId(), attempt.getAttemptNumber(), grade.percentage());
            }
        } else if (progress.getStatus() == ProgressStatus.NOT_STARTED) {
            progress.setStatus(ProgressStatus.IN_PROGRESS);
            progress.setCompletionPercentage(Math.max(progress.getCompletionPercentage(),
                    Math.min(grade.percentage(), 99)));
        }
        return attempt;
    }

    /**
     * Explicit status report from the client.
     *
     * @return true when this call completed the lesson
     */
    public boolean updateStatus(LessonProgress progress, Lesson lesson, ProgressStatus target) {
        if (target == null || target == ProgressStatus.NOT_STARTED) {
            throw new ValidationException("Status can only be set to IN_PROGRESS or COMPLETED");
        }
        Instant now = clock.instant();
        progress.setLastAccessedAt(now);

        if (target == ProgressStatus.IN_PROGRESS) {
            if (progress.getStatus() == ProgressStatus.NOT_STARTED) {
                progress.setStatus(ProgressStatus.IN_PROGRESS);
            }
            return false;
        }

        if (lesson.getType() == LessonType.QUIZ) {
            throw new InvalidOperationException("Quiz lessons are completed by passing the quiz");
        }
        if (progress.isCompleted()) {
            log.debug("Lesson already completed userId={} lessonId={}", progress.getUserId(), progress.getLessonId());
            return false;
        }
        progress.setCompletionPercentage(100);
        markCompleted(progress, now);
        log.info("Lesson marked completed userId={} lessonId={}", progress.getUserId(), progress.getLessonId());
        return true;
    }

    public LessonBookmark addBookmark(LessonProgress progress, int positionSeconds, String note) {
        if (positionSeconds < 0) {
            throw new ValidationException("positionSeconds must not be negative");
        }
        Instant now = clock.instant();
        LessonBookmark bookmark = new LessonBookmark();
        bookmark.setProgress(progress);
        bookmark.setPositionSeconds(positionSeconds);
        bookmark.setNote(note);
        bookmark.setCreatedAt(now);
        progress.getBookmarks().add(bookmark);
        progress.setLastAccessedAt(now);
        return bookmark;
    }

    public void removeBookmark(LessonProgress progress, UUID bookmarkId) {
        boolean removed = progress.getBookmarks().removeIf(b -> b.getId() != null && b.getId().equals(bookmarkId));
        if (!removed) {
            throw new ResourceNotFoundException("Bookmark " + bookmarkId + " not found");
        }
        progress.setLastAccessedAt(clock.instant());
    }

    public LessonNote addNote(LessonProgress progress, String content, Integer positionSeconds, Boolean privateNote) {
        requireContent(content);
        if (positionSeconds != null && positionSeconds < 0) {
            throw new ValidationException("positionSeconds must not be negative");
        }
        Instant now = clock.instant();
        LessonNote note = new LessonNote();
        note.setProgress(progress);
        note.setContent(content);
        note.setPositionSeconds(positionSeconds);
        note.setPrivateNote(privateNote == null || privateNote);
        note.setCreatedAt(now);
        progress.getNotes().add(note);
        progress.setLastAccessedAt(now);
        return note;
    }

    public LessonNote updateNote(LessonProgress progress, UUID noteId, String content) {
        requireContent(content);
        LessonNote note = progress.getNotes().stream()
                .filter(n -> n.getId() != null && n.getId().equals(noteId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Note " + noteId + " not found"));
        Instant now = clock.instant();
        note.setContent(content);
        note.setUpdatedAt(now);
        progress.setLastAccessedAt(now);
        return note;
    }

    public void recordInteraction(LessonProgress progress, InteractionType type, Integer positionSeconds, String value) {
        if (type == null) {
            throw new ValidationException("Interaction type is required");
        }
        Instant now = clock.instant();
        List<PlaybackInteraction> interactions = progress.getInteractions();
        interactions.add(new PlaybackInteraction(type, now, positionSeconds, value));
        int overflow = interactions.size() - properties.getInteractionHistoryLimit();
        if (overflow > 0) {
            interactions.subList(0, overflow).clear();
        }
        progress.setLastAccessedAt(now);
    }

    /**
     * Applies the non-null settings; the rest keep their current value.
     */
    public void updateSettings(LessonProgress progress,
                               Double playbackSpeed,
                               Double volume,
                               String quality,
                               Boolean subtitlesEnabled,
                               String subtitlesLanguage) {
        PlaybackSettings settings = progress.getSettings();
        if (settings == null) {
            settings = new PlaybackSettings();
            progress.setSettings(settings);
        }
        if (playbackSpeed != null) {
            if (playbackSpeed < MIN_PLAYBACK_SPEED || playbackSpeed > MAX_PLAYBACK_SPEED) {
                throw new ValidationException("playbackSpeed must be between " + MIN_PLAYBACK_SPEED + " and " + MAX_PLAYBACK_SPEED);
            }
            settings.setPlaybackSpeed(playbackSpeed);
        }
        if (volume != null) {
            if (volume < 0.0d || volume > 1.0d) {
                throw new ValidationException("volume must be between 0 and 1");
            }
            settings.setVolume(volume);
        }
        if (StringUtils.hasText(quality)) {
            settings.setQuality(quality.trim());
        }
        if (subtitlesEnabled != null) {
            settings.setSubtitlesEnabled(subtitlesEnabled);
        }
        if (StringUtils.hasText(subtitlesLanguage)) {
            settings.setSubtitlesLanguage(subtitlesLanguage.trim());
        }
        progress.setLastAccessedAt(clock.instant());
    }

    public void touch(LessonProgress progress) {
        progress.setLastAccessedAt(clock.instant());
    }

    private void markCompleted(LessonProgress progress, Instant now) {
        progress.setStatus(ProgressStatus.COMPLETED);
        if (progress.getCompletedAt() == null) {
            progress.setCompletedAt(now);
        }
    }

    private int requiredWatchPercent(Lesson lesson) {
        Integer required = lesson.getRequiredWatchTimePercent();
        return required != null ? required : properties.getDefaultRequiredWatchPercent();
    }

    private int passingScorePercent(Lesson lesson) {
        Integer passing = lesson.getPassingScorePercent();
        return passing != null ? passing : properties.getDefaultPassingScorePercent();
    }

    private static void requireContent(String content) {
        if (!StringUtils.hasText(content)) {
            throw new ValidationException("Note content must not be blank");
        }
    }
}
