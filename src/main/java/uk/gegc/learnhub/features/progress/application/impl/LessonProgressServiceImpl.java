package uk.gegc.learnhub.features.progress.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.catalog.application.CatalogLookup;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.catalog.domain.model.LessonType;
import uk.gegc.learnhub.features.enrollment.application.EnrollmentService;
import uk.gegc.learnhub.features.progress.api.dto.*;
import uk.gegc.learnhub.features.progress.application.LessonProgressService;
import uk.gegc.learnhub.features.progress.application.ProgressTracker;
import uk.gegc.learnhub.features.progress.domain.model.*;
import uk.gegc.learnhub.features.progress.domain.repository.LessonProgressRepository;
import uk.gegc.learnhub.features.progress.infra.mapping.LessonProgressMapper;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;
import uk.gegc.learnhub.shared.metrics.LearningMetricsService;
import uk.gegc.learnhub.shared.persistence.UniqueConstraints;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Transactional
public class LessonProgressServiceImpl implements LessonProgressService {

    private final LessonProgressRepository progressRepository;
    private final CatalogLookup catalogLookup;
    private final EnrollmentService enrollmentService;
    private final ProgressTracker tracker;
    private final LessonProgressMapper mapper;
    private final LearningMetricsService metricsService;
    private final LessonProgressService self;

    public LessonProgressServiceImpl(
            LessonProgressRepository progressRepository,
            CatalogLookup catalogLookup,
            EnrollmentService enrollmentService,
            ProgressTracker tracker,
            LessonProgressMapper mapper,
            LearningMetricsService metricsService,
            @Lazy LessonProgressService self
    ) {
        this.progressRepository = progressRepository;
        this.catalogLookup = catalogLookup;
        this.enrollmentService = enrollmentService;
        this.tracker = tracker;
        this.mapper = mapper;
        this.metricsService = metricsService;
        this.self = self;
    }

    @Override
    public LessonProgressDto getProgress(UUID userId, UUID lessonId) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        return mapper.toDto(progress);
    }

    @Override
    public LessonProgressDto recordWatchTime(UUID userId, UUID lessonId, int positionSeconds, int elapsedSeconds) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        boolean completedNow = tracker.recordWatchTime(progress, lesson, positionSeconds, elapsedSeconds);
        progressRepository.save(progress);
        afterMutation(progress, lesson, completedNow);
        return mapper.toDto(progress);
    }

    @Override
    public QuizAttemptResultDto recordQuizAttempt(UUID userId, UUID lessonId, List<SubmittedAnswer> answers, Integer timeSpentSeconds) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        boolean wasCompleted = progress.isCompleted();
        QuizAttempt attempt = tracker.recordQuizAttempt(progress, lesson, answers, timeSpentSeconds);
        // flush so the cascaded attempt row gets its id
        progressRepository.flush();
        metricsService.incrementQuizAttempt(userId, lessonId, attempt.isPassed());
        afterMutation(progress, lesson, !wasCompleted && progress.isCompleted());
        return new QuizAttemptResultDto(mapper.toDto(attempt), mapper.toDto(progress));
    }

    @Override
    public LessonProgressDto updateStatus(UUID userId, UUID lessonId, ProgressStatus status) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        boolean completedNow = tracker.updateStatus(progress, lesson, status);
        progressRepository.save(progress);
        afterMutation(progress, lesson, completedNow);
        return mapper.toDto(progress);
    }

    @Override
    public BookmarkDto addBookmark(UUID userId, UUID lessonId, int positionSeconds, String note) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        LessonBookmark bookmark = tracker.addBookmark(progress, positionSeconds, note);
        progressRepository.flush();
        return mapper.toDto(bookmark);
    }

    @Override
    public void removeBookmark(UUID userId, UUID lessonId, UUID bookmarkId) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        tracker.removeBookmark(progress, bookmarkId);
        progressRepository.save(progress);
    }

    @Override
    public NoteDto addNote(UUID userId, UUID lessonId, String content, Integer positionSeconds, Boolean isPrivate) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        LessonNote note = tracker.addNote(progress, content, positionSeconds, isPrivate);
        progressRepository.flush();
        return mapper.toDto(note);
    }

    @Override
    public NoteDto updateNote(UUID userId, UUID lessonId, UUID noteId, String content) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        LessonNote note = tracker.updateNote(progress, noteId, content);
        progressRepository.save(progress);
        return mapper.toDto(note);
    }

    @Override
    public void recordInteraction(UUID userId, UUID lessonId, InteractionType type, Integer positionSeconds, String value) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        tracker.recordInteraction(progress, type, positionSeconds, value);
        progressRepository.save(progress);
    }

    @Override
    public PlaybackSettingsDto updateSettings(UUID userId, UUID lessonId, PlaybackSettingsRequest request) {
        Lesson lesson = requireAccessibleLesson(userId, lessonId);
        LessonProgress progress = getOrCreate(userId, lesson);
        tracker.updateSettings(progress,
                request.playbackSpeed(),
                request.volume(),
                request.quality(),
                request.subtitlesEnabled(),
                request.subtitlesLanguage());
        progressRepository.save(progress);
        return mapper.toDto(progress.getSettings());
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID createProgressTx(UUID userId, Lesson lesson) {
        LessonProgress saved = progressRepository.saveAndFlush(tracker.newRecord(userId, lesson));
        log.debug("Lesson progress created progressId={} userId={} lessonId={}", saved.getId(), userId, lesson.getId());
        return saved.getId();
    }

    private Lesson requireAccessibleLesson(UUID userId, UUID lessonId) {
        Lesson lesson = catalogLookup.requireLesson(lessonId);
        if (!lesson.isPublished()) {
            throw new ResourceNotFoundException("Lesson " + lessonId + " not found");
        }
        if (lesson.isPreview()) {
            return lesson;
        }
        if (!enrollmentService.hasLearningAccess(userId, lesson.getCourseId())) {
            throw new AccessDeniedException("Enroll in the course to access lesson " + lessonId);
        }
        return lesson;
    }

    /**
     * Create-or-fetch. The insert runs in its own transaction; when a concurrent request
     * wins the race the existing row is read with a locking read.
     */
    private LessonProgress getOrCreate(UUID userId, Lesson lesson) {
        return progressRepository.findByUserIdAndLessonId(userId, lesson.getId())
                .orElseGet(() -> {
                    try {
                        self.createProgressTx(userId, lesson);
                    } catch (DataIntegrityViolationException e) {
                        if (!UniqueConstraints.isViolationOf(e, UniqueConstraints.LESSON_PROGRESS_USER_LESSON)) {
                            throw e;
                        }
                        log.info("Concurrent progress create resolved to existing row userId={} lessonId={}",
                                userId, lesson.getId());
                        metricsService.incrementConflictRecovered("lesson_progress");
                    }
                    return progressRepository.findLockedByUserIdAndLessonId(userId, lesson.getId())
                            .orElseThrow(() -> new IllegalStateException(
                                    "Progress for user " + userId + " in lesson " + lesson.getId() + " missing after create"));
                });
    }

    private void afterMutation(LessonProgress progress, Lesson lesson, boolean completedNow) {
        if (completedNow) {
            metricsService.incrementLessonCompleted(progress.getUserId(), lesson.getId());
        }
        if (progress.isCompleted()) {
            Integer score = lesson.getType() == LessonType.QUIZ ? progress.getHighestScore() : null;
            enrollmentService.recordLessonCompletion(progress.getUserId(), lesson, progress.getWatchTimeSeconds(), score);
        }
    }
}
