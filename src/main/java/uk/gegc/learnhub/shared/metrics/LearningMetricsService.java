package uk.gegc.learnhub.shared.metrics;

import java.util.UUID;

/**
 * Counters for learning state transitions.
 */
public interface LearningMetricsService {

    void incrementLessonCompleted(UUID userId, UUID lessonId);

    void incrementQuizAttempt(UUID userId, UUID lessonId, boolean passed);

    void incrementEnrollmentCreated(UUID userId, UUID courseId);

    void incrementEnrollmentCompleted(UUID userId, UUID courseId);

    void incrementCertificateIssued(UUID enrollmentId);

    /**
     * A concurrent create lost the insert race and the existing row was returned.
     *
     * @param record {@code lesson_progress} or {@code enrollment}
     */
    void incrementConflictRecovered(String record);
}
