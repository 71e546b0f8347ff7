package uk.gegc.learnhub.features.catalog.application;

import uk.gegc.learnhub.features.catalog.domain.model.Course;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of courses and lessons used by progress and enrollment tracking.
 */
public interface CatalogLookup {

    /**
     * @throws uk.gegc.learnhub.shared.exception.ResourceNotFoundException when the lesson does not exist
     */
    Lesson requireLesson(UUID lessonId);

    /**
     * @throws uk.gegc.learnhub.shared.exception.ResourceNotFoundException when the course does not exist
     */
    Course requireCourse(UUID courseId);

    /**
     * Next published lesson after {@code lesson} in course order, if any.
     */
    Optional<UUID> findNextLessonId(UUID courseId, Lesson lesson);

    Optional<UUID> findFirstPublishedLessonId(UUID courseId);

    long countPublishedLessons(UUID courseId);

    List<Lesson> listPublishedLessons(UUID courseId);
}
