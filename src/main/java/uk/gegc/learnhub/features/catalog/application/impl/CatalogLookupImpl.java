package uk.gegc.learnhub.features.catalog.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.catalog.application.CatalogLookup;
import uk.gegc.learnhub.features.catalog.domain.model.Course;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.catalog.domain.repository.CourseRepository;
import uk.gegc.learnhub.features.catalog.domain.repository.LessonRepository;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class CatalogLookupImpl implements CatalogLookup {

    private final CourseRepository courseRepository;
    private final LessonRepository lessonRepository;

    @Override
    public Lesson requireLesson(UUID lessonId) {
        return lessonRepository.findByIdWithCourse(lessonId)
                .orElseThrow(() -> new ResourceNotFoundException("Lesson " + lessonId + " not found"));
    }

    @Override
    public Course requireCourse(UUID courseId) {
        return courseRepository.findById(courseId)
                .orElseThrow(() -> new ResourceNotFoundException("Course " + courseId + " not found"));
    }

    @Override
    public Optional<UUID> findNextLessonId(UUID courseId, Lesson lesson) {
        return lessonRepository.findPublishedByCourseId(courseId).stream()
                .filter(candidate -> !candidate.getId().equals(lesson.getId()))
                .filter(candidate -> candidate.getLessonOrder() > lesson.getLessonOrder())
                .findFirst()
                .map(Lesson::getId);
    }

    @Override
    public Optional<UUID> findFirstPublishedLessonId(UUID courseId) {
        return lessonRepository.findPublishedByCourseId(courseId).stream()
                .findFirst()
                .map(Lesson::getId);
    }

    @Override
    public long countPublishedLessons(UUID courseId) {
        return lessonRepository.countPublishedByCourseId(courseId);
    }

    @Override
    public List<Lesson> listPublishedLessons(UUID courseId) {
        return lessonRepository.findPublishedByCourseId(courseId);
    }
}
