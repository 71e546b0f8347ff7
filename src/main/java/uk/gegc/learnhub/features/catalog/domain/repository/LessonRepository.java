package uk.gegc.learnhub.features.catalog.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LessonRepository extends JpaRepository<Lesson, UUID> {

    @Query("""
            SELECT l FROM Lesson l
            LEFT JOIN FETCH l.course
            WHERE l.id = :lessonId
            """)
    Optional<Lesson> findByIdWithCourse(@Param("lessonId") UUID lessonId);

    @Query("""
            SELECT l FROM Lesson l
            WHERE l.course.id = :courseId AND l.published = true
            ORDER BY l.lessonOrder ASC
            """)
    List<Lesson> findPublishedByCourseId(@Param("courseId") UUID courseId);

    @Query("""
            SELECT COUNT(l) FROM Lesson l
            WHERE l.course.id = :courseId AND l.published = true
            """)
    long countPublishedByCourseId(@Param("courseId") UUID courseId);
}
