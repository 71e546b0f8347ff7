package uk.gegc.learnhub.features.progress.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.learnhub.features.progress.domain.model.LessonProgress;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LessonProgressRepository extends JpaRepository<LessonProgress, UUID> {

    Optional<LessonProgress> findByUserIdAndLessonId(UUID userId, UUID lessonId);

    /**
     * Locking read; unlike a plain read it sees a row committed by a concurrent
     * transaction after this one started.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT p FROM LessonProgress p
            WHERE p.userId = :userId AND p.lessonId = :lessonId
            """)
    Optional<LessonProgress> findLockedByUserIdAndLessonId(@Param("userId") UUID userId,
                                                          @Param("lessonId") UUID lessonId);

    List<LessonProgress> findByUserIdAndCourseId(UUID userId, UUID courseId);

    @Query("""
            SELECT p FROM LessonProgress p
            WHERE p.userId = :userId
              AND p.lastAccessedAt >= :from
              AND p.lastAccessedAt < :to
            ORDER BY p.lastAccessedAt ASC
            """)
    List<LessonProgress> findAccessedBetween(@Param("userId") UUID userId,
                                             @Param("from") Instant from,
                                             @Param("to") Instant to);
}
