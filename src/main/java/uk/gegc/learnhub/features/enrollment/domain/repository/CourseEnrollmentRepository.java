package uk.gegc.learnhub.features.enrollment.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.learnhub.features.enrollment.domain.model.CourseEnrollment;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CourseEnrollmentRepository extends JpaRepository<CourseEnrollment, UUID> {

    Optional<CourseEnrollment> findByUserIdAndCourseId(UUID userId, UUID courseId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT e FROM CourseEnrollment e
            WHERE e.userId = :userId AND e.courseId = :courseId
            """)
    Optional<CourseEnrollment> findLockedByUserIdAndCourseId(@Param("userId") UUID userId,
                                                            @Param("courseId") UUID courseId);

    boolean existsByUserIdAndCourseIdAndStatusIn(UUID userId, UUID courseId, Collection<EnrollmentStatus> statuses);

    Page<CourseEnrollment> findByUserId(UUID userId, Pageable pageable);

    Page<CourseEnrollment> findByUserIdAndStatus(UUID userId, EnrollmentStatus status, Pageable pageable);

    Page<CourseEnrollment> findByCourseId(UUID courseId, Pageable pageable);

    Page<CourseEnrollment> findByCourseIdAndStatus(UUID courseId, EnrollmentStatus status, Pageable pageable);

    List<CourseEnrollment> findAllByCourseId(UUID courseId);
}
