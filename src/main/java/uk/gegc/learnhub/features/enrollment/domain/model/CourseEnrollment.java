package uk.gegc.learnhub.features.enrollment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A learner's membership in a course. One row per (user, course); never deleted.
 */
@Entity
@Getter
@Setter
@Table(
        name = "course_enrollments",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_enrollment_user_course",
                        columnNames = {"user_id", "course_id"}
                )
        }
)
public class CourseEnrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "enrollment_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "course_id", nullable = false, updatable = false)
    private UUID courseId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EnrollmentStatus status = EnrollmentStatus.ACTIVE;

    @Column(name = "enrolled_at", nullable = false, updatable = false)
    private Instant enrolledAt;

    @ElementCollection
    @CollectionTable(
            name = "enrollment_completed_lessons",
            joinColumns = @JoinColumn(name = "enrollment_id"),
            uniqueConstraints = @UniqueConstraint(
                    name = "uq_completed_lesson_enrollment_lesson",
                    columnNames = {"enrollment_id", "lesson_id"}
            )
    )
    @OrderBy("completedAt ASC")
    private List<CompletedLesson> completedLessons = new ArrayList<>();

    @Column(name = "current_lesson_id")
    private UUID currentLessonId;

    @Column(name = "completion_percentage", nullable = false)
    private int completionPercentage;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "certificate_issued", nullable = false)
    private boolean certificateIssued;

    @Column(name = "certificate_id", length = 100, unique = true)
    private String certificateId;

    @Embedded
    private EnrollmentRating rating;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean hasCompletedLesson(UUID lessonId) {
        return completedLessons.stream().anyMatch(c -> c.getLessonId().equals(lessonId));
    }
}
