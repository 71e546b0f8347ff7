package uk.gegc.learnhub.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A learner's state in one lesson. One row per (user, lesson); created on first access
 * and never deleted. All derived fields are maintained by {@code ProgressTracker}.
 */
@Entity
@Getter
@Setter
@Table(
        name = "lesson_progress",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_lesson_progress_user_lesson",
                        columnNames = {"user_id", "lesson_id"}
                )
        }
)
public class LessonProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "progress_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "lesson_id", nullable = false, updatable = false)
    private UUID lessonId;

    @Column(name = "course_id", nullable = false, updatable = false)
    private UUID courseId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ProgressStatus status = ProgressStatus.NOT_STARTED;

    @Column(name = "watch_time_seconds", nullable = false)
    private int watchTimeSeconds;

    @Column(name = "total_watch_time_seconds", nullable = false)
    private long totalWatchTimeSeconds;

    @Column(name = "completion_percentage", nullable = false)
    private int completionPercentage;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @OneToMany(mappedBy = "progress", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("attemptNumber ASC")
    private List<QuizAttempt> quizAttempts = new ArrayList<>();

    @Column(name = "highest_score", nullable = false)
    private int highestScore;

    @Column(name = "best_attempt_number")
    private Integer bestAttemptNumber;

    @Column(name = "quiz_passed", nullable = false)
    private boolean quizPassed;

    @OneToMany(mappedBy = "progress", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    private List<LessonBookmark> bookmarks = new ArrayList<>();

    @OneToMany(mappedBy = "progress", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    private List<LessonNote> notes = new ArrayList<>();

    @Convert(converter = PlaybackInteractionsConverter.class)
    @Column(name = "interactions", nullable = false, columnDefinition = "TEXT")
    private List<PlaybackInteraction> interactions = new ArrayList<>();

    @Embedded
    private PlaybackSettings settings = new PlaybackSettings();

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isCompleted() {
        return status == ProgressStatus.COMPLETED;
    }
}
