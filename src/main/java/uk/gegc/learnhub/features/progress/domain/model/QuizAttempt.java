package uk.gegc.learnhub.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable record of one graded quiz submission.
 */
@Entity
@Getter
@Setter
@Table(
        name = "quiz_attempts",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_quiz_attempt_progress_number",
                        columnNames = {"progress_id", "attempt_number"}
                )
        }
)
public class QuizAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "attempt_id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "progress_id", nullable = false)
    private LessonProgress progress;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Convert(converter = GradedAnswersConverter.class)
    @Column(name = "answers", nullable = false, columnDefinition = "TEXT")
    private List<GradedAnswer> answers = new ArrayList<>();

    @Column(name = "score", nullable = false)
    private int score;

    @Column(name = "total_points", nullable = false)
    private int totalPoints;

    @Column(name = "percentage", nullable = false)
    private int percentage;

    @Column(name = "time_spent_seconds")
    private Integer timeSpentSeconds;

    @Column(name = "passed", nullable = false)
    private boolean passed;

    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;
}
