package uk.gegc.learnhub.features.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "quiz_questions")
public class QuizQuestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "question_id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "lesson_id", nullable = false)
    private Lesson lesson;

    @Column(name = "question_order", nullable = false)
    private int questionOrder;

    @Column(name = "prompt", nullable = false, length = 1000)
    private String prompt;

    @Column(name = "points")
    private Integer points;

    @Convert(converter = AnswerValueConverter.class)
    @Column(name = "correct_answer", nullable = false, columnDefinition = "TEXT")
    private AnswerValue correctAnswer;

    public int effectivePoints() {
        return points != null ? points : 1;
    }
}
