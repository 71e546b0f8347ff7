package uk.gegc.learnhub.features.progress.domain.model;

import uk.gegc.learnhub.features.catalog.domain.model.AnswerValue;

import java.util.UUID;

/**
 * One submitted answer after grading. {@code answer} is null for an unanswered question.
 */
public record GradedAnswer(
        UUID questionId,
        AnswerValue answer,
        boolean correct,
        int pointsAwarded
) {
}
