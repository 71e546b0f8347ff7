package uk.gegc.learnhub.features.progress.application;

import uk.gegc.learnhub.features.progress.domain.model.GradedAnswer;

import java.util.List;

public record QuizGrade(
        List<GradedAnswer> answers,
        int score,
        int totalPoints,
        int percentage
) {
}
