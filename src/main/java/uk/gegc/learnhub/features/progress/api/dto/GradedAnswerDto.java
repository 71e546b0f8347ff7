package uk.gegc.learnhub.features.progress.api.dto;

import java.util.UUID;

public record GradedAnswerDto(
        UUID questionId,
        AnswerValueDto answer,
        boolean correct,
        int pointsAwarded
) {
}
