package uk.gegc.learnhub.features.progress.domain.model;

import uk.gegc.learnhub.features.catalog.domain.model.AnswerValue;

import java.util.UUID;

public record SubmittedAnswer(UUID questionId, AnswerValue answer) {
}
