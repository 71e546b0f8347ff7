package uk.gegc.learnhub.features.catalog.domain.model;

public enum AnswerKind {
    SINGLE,
    MULTIPLE
}
