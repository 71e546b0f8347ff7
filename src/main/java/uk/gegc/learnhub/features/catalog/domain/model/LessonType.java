package uk.gegc.learnhub.features.catalog.domain.model;

public enum LessonType {
    VIDEO,
    TEXT,
    QUIZ,
    ASSIGNMENT,
    LIVE
}
