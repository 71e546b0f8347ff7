package uk.gegc.learnhub.features.catalog.domain.model;

public enum CourseStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
}
