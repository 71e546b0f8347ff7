package uk.gegc.learnhub.features.enrollment.domain.model;

public enum EnrollmentStatus {
    ACTIVE,
    COMPLETED,
    DROPPED,
    SUSPENDED
}
