package uk.gegc.learnhub.features.enrollment.application;

public enum CertificateOutcome {
    ISSUED,
    ALREADY_ISSUED,
    NOT_ELIGIBLE
}
