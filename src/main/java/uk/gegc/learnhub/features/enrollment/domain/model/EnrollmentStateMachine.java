package uk.gegc.learnhub.features.enrollment.domain.model;

import java.util.Set;

/**
 * Manually requested enrollment status changes. COMPLETED is reached only through
 * lesson completion and is terminal.
 */
public enum EnrollmentStateMachine {
    ACTIVE(Set.of(EnrollmentStatus.DROPPED, EnrollmentStatus.SUSPENDED)),
    COMPLETED(Set.of()),
    DROPPED(Set.of(EnrollmentStatus.ACTIVE)),
    SUSPENDED(Set.of(EnrollmentStatus.ACTIVE));

    private final Set<EnrollmentStatus> allowedTransitions;

    EnrollmentStateMachine(Set<EnrollmentStatus> allowedTransitions) {
        this.allowedTransitions = allowedTransitions;
    }

    public boolean canTransitionTo(EnrollmentStatus targetStatus) {
        if (targetStatus == null) {
            return false;
        }
        return allowedTransitions.contains(targetStatus);
    }

    public static boolean isValidTransition(EnrollmentStatus from, EnrollmentStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return EnrollmentStateMachine.valueOf(from.name()).canTransitionTo(to);
    }
}
