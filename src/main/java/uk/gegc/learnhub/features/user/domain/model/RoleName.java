package uk.gegc.learnhub.features.user.domain.model;

public enum RoleName {
    STUDENT,
    INSTRUCTOR,
    ADMIN;

    public String authority() {
        return "ROLE_" + name();
    }
}
