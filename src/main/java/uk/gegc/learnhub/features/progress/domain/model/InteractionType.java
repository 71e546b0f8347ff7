package uk.gegc.learnhub.features.progress.domain.model;

public enum InteractionType {
    PLAY,
    PAUSE,
    SEEK,
    SPEED_CHANGE,
    QUALITY_CHANGE,
    FULLSCREEN
}
