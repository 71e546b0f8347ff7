package uk.gegc.learnhub.features.progress.api.dto;

public record PlaybackSettingsDto(
        double playbackSpeed,
        double volume,
        String quality,
        boolean subtitlesEnabled,
        String subtitlesLanguage
) {
}
