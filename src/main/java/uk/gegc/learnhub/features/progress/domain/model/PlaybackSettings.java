package uk.gegc.learnhub.features.progress.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
public class PlaybackSettings {

    @Column(name = "playback_speed", nullable = false)
    private double playbackSpeed = 1.0d;

    @Column(name = "volume", nullable = false)
    private double volume = 1.0d;

    @Column(name = "quality", nullable = false, length = 20)
    private String quality = "auto";

    @Column(name = "subtitles_enabled", nullable = false)
    private boolean subtitlesEnabled = false;

    @Column(name = "subtitles_language", nullable = false, length = 10)
    private String subtitlesLanguage = "en";
}
