package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "PlaybackSettingsRequest", description = "Partial playback settings update; null fields are left unchanged")
public record PlaybackSettingsRequest(
        @Schema(description = "Playback speed (0.25 - 4.0)", example = "1.25")
        Double playbackSpeed,
        @Schema(description = "Volume (0.0 - 1.0)", example = "0.8")
        Double volume,
        @Schema(description = "Video quality", example = "720p")
        @Size(max = 20)
        String quality,
        @Schema(description = "Subtitles on or off")
        Boolean subtitlesEnabled,
        @Schema(description = "Subtitles language code", example = "en")
        @Size(max = 10)
        String subtitlesLanguage
) {
}
