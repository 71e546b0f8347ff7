package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(name = "WatchTimeRequest", description = "Playback report for a video lesson")
public record WatchTimeRequest(
        @Schema(description = "Furthest playback position reached, in seconds", example = "240", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull @PositiveOrZero
        Integer positionSeconds,
        @Schema(description = "Seconds watched since the previous report", example = "30", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull @PositiveOrZero
        Integer elapsedSeconds
) {
}
