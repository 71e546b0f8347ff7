package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record BookmarkRequest(
        @Schema(description = "Playback position in seconds", example = "125", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull @PositiveOrZero
        Integer positionSeconds,
        @Schema(description = "Optional label", example = "Definition of a monad")
        @Size(max = 500)
        String note
) {
}
