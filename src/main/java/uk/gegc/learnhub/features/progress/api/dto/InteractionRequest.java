package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import uk.gegc.learnhub.features.progress.domain.model.InteractionType;

@Schema(name = "InteractionRequest", description = "Player event")
public record InteractionRequest(
        @Schema(description = "Event type", example = "SEEK", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        InteractionType type,
        @Schema(description = "Playback position when the event happened", example = "42")
        @PositiveOrZero
        Integer positionSeconds,
        @Schema(description = "Event value, e.g. new speed or quality", example = "1.5")
        @Size(max = 100)
        String value
) {
}
