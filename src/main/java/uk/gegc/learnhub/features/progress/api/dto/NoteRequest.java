package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record NoteRequest(
        @Schema(description = "Note text", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank @Size(max = 2000)
        String content,
        @Schema(description = "Playback position the note refers to", example = "300")
        @PositiveOrZero
        Integer positionSeconds,
        @Schema(description = "Whether the note is private (default true)")
        Boolean isPrivate
) {
}
