package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.learnhub.features.progress.domain.model.ProgressStatus;

@Schema(name = "ProgressStatusRequest", description = "Explicit status report for a non-quiz lesson")
public record ProgressStatusRequest(
        @Schema(description = "IN_PROGRESS or COMPLETED", example = "COMPLETED", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        ProgressStatus status
) {
}
