package uk.gegc.learnhub.features.enrollment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RatingRequest(
        @Schema(description = "Rating from 1 to 5", example = "4", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull @Min(1) @Max(5)
        Integer score,
        @Schema(description = "Optional review text")
        @Size(max = 1000)
        String review
) {
}
