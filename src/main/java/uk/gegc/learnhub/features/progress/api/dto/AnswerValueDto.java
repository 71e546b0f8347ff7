package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import uk.gegc.learnhub.features.catalog.domain.model.AnswerKind;

import java.util.List;

@Schema(name = "AnswerValue", description = "Tagged answer: SINGLE carries one value, MULTIPLE one or more")
public record AnswerValueDto(
        @Schema(description = "Answer kind", example = "MULTIPLE", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        AnswerKind kind,
        @Schema(description = "Answer values", example = "[\"a\", \"c\"]", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty
        List<@NotNull String> values
) {
}
