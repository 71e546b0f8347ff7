package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "QuizAnswerRequest", description = "Answer to one quiz question")
public record QuizAnswerRequest(
        @Schema(description = "Question ID", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID questionId,
        @Schema(description = "Submitted answer", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull @Valid
        AnswerValueDto answer
) {
}
