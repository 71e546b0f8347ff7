package uk.gegc.learnhub.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

@Schema(name = "QuizAttemptRequest", description = "Quiz submission; unanswered questions score zero")
public record QuizAttemptRequest(
        @Schema(description = "Answers keyed by question ID", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        List<@Valid @NotNull QuizAnswerRequest> answers,
        @Schema(description = "Time spent on the attempt in seconds", example = "95")
        @PositiveOrZero
        Integer timeSpentSeconds
) {
}
