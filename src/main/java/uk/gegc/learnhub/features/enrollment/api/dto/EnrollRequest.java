package uk.gegc.learnhub.features.enrollment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "EnrollRequest", description = "Enroll the caller in a published course")
public record EnrollRequest(
        @Schema(description = "Course ID", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID courseId
) {
}
