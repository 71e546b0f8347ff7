package uk.gegc.learnhub.features.enrollment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;

@Schema(name = "EnrollmentStatusRequest", description = "Requested status: DROPPED (owner), SUSPENDED (instructor/admin) or ACTIVE (admin reactivation)")
public record EnrollmentStatusRequest(
        @Schema(description = "Target status", example = "DROPPED", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        EnrollmentStatus status
) {
}
