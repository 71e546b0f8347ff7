package uk.gegc.learnhub.features.enrollment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.learnhub.features.enrollment.application.CertificateOutcome;

import java.util.UUID;

@Schema(name = "CertificateDto", description = "Outcome of a certificate request")
public record CertificateDto(
        UUID enrollmentId,
        CertificateOutcome outcome,
        @Schema(description = "Certificate ID; null when not eligible")
        String certificateId,
        @Schema(description = "Why the enrollment is not eligible")
        String reason
) {
}
