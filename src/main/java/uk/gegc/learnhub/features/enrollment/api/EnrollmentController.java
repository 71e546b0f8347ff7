package uk.gegc.learnhub.features.enrollment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnhub.features.enrollment.api.dto.*;
import uk.gegc.learnhub.features.enrollment.application.EnrollResult;
import uk.gegc.learnhub.features.enrollment.application.EnrollmentService;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver.CurrentUser;

import java.util.UUID;

@Tag(name = "Enrollments", description = "Course enrollment, status changes, certificates and ratings")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1/enrollments")
@RequiredArgsConstructor
@Validated
public class EnrollmentController {

    private final EnrollmentService enrollmentService;
    private final AuthenticatedUserResolver userResolver;

    @PostMapping
    @Operation(
            summary = "Enroll in a course",
            description = "Creates an ACTIVE enrollment in a published course. Enrolling twice returns the existing enrollment with 200."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Enrollment created",
                    content = @Content(schema = @Schema(implementation = EnrollmentDto.class))),
            @ApiResponse(responseCode = "200", description = "Already enrolled",
                    content = @Content(schema = @Schema(implementation = EnrollmentDto.class))),
            @ApiResponse(responseCode = "404", description = "Course not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Course not published",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<EnrollmentDto> enroll(
            @Valid @RequestBody EnrollRequest request,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        EnrollResult result = enrollmentService.enroll(user.id(), request.courseId());
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result.enrollment());
    }

    @GetMapping("/my")
    @Operation(summary = "List my enrollments", description = "Optionally filtered by status, newest first.")
    public ResponseEntity<Page<EnrollmentDto>> getMyEnrollments(
            @Parameter(description = "Status filter") @RequestParam(required = false) EnrollmentStatus status,
            @ParameterObject @PageableDefault(size = 20, sort = "enrolledAt", direction = Sort.Direction.DESC) Pageable pageable,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        return ResponseEntity.ok(enrollmentService.getMyEnrollments(user.id(), status, pageable));
    }

    @GetMapping("/{enrollmentId}")
    @Operation(summary = "Get an enrollment", description = "Visible to the learner, the course instructor and admins.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Enrollment"),
            @ApiResponse(responseCode = "403", description = "Not allowed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Enrollment not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<EnrollmentDto> getEnrollment(
            @PathVariable UUID enrollmentId,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        return ResponseEntity.ok(enrollmentService.getEnrollment(user, enrollmentId));
    }

    @GetMapping("/course/{courseId}")
    @Operation(summary = "List enrollments of a course", description = "Course instructor or admin only.")
    public ResponseEntity<Page<EnrollmentDto>> getCourseEnrollments(
            @PathVariable UUID courseId,
            @Parameter(description = "Status filter") @RequestParam(required = false) EnrollmentStatus status,
            @ParameterObject @PageableDefault(size = 20, sort = "enrolledAt", direction = Sort.Direction.DESC) Pageable pageable,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        return ResponseEntity.ok(enrollmentService.getCourseEnrollments(user, courseId, status, pageable));
    }

    @PutMapping("/{enrollmentId}/status")
    @Operation(
            summary = "Change enrollment status",
            description = "DROPPED by the learner, SUSPENDED by the course instructor or an admin, ACTIVE by an admin. COMPLETED cannot be requested."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "403", description = "Not allowed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Transition not allowed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<EnrollmentDto> changeStatus(
            @PathVariable UUID enrollmentId,
            @Valid @RequestBody EnrollmentStatusRequest request,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        return ResponseEntity.ok(enrollmentService.changeStatus(user, enrollmentId, request.status()));
    }

    @PostMapping("/{enrollmentId}/certificate")
    @Operation(
            summary = "Request the course certificate",
            description = "Issues a certificate once per completed enrollment. Repeated calls report ALREADY_ISSUED."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Certificate issued",
                    content = @Content(schema = @Schema(implementation = CertificateDto.class))),
            @ApiResponse(responseCode = "200", description = "Certificate was already issued",
                    content = @Content(schema = @Schema(implementation = CertificateDto.class))),
            @ApiResponse(responseCode = "409", description = "Not eligible",
                    content = @Content(schema = @Schema(implementation = CertificateDto.class)))
    })
    public ResponseEntity<CertificateDto> issueCertificate(
            @PathVariable UUID enrollmentId,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        CertificateDto certificate = enrollmentService.issueCertificate(user, enrollmentId);
        HttpStatus status = switch (certificate.outcome()) {
            case ISSUED -> HttpStatus.CREATED;
            case ALREADY_ISSUED -> HttpStatus.OK;
            case NOT_ELIGIBLE -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(certificate);
    }

    @PutMapping("/{enrollmentId}/rating")
    @Operation(summary = "Rate the course", description = "Learners with an active or completed enrollment rate 1-5.")
    public ResponseEntity<EnrollmentDto> rate(
            @PathVariable UUID enrollmentId,
            @Valid @RequestBody RatingRequest request,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        return ResponseEntity.ok(enrollmentService.rate(user, enrollmentId, request.score(), request.review()));
    }
}
