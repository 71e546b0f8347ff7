package uk.gegc.learnhub.features.analytics.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnhub.features.analytics.api.dto.CourseEnrollmentStatsDto;
import uk.gegc.learnhub.features.analytics.api.dto.CourseProgressSummaryDto;
import uk.gegc.learnhub.features.analytics.api.dto.EnrollmentStatsDto;
import uk.gegc.learnhub.features.analytics.api.dto.LearningAnalyticsDto;
import uk.gegc.learnhub.features.analytics.application.LearningAnalyticsService;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver.CurrentUser;

import java.time.LocalDate;
import java.util.UUID;

@Tag(name = "Learning Analytics", description = "Read-only progress summaries and enrollment statistics")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class LearningAnalyticsController {

    private final LearningAnalyticsService analyticsService;
    private final AuthenticatedUserResolver userResolver;

    @GetMapping("/progress/courses/{courseId}/summary")
    @Operation(summary = "My progress in a course", description = "Per-lesson status over the published lessons of the course.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Course summary",
                    content = @Content(schema = @Schema(implementation = CourseProgressSummaryDto.class))),
            @ApiResponse(responseCode = "404", description = "Course not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CourseProgressSummaryDto> getCourseSummary(
            @PathVariable UUID courseId,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        return ResponseEntity.ok(analyticsService.getCourseSummary(userId, courseId));
    }

    @GetMapping("/progress/analytics")
    @Operation(summary = "My daily learning activity", description = "Defaults to the last 30 days.")
    public ResponseEntity<LearningAnalyticsDto> getLearningAnalytics(
            @Parameter(description = "First day, inclusive (ISO date)", example = "2025-01-01")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @Parameter(description = "Last day, inclusive (ISO date)", example = "2025-01-31")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        return ResponseEntity.ok(analyticsService.getLearningAnalytics(userId, from, to));
    }

    @GetMapping("/enrollments/{enrollmentId}/stats")
    @Operation(summary = "Completion statistics of an enrollment")
    public ResponseEntity<EnrollmentStatsDto> getEnrollmentStats(
            @PathVariable UUID enrollmentId,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        return ResponseEntity.ok(analyticsService.getEnrollmentStats(user, enrollmentId));
    }

    @GetMapping("/courses/{courseId}/enrollment-stats")
    @PreAuthorize("hasAnyRole('INSTRUCTOR', 'ADMIN')")
    @Operation(summary = "Enrollment statistics of a course", description = "Course instructor or admin only.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Course enrollment statistics"),
            @ApiResponse(responseCode = "403", description = "Not the course instructor",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CourseEnrollmentStatsDto> getCourseEnrollmentStats(
            @PathVariable UUID courseId,
            Authentication authentication
    ) {
        CurrentUser user = userResolver.resolve(authentication);
        return ResponseEntity.ok(analyticsService.getCourseEnrollmentStats(user, courseId));
    }
}
