package uk.gegc.learnhub.features.progress.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnhub.features.progress.api.dto.*;
import uk.gegc.learnhub.features.progress.application.LessonProgressService;
import uk.gegc.learnhub.features.progress.infra.mapping.LessonProgressMapper;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver;

import java.util.UUID;

@Tag(name = "Lesson Progress", description = "Watch time, quiz attempts, bookmarks, notes and player state for the current user")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1/lessons/{lessonId}/progress")
@RequiredArgsConstructor
@Validated
public class LessonProgressController {

    private final LessonProgressService progressService;
    private final LessonProgressMapper progressMapper;
    private final AuthenticatedUserResolver userResolver;

    @GetMapping
    @Operation(summary = "Get my progress in a lesson", description = "Creates a NOT_STARTED record on first access.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lesson progress",
                    content = @Content(schema = @Schema(implementation = LessonProgressDto.class))),
            @ApiResponse(responseCode = "403", description = "Not enrolled in the course",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Lesson not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<LessonProgressDto> getProgress(
            @PathVariable UUID lessonId,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        return ResponseEntity.ok(progressService.getProgress(userId, lessonId));
    }

    @PostMapping("/watch-time")
    @Operation(
            summary = "Report video playback",
            description = "Raises the watch-time high-water mark and accumulates elapsed time. Completes the lesson once the required share is watched."
    )
    public ResponseEntity<LessonProgressDto> recordWatchTime(
            @PathVariable UUID lessonId,
            @Valid @RequestBody WatchTimeRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        return ResponseEntity.ok(progressService.recordWatchTime(userId, lessonId,
                request.positionSeconds(), request.elapsedSeconds()));
    }

    @PostMapping("/quiz-attempts")
    @Operation(summary = "Submit a quiz attempt", description = "Grades the answers and records the attempt.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Attempt graded",
                    content = @Content(schema = @Schema(implementation = QuizAttemptResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Unknown or duplicate question",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Lesson is not a quiz",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<QuizAttemptResultDto> recordQuizAttempt(
            @PathVariable UUID lessonId,
            @Valid @RequestBody QuizAttemptRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        QuizAttemptResultDto result = progressService.recordQuizAttempt(userId, lessonId,
                progressMapper.toSubmittedAnswers(request), request.timeSpentSeconds());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PutMapping("/status")
    @Operation(summary = "Report lesson status", description = "IN_PROGRESS or COMPLETED; quiz lessons complete only by passing.")
    public ResponseEntity<LessonProgressDto> updateStatus(
            @PathVariable UUID lessonId,
            @Valid @RequestBody ProgressStatusRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        return ResponseEntity.ok(progressService.updateStatus(userId, lessonId, request.status()));
    }

    @PostMapping("/bookmarks")
    @Operation(summary = "Add a bookmark")
    public ResponseEntity<BookmarkDto> addBookmark(
            @PathVariable UUID lessonId,
            @Valid @RequestBody BookmarkRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        BookmarkDto bookmark = progressService.addBookmark(userId, lessonId, request.positionSeconds(), request.note());
        return ResponseEntity.status(HttpStatus.CREATED).body(bookmark);
    }

    @DeleteMapping("/bookmarks/{bookmarkId}")
    @Operation(summary = "Remove a bookmark")
    public ResponseEntity<Void> removeBookmark(
            @PathVariable UUID lessonId,
            @PathVariable UUID bookmarkId,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        progressService.removeBookmark(userId, lessonId, bookmarkId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/notes")
    @Operation(summary = "Add a note")
    public ResponseEntity<NoteDto> addNote(
            @PathVariable UUID lessonId,
            @Valid @RequestBody NoteRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        NoteDto note = progressService.addNote(userId, lessonId, request.content(), request.positionSeconds(), request.isPrivate());
        return ResponseEntity.status(HttpStatus.CREATED).body(note);
    }

    @PutMapping("/notes/{noteId}")
    @Operation(summary = "Edit a note")
    public ResponseEntity<NoteDto> updateNote(
            @PathVariable UUID lessonId,
            @PathVariable UUID noteId,
            @Valid @RequestBody NoteUpdateRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        return ResponseEntity.ok(progressService.updateNote(userId, lessonId, noteId, request.content()));
    }

    @PostMapping("/interactions")
    @Operation(summary = "Record a player event", description = "Only the most recent events are kept.")
    public ResponseEntity<Void> recordInteraction(
            @PathVariable UUID lessonId,
            @Valid @RequestBody InteractionRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        progressService.recordInteraction(userId, lessonId, request.type(), request.positionSeconds(), request.value());
        return ResponseEntity.accepted().build();
    }

    @PutMapping("/settings")
    @Operation(summary = "Update playback settings", description = "Null fields keep their current value.")
    public ResponseEntity<PlaybackSettingsDto> updateSettings(
            @PathVariable UUID lessonId,
            @Valid @RequestBody PlaybackSettingsRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolve(authentication).id();
        return ResponseEntity.ok(progressService.updateSettings(userId, lessonId, request));
    }
}
