package uk.gegc.learnhub.features.enrollment.api.dto;

import java.time.Instant;
import java.util.UUID;

public record CompletedLessonDto(UUID lessonId, Instant completedAt, int watchTimeSeconds, Integer score) {
}
