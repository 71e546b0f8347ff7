package uk.gegc.learnhub.features.progress.api.dto;

import java.time.Instant;
import java.util.UUID;

public record NoteDto(
        UUID id,
        String content,
        Integer positionSeconds,
        boolean isPrivate,
        Instant createdAt,
        Instant updatedAt
) {
}
