package uk.gegc.learnhub.features.progress.api.dto;

import java.time.Instant;
import java.util.UUID;

public record BookmarkDto(UUID id, int positionSeconds, String note, Instant createdAt) {
}
