package uk.gegc.learnhub.features.progress.domain.model;

import java.time.Instant;

public record PlaybackInteraction(
        InteractionType type,
        Instant occurredAt,
        Integer positionSeconds,
        String value
) {
}
