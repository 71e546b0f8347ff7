package uk.gegc.learnhub.features.enrollment.api.dto;

import java.time.Instant;

public record RatingDto(int score, String review, Instant ratedAt) {
}
