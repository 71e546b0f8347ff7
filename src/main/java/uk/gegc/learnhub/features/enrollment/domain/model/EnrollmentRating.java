package uk.gegc.learnhub.features.enrollment.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EnrollmentRating {

    @Column(name = "rating_score")
    private Integer score;

    @Column(name = "rating_review", length = 1000)
    private String review;

    @Column(name = "rated_at")
    private Instant ratedAt;
}
