package uk.gegc.learnhub.features.enrollment.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.learnhub.features.enrollment.api.dto.CompletedLessonDto;
import uk.gegc.learnhub.features.enrollment.api.dto.EnrollmentDto;
import uk.gegc.learnhub.features.enrollment.api.dto.RatingDto;
import uk.gegc.learnhub.features.enrollment.domain.model.CourseEnrollment;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentRating;

import java.util.List;

@Component
public class EnrollmentMapper {

    public EnrollmentDto toDto(CourseEnrollment enrollment) {
        List<CompletedLessonDto> completed = enrollment.getCompletedLessons().stream()
                .map(c -> new CompletedLessonDto(c.getLessonId(), c.getCompletedAt(), c.getWatchTimeSeconds(), c.getScore()))
                .toList();

        return new EnrollmentDto(
                enrollment.getId(),
                enrollment.getUserId(),
                enrollment.getCourseId(),
                enrollment.getStatus(),
                enrollment.getEnrolledAt(),
                enrollment.getCurrentLessonId(),
                enrollment.getCompletionPercentage(),
                enrollment.getLastAccessedAt(),
                enrollment.getCompletedAt(),
                enrollment.isCertificateIssued(),
                enrollment.getCertificateId(),
                completed,
                toDto(enrollment.getRating())
        );
    }

    private RatingDto toDto(EnrollmentRating rating) {
        if (rating == null || rating.getScore() == null) {
            return null;
        }
        return new RatingDto(rating.getScore(), rating.getReview(), rating.getRatedAt());
    }
}
