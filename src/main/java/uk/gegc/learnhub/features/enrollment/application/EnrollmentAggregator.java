package uk.gegc.learnhub.features.enrollment.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.learnhub.features.catalog.application.CatalogLookup;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.enrollment.domain.model.*;
import uk.gegc.learnhub.shared.exception.InvalidOperationException;
import uk.gegc.learnhub.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Roll-up of lesson completions into a {@link CourseEnrollment}.
 * <p>
 * Completion recording is idempotent per lesson. ACTIVE becomes COMPLETED once the
 * completion percentage reaches 100 and never goes back automatically.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrollmentAggregator {

    private final CatalogLookup catalogLookup;
    private final Clock clock;

    public CourseEnrollment newEnrollment(UUID userId, UUID courseId, UUID firstLessonId) {
        Instant now = clock.instant();
        CourseEnrollment enrollment = new CourseEnrollment();
        enrollment.setUserId(userId);
        enrollment.setCourseId(courseId);
        enrollment.setStatus(EnrollmentStatus.ACTIVE);
        enrollment.setEnrolledAt(now);
        enrollment.setLastAccessedAt(now);
        enrollment.setCurrentLessonId(firstLessonId);
        return enrollment;
    }

    /**
     * Only published lessons count towards completion.
     *
     * @return false when the lesson is unpublished or already recorded and nothing changed
     */
    public boolean markLessonCompleted(CourseEnrollment enrollment, Lesson lesson, int watchTimeSeconds, Integer score) {
        if (!lesson.isPublished()) {
            log.debug("Unpublished lesson not counted enrollmentId={} lessonId={}", enrollment.getId(), lesson.getId());
            return false;
        }
        if (enrollment.hasCompletedLesson(lesson.getId())) {
            log.debug("Lesson already recorded enrollmentId={} lessonId={}", enrollment.getId(), lesson.getId());
            return false;
        }
        enrollment.getCompletedLessons().add(
                new CompletedLesson(lesson.getId(), clock.instant(), watchTimeSeconds, score));
        enrollment.setCurrentLessonId(
                catalogLookup.findNextLessonId(enrollment.getCourseId(), lesson).orElse(null));
        recomputeCompletion(enrollment, catalogLookup.countPublishedLessons(enrollment.getCourseId()));
        return true;
    }

    public void recomputeCompletion(CourseEnrollment enrollment, long publishedLessonCount) {
        if (publishedLessonCount <= 0) {
            return;
        }
        Instant now = clock.instant();
        long percentage = Math.round(100.0 * enrollment.getCompletedLessons().size() / publishedLessonCount);
        enrollment.setCompletionPercentage((int) Math.min(100L, percentage));
        enrollment.setLastAccessedAt(now);

        if (enrollment.getCompletionPercentage() >= 100 && enrollment.getStatus() == EnrollmentStatus.ACTIVE) {
            enrollment.setStatus(EnrollmentStatus.COMPLETED);
            enrollment.setCompletedAt(now);
            log.info("Enrollment completed enrollmentId={} userId={} courseId={}",
                    enrollment.getId(), enrollment.getUserId(), enrollment.getCourseId());
        }
    }

    /**
     * @return the new certificate id, or null when the enrollment is not eligible or already has one
     */
    public String issueCertificate(CourseEnrollment enrollment, boolean courseCertificateEnabled) {
        if (enrollment.getStatus() != EnrollmentStatus.COMPLETED
                || enrollment.isCertificateIssued()
                || !courseCertificateEnabled) {
            return null;
        }
        String certificateId = "CERT-" + clock.millis() + "-" + enrollment.getId();
        enrollment.setCertificateId(certificateId);
        enrollment.setCertificateIssued(true);
        log.info("Certificate issued enrollmentId={} certificateId={}", enrollment.getId(), certificateId);
        return certificateId;
    }

    public void changeStatus(CourseEnrollment enrollment, EnrollmentStatus target) {
        EnrollmentStatus current = enrollment.getStatus();
        if (!EnrollmentStateMachine.isValidTransition(current, target)) {
            throw new InvalidOperationException("Cannot change enrollment status from " + current + " to " + target);
        }
        enrollment.setStatus(target);
        enrollment.setLastAccessedAt(clock.instant());
        log.info("Enrollment status changed enrollmentId={} from={} to={}", enrollment.getId(), current, target);
    }

    public void rate(CourseEnrollment enrollment, int score, String review) {
        if (score < 1 || score > 5) {
            throw new ValidationException("Rating score must be between 1 and 5");
        }
        EnrollmentStatus status = enrollment.getStatus();
        if (status != EnrollmentStatus.ACTIVE && status != EnrollmentStatus.COMPLETED) {
            throw new InvalidOperationException("Only active or completed enrollments can be rated");
        }
        enrollment.setRating(new EnrollmentRating(score, review, clock.instant()));
    }
}
