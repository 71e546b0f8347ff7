package uk.gegc.learnhub.features.enrollment.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.enrollment.api.dto.CertificateDto;
import uk.gegc.learnhub.features.enrollment.api.dto.EnrollmentDto;
import uk.gegc.learnhub.features.enrollment.domain.model.CourseEnrollment;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver.CurrentUser;

import java.util.UUID;

public interface EnrollmentService {

    /**
     * Enrolls the user in a published course, or returns the existing enrollment.
     */
    EnrollResult enroll(UUID userId, UUID courseId);

    /**
     * Inserts a new enrollment in its own transaction.
     * A concurrent duplicate surfaces as {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    UUID createEnrollmentTx(UUID userId, UUID courseId, UUID firstLessonId);

    Page<EnrollmentDto> getMyEnrollments(UUID userId, EnrollmentStatus status, Pageable pageable);

    EnrollmentDto getEnrollment(CurrentUser viewer, UUID enrollmentId);

    Page<EnrollmentDto> getCourseEnrollments(CurrentUser viewer, UUID courseId, EnrollmentStatus status, Pageable pageable);

    EnrollmentDto changeStatus(CurrentUser actor, UUID enrollmentId, EnrollmentStatus target);

    CertificateDto issueCertificate(CurrentUser actor, UUID enrollmentId);

    EnrollmentDto rate(CurrentUser actor, UUID enrollmentId, int score, String review);

    /**
     * Loads an enrollment the viewer may read: the owner, the course instructor or an admin.
     */
    CourseEnrollment requireViewableEnrollment(CurrentUser viewer, UUID enrollmentId);

    /**
     * Whether the user may study lessons of the course (ACTIVE or COMPLETED enrollment).
     */
    boolean hasLearningAccess(UUID userId, UUID courseId);

    /**
     * Forwards a completed lesson to the user's enrollment; ignored unless the enrollment is ACTIVE.
     */
    void recordLessonCompletion(UUID userId, Lesson lesson, int watchTimeSeconds, Integer score);
}
