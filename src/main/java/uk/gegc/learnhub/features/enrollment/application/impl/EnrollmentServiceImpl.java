package uk.gegc.learnhub.features.enrollment.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.catalog.application.CatalogLookup;
import uk.gegc.learnhub.features.catalog.domain.model.Course;
import uk.gegc.learnhub.features.catalog.domain.model.CourseStatus;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.catalog.domain.model.LessonType;
import uk.gegc.learnhub.features.enrollment.api.dto.CertificateDto;
import uk.gegc.learnhub.features.enrollment.api.dto.EnrollmentDto;
import uk.gegc.learnhub.features.enrollment.application.CertificateOutcome;
import uk.gegc.learnhub.features.enrollment.application.EnrollResult;
import uk.gegc.learnhub.features.enrollment.application.EnrollmentAggregator;
import uk.gegc.learnhub.features.enrollment.application.EnrollmentService;
import uk.gegc.learnhub.features.enrollment.domain.model.CourseEnrollment;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;
import uk.gegc.learnhub.features.enrollment.domain.repository.CourseEnrollmentRepository;
import uk.gegc.learnhub.features.enrollment.infra.mapping.EnrollmentMapper;
import uk.gegc.learnhub.features.progress.domain.model.LessonProgress;
import uk.gegc.learnhub.features.progress.domain.repository.LessonProgressRepository;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver.CurrentUser;
import uk.gegc.learnhub.shared.exception.InvalidOperationException;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;
import uk.gegc.learnhub.shared.metrics.LearningMetricsService;
import uk.gegc.learnhub.shared.persistence.UniqueConstraints;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional
public class EnrollmentServiceImpl implements EnrollmentService {

    private static final EnumSet<EnrollmentStatus> LEARNING_STATUSES =
            EnumSet.of(EnrollmentStatus.ACTIVE, EnrollmentStatus.COMPLETED);

    private final CourseEnrollmentRepository enrollmentRepository;
    private final LessonProgressRepository progressRepository;
    private final CatalogLookup catalogLookup;
    private final EnrollmentAggregator aggregator;
    private final EnrollmentMapper enrollmentMapper;
    private final LearningMetricsService metricsService;
    private final EnrollmentService self;

    public EnrollmentServiceImpl(
            CourseEnrollmentRepository enrollmentRepository,
            LessonProgressRepository progressRepository,
            CatalogLookup catalogLookup,
            EnrollmentAggregator aggregator,
            EnrollmentMapper enrollmentMapper,
            LearningMetricsService metricsService,
            @Lazy EnrollmentService self
    ) {
        this.enrollmentRepository = enrollmentRepository;
        this.progressRepository = progressRepository;
        this.catalogLookup = catalogLookup;
        this.aggregator = aggregator;
        this.enrollmentMapper = enrollmentMapper;
        this.metricsService = metricsService;
        this.self = self;
    }

    @Override
    public EnrollResult enroll(UUID userId, UUID courseId) {
        Course course = catalogLookup.requireCourse(courseId);
        if (course.getStatus() != CourseStatus.PUBLISHED) {
            throw new InvalidOperationException("Course " + courseId + " is not open for enrollment");
        }

        Optional<CourseEnrollment> existing = enrollmentRepository.findByUserIdAndCourseId(userId, courseId);
        if (existing.isPresent()) {
            log.debug("Already enrolled userId={} courseId={}", userId, courseId);
            return new EnrollResult(enrollmentMapper.toDto(existing.get()), false);
        }

        UUID firstLessonId = catalogLookup.findFirstPublishedLessonId(courseId).orElse(null);
        boolean created;
        try {
            self.createEnrollmentTx(userId, courseId, firstLessonId);
            created = true;
        } catch (DataIntegrityViolationException e) {
            if (!UniqueConstraints.isViolationOf(e, UniqueConstraints.ENROLLMENT_USER_COURSE)) {
                throw e;
            }
            log.info("Concurrent enrollment resolved to existing row userId={} courseId={}", userId, courseId);
            metricsService.incrementConflictRecovered("enrollment");
            created = false;
        }

        CourseEnrollment enrollment = enrollmentRepository.findLockedByUserIdAndCourseId(userId, courseId)
                .orElseThrow(() -> new IllegalStateException(
                        "Enrollment for user " + userId + " in course " + courseId + " missing after create"));
        if (created) {
            metricsService.incrementEnrollmentCreated(userId, courseId);
            backfillCompletions(enrollment);
        }
        return new EnrollResult(enrollmentMapper.toDto(enrollment), created);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID createEnrollmentTx(UUID userId, UUID courseId, UUID firstLessonId) {
        CourseEnrollment enrollment = aggregator.newEnrollment(userId, courseId, firstLessonId);
        CourseEnrollment saved = enrollmentRepository.saveAndFlush(enrollment);
        log.info("Enrollment created enrollmentId={} userId={} courseId={}", saved.getId(), userId, courseId);
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Page<EnrollmentDto> getMyEnrollments(UUID userId, EnrollmentStatus status, Pageable pageable) {
        Page<CourseEnrollment> page = status == null
                ? enrollmentRepository.findByUserId(userId, pageable)
                : enrollmentRepository.findByUserIdAndStatus(userId, status, pageable);
        return page.map(enrollmentMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public EnrollmentDto getEnrollment(CurrentUser viewer, UUID enrollmentId) {
        return enrollmentMapper.toDto(requireViewableEnrollment(viewer, enrollmentId));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<EnrollmentDto> getCourseEnrollments(CurrentUser viewer, UUID courseId, EnrollmentStatus status, Pageable pageable) {
        Course course = catalogLookup.requireCourse(courseId);
        if (!isCourseStaff(viewer, course)) {
            throw new AccessDeniedException("Only the course instructor or an admin can list its enrollments");
        }
        Page<CourseEnrollment> page = status == null
                ? enrollmentRepository.findByCourseId(courseId, pageable)
                : enrollmentRepository.findByCourseIdAndStatus(courseId, status, pageable);
        return page.map(enrollmentMapper::toDto);
    }

    @Override
    public EnrollmentDto changeStatus(CurrentUser actor, UUID enrollmentId, EnrollmentStatus target) {
        if (target == EnrollmentStatus.COMPLETED) {
            throw new InvalidOperationException("Enrollments complete automatically when every lesson is completed");
        }
        CourseEnrollment enrollment = requireEnrollment(enrollmentId);
        Course course = catalogLookup.requireCourse(enrollment.getCourseId());
        boolean owner = enrollment.getUserId().equals(actor.id());

        switch (target) {
            case DROPPED -> {
                if (!owner && !actor.isAdmin()) {
                    throw new AccessDeniedException("Only the learner can drop an enrollment");
                }
            }
            case SUSPENDED -> {
                if (!isCourseStaff(actor, course)) {
                    throw new AccessDeniedException("Only the course instructor or an admin can suspend an enrollment");
                }
            }
            case ACTIVE -> {
                if (!actor.isAdmin()) {
                    throw new AccessDeniedException("Only an admin can reactivate an enrollment");
                }
            }
            default -> throw new InvalidOperationException("Unsupported status " + target);
        }

        aggregator.changeStatus(enrollment, target);
        return enrollmentMapper.toDto(enrollmentRepository.save(enrollment));
    }

    @Override
    public CertificateDto issueCertificate(CurrentUser actor, UUID enrollmentId) {
        CourseEnrollment enrollment = requireEnrollment(enrollmentId);
        if (!enrollment.getUserId().equals(actor.id()) && !actor.isAdmin()) {
            throw new AccessDeniedException("Only the learner can request this certificate");
        }
        Course course = catalogLookup.requireCourse(enrollment.getCourseId());

        boolean alreadyIssued = enrollment.isCertificateIssued();
        String certificateId = aggregator.issueCertificate(enrollment, course.isCertificateEnabled());
        if (certificateId != null) {
            enrollmentRepository.save(enrollment);
            metricsService.incrementCertificateIssued(enrollment.getId());
            return new CertificateDto(enrollment.getId(), CertificateOutcome.ISSUED, certificateId, null);
        }
        if (alreadyIssued) {
            return new CertificateDto(enrollment.getId(), CertificateOutcome.ALREADY_ISSUED, enrollment.getCertificateId(), null);
        }
        String reason = enrollment.getStatus() != EnrollmentStatus.COMPLETED
                ? "Course has not been completed yet"
                : "Certificates are not enabled for this course";
        return new CertificateDto(enrollment.getId(), CertificateOutcome.NOT_ELIGIBLE, null, reason);
    }

    @Override
    public EnrollmentDto rate(CurrentUser actor, UUID enrollmentId, int score, String review) {
        CourseEnrollment enrollment = requireEnrollment(enrollmentId);
        if (!enrollment.getUserId().equals(actor.id())) {
            throw new AccessDeniedException("Only the learner can rate this course");
        }
        aggregator.rate(enrollment, score, review);
        return enrollmentMapper.toDto(enrollmentRepository.save(enrollment));
    }

    @Override
    @Transactional(readOnly = true)
    public CourseEnrollment requireViewableEnrollment(CurrentUser viewer, UUID enrollmentId) {
        CourseEnrollment enrollment = requireEnrollment(enrollmentId);
        if (enrollment.getUserId().equals(viewer.id()) || viewer.isAdmin()) {
            return enrollment;
        }
        Course course = catalogLookup.requireCourse(enrollment.getCourseId());
        if (!isCourseStaff(viewer, course)) {
            throw new AccessDeniedException("You do not have access to this enrollment");
        }
        return enrollment;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasLearningAccess(UUID userId, UUID courseId) {
        return enrollmentRepository.existsByUserIdAndCourseIdAndStatusIn(userId, courseId, LEARNING_STATUSES);
    }

    @Override
    public void recordLessonCompletion(UUID userId, Lesson lesson, int watchTimeSeconds, Integer score) {
        UUID courseId = lesson.getCourseId();
        Optional<CourseEnrollment> found = enrollmentRepository.findLockedByUserIdAndCourseId(userId, courseId);
        if (found.isEmpty() || found.get().getStatus() != EnrollmentStatus.ACTIVE) {
            log.debug("No active enrollment to roll up userId={} courseId={} lessonId={}", userId, courseId, lesson.getId());
            return;
        }
        CourseEnrollment enrollment = found.get();
        if (!aggregator.markLessonCompleted(enrollment, lesson, watchTimeSeconds, score)) {
            return;
        }
        enrollmentRepository.save(enrollment);
        if (enrollment.getStatus() == EnrollmentStatus.COMPLETED) {
            metricsService.incrementEnrollmentCompleted(userId, courseId);
        }
    }

    /**
     * Rolls up lessons the learner completed before enrolling, such as previews.
     */
    private void backfillCompletions(CourseEnrollment enrollment) {
        Map<UUID, LessonProgress> completedByLesson = progressRepository
                .findByUserIdAndCourseId(enrollment.getUserId(), enrollment.getCourseId()).stream()
                .filter(LessonProgress::isCompleted)
                .collect(Collectors.toMap(LessonProgress::getLessonId, Function.identity()));
        if (completedByLesson.isEmpty()) {
            return;
        }

        int backfilled = 0;
        List<Lesson> lessons = catalogLookup.listPublishedLessons(enrollment.getCourseId());
        for (Lesson lesson : lessons) {
            LessonProgress progress = completedByLesson.get(lesson.getId());
            if (progress == null) {
                continue;
            }
            Integer score = lesson.getType() == LessonType.QUIZ ? progress.getHighestScore() : null;
            if (aggregator.markLessonCompleted(enrollment, lesson, progress.getWatchTimeSeconds(), score)) {
                backfilled++;
            }
        }
        if (backfilled == 0) {
            return;
        }

        enrollmentRepository.save(enrollment);
        log.info("Backfilled {} completed lessons enrollmentId={} userId={} courseId={}",
                backfilled, enrollment.getId(), enrollment.getUserId(), enrollment.getCourseId());
        if (enrollment.getStatus() == EnrollmentStatus.COMPLETED) {
            metricsService.incrementEnrollmentCompleted(enrollment.getUserId(), enrollment.getCourseId());
        }
    }

    private CourseEnrollment requireEnrollment(UUID enrollmentId) {
        return enrollmentRepository.findById(enrollmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Enrollment " + enrollmentId + " not found"));
    }

    private boolean isCourseStaff(CurrentUser user, Course course) {
        return user.isAdmin() || (user.isStaff() && course.getInstructorId().equals(user.id()));
    }
}
