package uk.gegc.learnhub.features.enrollment.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.access.AccessDeniedException;
import uk.gegc.learnhub.BaseUnitTest;
import uk.gegc.learnhub.features.catalog.application.CatalogLookup;
import uk.gegc.learnhub.features.catalog.domain.model.Course;
import uk.gegc.learnhub.features.catalog.domain.model.CourseStatus;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
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
import uk.gegc.learnhub.features.progress.domain.model.ProgressStatus;
import uk.gegc.learnhub.features.progress.domain.repository.LessonProgressRepository;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver.CurrentUser;
import uk.gegc.learnhub.features.user.domain.model.RoleName;
import uk.gegc.learnhub.shared.exception.InvalidOperationException;
import uk.gegc.learnhub.shared.metrics.LearningMetricsService;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static uk.gegc.learnhub.testsupport.CatalogFixtures.*;

class EnrollmentServiceImplTest extends BaseUnitTest {

    @Mock
    private CourseEnrollmentRepository enrollmentRepository;
    @Mock
    private LessonProgressRepository progressRepository;
    @Mock
    private CatalogLookup catalogLookup;
    @Mock
    private LearningMetricsService metricsService;
    @Mock
    private EnrollmentService self;

    private EnrollmentAggregator aggregator;
    private EnrollmentServiceImpl service;

    private final UUID instructorId = UUID.randomUUID();
    private final CurrentUser student = new CurrentUser(UUID.randomUUID(), RoleName.STUDENT);
    private final CurrentUser otherStudent = new CurrentUser(UUID.randomUUID(), RoleName.STUDENT);
    private final CurrentUser instructor = new CurrentUser(instructorId, RoleName.INSTRUCTOR);
    private final CurrentUser otherInstructor = new CurrentUser(UUID.randomUUID(), RoleName.INSTRUCTOR);
    private final CurrentUser admin = new CurrentUser(UUID.randomUUID(), RoleName.ADMIN);

    private Course course;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        aggregator = new EnrollmentAggregator(catalogLookup, clock);
        service = new EnrollmentServiceImpl(
                enrollmentRepository,
                progressRepository,
                catalogLookup,
                aggregator,
                new EnrollmentMapper(),
                metricsService,
                self
        );
        course = publishedCourse(instructorId);
    }

    private LessonProgress progressIn(Lesson lesson, ProgressStatus status, int watchTimeSeconds) {
        LessonProgress progress = new LessonProgress();
        progress.setUserId(student.id());
        progress.setLessonId(lesson.getId());
        progress.setCourseId(course.getId());
        progress.setStatus(status);
        progress.setWatchTimeSeconds(watchTimeSeconds);
        return progress;
    }

    private CourseEnrollment storedEnrollment(EnrollmentStatus status) {
        CourseEnrollment enrollment = aggregator.newEnrollment(student.id(), course.getId(), null);
        enrollment.setId(UUID.randomUUID());
        enrollment.setStatus(status);
        when(enrollmentRepository.findById(enrollment.getId())).thenReturn(Optional.of(enrollment));
        return enrollment;
    }

    @Nested
    @DisplayName("enroll")
    class Enroll {

        @Test
        @DisplayName("Creates an enrollment at the first published lesson")
        void createsEnrollment() {
            UUID firstLesson = UUID.randomUUID();
            CourseEnrollment created = aggregator.newEnrollment(student.id(), course.getId(), firstLesson);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.findByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.empty());
            when(catalogLookup.findFirstPublishedLessonId(course.getId())).thenReturn(Optional.of(firstLesson));
            when(enrollmentRepository.findLockedByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.of(created));

            EnrollResult result = service.enroll(student.id(), course.getId());

            assertTrue(result.created());
            assertEquals(firstLesson, result.enrollment().currentLessonId());
            verify(self).createEnrollmentTx(student.id(), course.getId(), firstLesson);
            verify(metricsService).incrementEnrollmentCreated(student.id(), course.getId());
        }

        @Test
        @DisplayName("Enrolling again returns the existing enrollment")
        void existingEnrollmentReturned() {
            CourseEnrollment existing = aggregator.newEnrollment(student.id(), course.getId(), null);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.findByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.of(existing));

            EnrollResult result = service.enroll(student.id(), course.getId());

            assertFalse(result.created());
            verifyNoInteractions(self, metricsService);
        }

        @Test
        @DisplayName("A concurrent enrollment is recovered as not created")
        void concurrentEnrollmentRecovered() {
            CourseEnrollment winner = aggregator.newEnrollment(student.id(), course.getId(), null);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.findByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.empty());
            when(catalogLookup.findFirstPublishedLessonId(course.getId())).thenReturn(Optional.empty());
            when(self.createEnrollmentTx(student.id(), course.getId(), null))
                    .thenThrow(new DataIntegrityViolationException("could not execute statement",
                            new SQLException("Unique index or primary key violation", "23505")));
            when(enrollmentRepository.findLockedByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.of(winner));

            EnrollResult result = service.enroll(student.id(), course.getId());

            assertFalse(result.created());
            verify(metricsService).incrementConflictRecovered("enrollment");
            verify(metricsService, never()).incrementEnrollmentCreated(any(), any());
        }

        @Test
        @DisplayName("Integrity violations other than duplicate keys propagate")
        void otherIntegrityViolationPropagates() {
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.findByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.empty());
            when(catalogLookup.findFirstPublishedLessonId(course.getId())).thenReturn(Optional.empty());
            when(self.createEnrollmentTx(student.id(), course.getId(), null))
                    .thenThrow(new DataIntegrityViolationException("could not execute statement",
                            new SQLException("NULL not allowed for column \"COURSE_ID\"", "23502")));

            assertThrows(DataIntegrityViolationException.class, () -> service.enroll(student.id(), course.getId()));
            verify(enrollmentRepository, never()).findLockedByUserIdAndCourseId(any(), any());
        }

        @Test
        @DisplayName("Lessons completed before enrolling are rolled into the new enrollment")
        void earlierCompletionsBackfilled() {
            Lesson preview = textLesson(course, 1);
            preview.setPreview(true);
            Lesson second = textLesson(course, 2);
            CourseEnrollment created = aggregator.newEnrollment(student.id(), course.getId(), preview.getId());
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.findByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.empty());
            when(catalogLookup.findFirstPublishedLessonId(course.getId())).thenReturn(Optional.of(preview.getId()));
            when(enrollmentRepository.findLockedByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.of(created));
            when(progressRepository.findByUserIdAndCourseId(student.id(), course.getId())).thenReturn(List.of(
                    progressIn(preview, ProgressStatus.COMPLETED, 90),
                    progressIn(second, ProgressStatus.IN_PROGRESS, 10)));
            when(catalogLookup.listPublishedLessons(course.getId())).thenReturn(List.of(preview, second));
            when(catalogLookup.findNextLessonId(course.getId(), preview)).thenReturn(Optional.of(second.getId()));
            when(catalogLookup.countPublishedLessons(course.getId())).thenReturn(2L);

            EnrollResult result = service.enroll(student.id(), course.getId());

            assertTrue(result.created());
            assertEquals(50, result.enrollment().completionPercentage());
            assertEquals(second.getId(), result.enrollment().currentLessonId());
            assertThat(created.getCompletedLessons()).hasSize(1);
            assertEquals(preview.getId(), created.getCompletedLessons().get(0).getLessonId());
            assertEquals(90, created.getCompletedLessons().get(0).getWatchTimeSeconds());
            verify(enrollmentRepository).save(created);
            verify(metricsService, never()).incrementEnrollmentCompleted(any(), any());
        }

        @Test
        @DisplayName("An enrollment whose lessons were all completed beforehand starts COMPLETED")
        void allLessonsCompletedBeforehand() {
            Lesson only = textLesson(course, 1);
            only.setPreview(true);
            CourseEnrollment created = aggregator.newEnrollment(student.id(), course.getId(), only.getId());
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.findByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.empty());
            when(catalogLookup.findFirstPublishedLessonId(course.getId())).thenReturn(Optional.of(only.getId()));
            when(enrollmentRepository.findLockedByUserIdAndCourseId(student.id(), course.getId())).thenReturn(Optional.of(created));
            when(progressRepository.findByUserIdAndCourseId(student.id(), course.getId()))
                    .thenReturn(List.of(progressIn(only, ProgressStatus.COMPLETED, 0)));
            when(catalogLookup.listPublishedLessons(course.getId())).thenReturn(List.of(only));
            when(catalogLookup.findNextLessonId(course.getId(), only)).thenReturn(Optional.empty());
            when(catalogLookup.countPublishedLessons(course.getId())).thenReturn(1L);

            EnrollResult result = service.enroll(student.id(), course.getId());

            assertEquals(EnrollmentStatus.COMPLETED, result.enrollment().status());
            assertEquals(100, result.enrollment().completionPercentage());
            verify(metricsService).incrementEnrollmentCompleted(student.id(), course.getId());
        }

        @Test
        @DisplayName("Unpublished courses are closed for enrollment")
        void draftCourseRejected() {
            course.setStatus(CourseStatus.DRAFT);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);

            assertThrows(InvalidOperationException.class, () -> service.enroll(student.id(), course.getId()));
            verifyNoInteractions(enrollmentRepository);
        }
    }

    @Nested
    @DisplayName("changeStatus")
    class ChangeStatus {

        @Test
        @DisplayName("The learner can drop their enrollment")
        void ownerDrops() {
            CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.ACTIVE);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.save(enrollment)).thenReturn(enrollment);

            EnrollmentDto dto = service.changeStatus(student, enrollment.getId(), EnrollmentStatus.DROPPED);

            assertEquals(EnrollmentStatus.DROPPED, dto.status());
        }

        @Test
        @DisplayName("Only course staff suspend")
        void suspendRequiresStaff() {
            CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.ACTIVE);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.save(enrollment)).thenReturn(enrollment);

            assertThrows(AccessDeniedException.class,
                    () -> service.changeStatus(student, enrollment.getId(), EnrollmentStatus.SUSPENDED));
            assertThrows(AccessDeniedException.class,
                    () -> service.changeStatus(otherInstructor, enrollment.getId(), EnrollmentStatus.SUSPENDED));

            EnrollmentDto dto = service.changeStatus(instructor, enrollment.getId(), EnrollmentStatus.SUSPENDED);
            assertEquals(EnrollmentStatus.SUSPENDED, dto.status());
        }

        @Test
        @DisplayName("Only an admin reactivates")
        void reactivateRequiresAdmin() {
            CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.SUSPENDED);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
            when(enrollmentRepository.save(enrollment)).thenReturn(enrollment);

            assertThrows(AccessDeniedException.class,
                    () -> service.changeStatus(instructor, enrollment.getId(), EnrollmentStatus.ACTIVE));
            assertEquals(EnrollmentStatus.ACTIVE,
                    service.changeStatus(admin, enrollment.getId(), EnrollmentStatus.ACTIVE).status());
        }

        @Test
        @DisplayName("COMPLETED cannot be requested")
        void completedRejected() {
            assertThrows(InvalidOperationException.class,
                    () -> service.changeStatus(admin, UUID.randomUUID(), EnrollmentStatus.COMPLETED));
            verifyNoInteractions(enrollmentRepository);
        }

        @Test
        @DisplayName("Completed enrollments cannot be dropped")
        void completedIsTerminal() {
            CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.COMPLETED);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);

            assertThrows(InvalidOperationException.class,
                    () -> service.changeStatus(student, enrollment.getId(), EnrollmentStatus.DROPPED));
            verify(enrollmentRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("issueCertificate")
    class Certificates {

        @Test
        @DisplayName("Not eligible until the course is completed")
        void notCompleted() {
            CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.ACTIVE);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);

            CertificateDto certificate = service.issueCertificate(student, enrollment.getId());

            assertEquals(CertificateOutcome.NOT_ELIGIBLE, certificate.outcome());
            assertEquals("Course has not been completed yet", certificate.reason());
            assertNull(certificate.certificateId());
        }

        @Test
        @DisplayName("Not eligible when the course disables certificates")
        void disabledCourse() {
            CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.COMPLETED);
            course.setCertificateEnabled(false);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);

            CertificateDto certificate = service.issueCertificate(student, enrollment.getId());

            assertEquals(CertificateOutcome.NOT_ELIGIBLE, certificate.outcome());
            assertEquals("Certificates are not enabled for this course", certificate.reason());
        }

        @Test
        @DisplayName("Issued once, then reported as already issued with the same id")
        void issuedOnce() {
            CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.COMPLETED);
            when(catalogLookup.requireCourse(course.getId())).thenReturn(course);

            CertificateDto first = service.issueCertificate(student, enrollment.getId());
            CertificateDto second = service.issueCertificate(student, enrollment.getId());

            assertEquals(CertificateOutcome.ISSUED, first.outcome());
            assertThat(first.certificateId()).startsWith("CERT-").endsWith(enrollment.getId().toString());
            assertEquals(CertificateOutcome.ALREADY_ISSUED, second.outcome());
            assertEquals(first.certificateId(), second.certificateId());
            verify(enrollmentRepository, times(1)).save(enrollment);
            verify(metricsService, times(1)).incrementCertificateIssued(enrollment.getId());
        }

        @Test
        @DisplayName("Other learners cannot request the certificate")
        void otherLearnerDenied() {
            CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.COMPLETED);

            assertThrows(AccessDeniedException.class, () -> service.issueCertificate(otherStudent, enrollment.getId()));
        }
    }

    @Test
    @DisplayName("Only the learner rates the course")
    void rateOwnerOnly() {
        CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.ACTIVE);
        when(enrollmentRepository.save(enrollment)).thenReturn(enrollment);

        assertThrows(AccessDeniedException.class, () -> service.rate(admin, enrollment.getId(), 5, null));

        EnrollmentDto dto = service.rate(student, enrollment.getId(), 5, "Great");
        assertEquals(5, dto.rating().score());
    }

    @Test
    @DisplayName("Enrollments are visible to the learner, course staff and admins")
    void visibility() {
        CourseEnrollment enrollment = storedEnrollment(EnrollmentStatus.ACTIVE);
        when(catalogLookup.requireCourse(course.getId())).thenReturn(course);

        assertSame(enrollment, service.requireViewableEnrollment(student, enrollment.getId()));
        assertSame(enrollment, service.requireViewableEnrollment(admin, enrollment.getId()));
        assertSame(enrollment, service.requireViewableEnrollment(instructor, enrollment.getId()));
        assertThrows(AccessDeniedException.class, () -> service.requireViewableEnrollment(otherStudent, enrollment.getId()));
        assertThrows(AccessDeniedException.class, () -> service.requireViewableEnrollment(otherInstructor, enrollment.getId()));
    }

    @Test
    @DisplayName("Course roster is limited to course staff")
    void courseRosterRequiresStaff() {
        when(catalogLookup.requireCourse(course.getId())).thenReturn(course);

        assertThrows(AccessDeniedException.class,
                () -> service.getCourseEnrollments(otherInstructor, course.getId(), null, PageRequest.of(0, 20)));
        verifyNoInteractions(enrollmentRepository);
    }

    @Nested
    @DisplayName("recordLessonCompletion")
    class LessonCompletion {

        @Test
        @DisplayName("The last lesson completes the enrollment and counts it")
        void completesEnrollment() {
            Lesson lesson = textLesson(course, 1);
            CourseEnrollment enrollment = aggregator.newEnrollment(student.id(), course.getId(), lesson.getId());
            when(enrollmentRepository.findLockedByUserIdAndCourseId(student.id(), course.getId()))
                    .thenReturn(Optional.of(enrollment));
            when(catalogLookup.findNextLessonId(course.getId(), lesson)).thenReturn(Optional.empty());
            when(catalogLookup.countPublishedLessons(course.getId())).thenReturn(1L);

            service.recordLessonCompletion(student.id(), lesson, 0, null);

            assertEquals(EnrollmentStatus.COMPLETED, enrollment.getStatus());
            verify(enrollmentRepository).save(enrollment);
            verify(metricsService).incrementEnrollmentCompleted(student.id(), course.getId());
        }

        @Test
        @DisplayName("Suspended or missing enrollments are not updated")
        void inactiveSkipped() {
            Lesson lesson = textLesson(course, 1);
            CourseEnrollment enrollment = aggregator.newEnrollment(student.id(), course.getId(), lesson.getId());
            enrollment.setStatus(EnrollmentStatus.SUSPENDED);
            when(enrollmentRepository.findLockedByUserIdAndCourseId(student.id(), course.getId()))
                    .thenReturn(Optional.of(enrollment), Optional.empty());

            service.recordLessonCompletion(student.id(), lesson, 0, null);
            service.recordLessonCompletion(student.id(), lesson, 0, null);

            assertThat(enrollment.getCompletedLessons()).isEmpty();
            verify(enrollmentRepository, never()).save(any());
            verifyNoInteractions(metricsService);
        }

        @Test
        @DisplayName("A lesson already recorded is not saved again")
        void alreadyRecorded() {
            Lesson first = textLesson(course, 1);
            CourseEnrollment enrollment = aggregator.newEnrollment(student.id(), course.getId(), first.getId());
            when(enrollmentRepository.findLockedByUserIdAndCourseId(student.id(), course.getId()))
                    .thenReturn(Optional.of(enrollment));
            when(catalogLookup.findNextLessonId(course.getId(), first)).thenReturn(Optional.empty());
            when(catalogLookup.countPublishedLessons(course.getId())).thenReturn(2L);

            service.recordLessonCompletion(student.id(), first, 0, null);
            service.recordLessonCompletion(student.id(), first, 0, null);

            assertEquals(50, enrollment.getCompletionPercentage());
            verify(enrollmentRepository, times(1)).save(enrollment);
            verify(metricsService, never()).incrementEnrollmentCompleted(any(), any());
        }
    }
}
