package uk.gegc.learnhub.features.analytics.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.security.access.AccessDeniedException;
import uk.gegc.learnhub.BaseUnitTest;
import uk.gegc.learnhub.features.analytics.api.dto.CourseEnrollmentStatsDto;
import uk.gegc.learnhub.features.analytics.api.dto.EnrollmentStatsDto;
import uk.gegc.learnhub.features.analytics.api.dto.LearningAnalyticsDto;
import uk.gegc.learnhub.features.catalog.application.CatalogLookup;
import uk.gegc.learnhub.features.catalog.domain.model.Course;
import uk.gegc.learnhub.features.enrollment.application.EnrollmentService;
import uk.gegc.learnhub.features.enrollment.domain.model.CourseEnrollment;
import uk.gegc.learnhub.features.enrollment.domain.repository.CourseEnrollmentRepository;
import uk.gegc.learnhub.features.progress.domain.repository.LessonProgressRepository;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver.CurrentUser;
import uk.gegc.learnhub.features.user.domain.model.RoleName;
import uk.gegc.learnhub.shared.config.ProgressProperties;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;
import uk.gegc.learnhub.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;
import static uk.gegc.learnhub.testsupport.CatalogFixtures.publishedCourse;

class LearningAnalyticsServiceImplTest extends BaseUnitTest {

    @Mock
    private LessonProgressRepository progressRepository;
    @Mock
    private CourseEnrollmentRepository enrollmentRepository;
    @Mock
    private EnrollmentService enrollmentService;
    @Mock
    private CatalogLookup catalogLookup;

    private LearningAnalyticsServiceImpl service;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-31T15:00:00Z"), ZoneOffset.UTC);
        service = new LearningAnalyticsServiceImpl(progressRepository, enrollmentRepository, enrollmentService,
                catalogLookup, new ProgressProperties(), clock);
    }

    @Test
    @DisplayName("Without a range the analytics cover the configured window ending today")
    void defaultWindow() {
        LearningAnalyticsDto analytics = service.getLearningAnalytics(userId, null, null);

        assertEquals(LocalDate.of(2025, 1, 31), analytics.to());
        assertEquals(LocalDate.of(2025, 1, 1), analytics.from());
        assertThat(analytics.days()).isEmpty();
        verify(progressRepository).findAccessedBetween(userId,
                Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-02-01T00:00:00Z"));
    }

    @Test
    @DisplayName("A range that ends before it starts is rejected")
    void invertedRange() {
        assertThrows(ValidationException.class, () -> service.getLearningAnalytics(userId,
                LocalDate.of(2025, 1, 10), LocalDate.of(2025, 1, 5)));
        verifyNoInteractions(progressRepository);
    }

    @Test
    @DisplayName("Course summary requires an existing course")
    void courseSummaryUnknownCourse() {
        UUID courseId = UUID.randomUUID();
        when(catalogLookup.requireCourse(courseId)).thenThrow(new ResourceNotFoundException("Course " + courseId + " not found"));

        assertThrows(ResourceNotFoundException.class, () -> service.getCourseSummary(userId, courseId));
    }

    @Test
    @DisplayName("Enrollment stats go through enrollment visibility")
    void enrollmentStats() {
        CurrentUser viewer = new CurrentUser(userId, RoleName.STUDENT);
        CourseEnrollment enrollment = new CourseEnrollment();
        enrollment.setId(UUID.randomUUID());
        enrollment.setCourseId(UUID.randomUUID());
        enrollment.setCompletionPercentage(25);
        when(enrollmentService.requireViewableEnrollment(viewer, enrollment.getId())).thenReturn(enrollment);
        when(catalogLookup.countPublishedLessons(enrollment.getCourseId())).thenReturn(4L);

        EnrollmentStatsDto stats = service.getEnrollmentStats(viewer, enrollment.getId());

        assertEquals(4, stats.totalLessons());
        assertEquals(25, stats.completionPercentage());
    }

    @Test
    @DisplayName("Course enrollment stats are limited to the course instructor and admins")
    void courseStatsAccess() {
        UUID instructorId = UUID.randomUUID();
        Course course = publishedCourse(instructorId);
        when(catalogLookup.requireCourse(course.getId())).thenReturn(course);
        when(enrollmentRepository.findAllByCourseId(course.getId())).thenReturn(List.of());

        assertThrows(AccessDeniedException.class, () -> service.getCourseEnrollmentStats(
                new CurrentUser(UUID.randomUUID(), RoleName.INSTRUCTOR), course.getId()));

        CourseEnrollmentStatsDto stats = service.getCourseEnrollmentStats(
                new CurrentUser(instructorId, RoleName.INSTRUCTOR), course.getId());
        assertEquals(0, stats.totalEnrollments());
        service.getCourseEnrollmentStats(new CurrentUser(UUID.randomUUID(), RoleName.ADMIN), course.getId());
        verify(enrollmentRepository, times(2)).findAllByCourseId(course.getId());
    }
}
