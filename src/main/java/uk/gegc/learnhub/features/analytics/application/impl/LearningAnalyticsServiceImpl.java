package uk.gegc.learnhub.features.analytics.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.analytics.api.dto.CourseEnrollmentStatsDto;
import uk.gegc.learnhub.features.analytics.api.dto.CourseProgressSummaryDto;
import uk.gegc.learnhub.features.analytics.api.dto.EnrollmentStatsDto;
import uk.gegc.learnhub.features.analytics.api.dto.LearningAnalyticsDto;
import uk.gegc.learnhub.features.analytics.application.LearningAnalyticsService;
import uk.gegc.learnhub.features.analytics.application.ProgressRollup;
import uk.gegc.learnhub.features.catalog.application.CatalogLookup;
import uk.gegc.learnhub.features.catalog.domain.model.Course;
import uk.gegc.learnhub.features.enrollment.application.EnrollmentService;
import uk.gegc.learnhub.features.enrollment.domain.model.CourseEnrollment;
import uk.gegc.learnhub.features.enrollment.domain.repository.CourseEnrollmentRepository;
import uk.gegc.learnhub.features.progress.domain.model.LessonProgress;
import uk.gegc.learnhub.features.progress.domain.repository.LessonProgressRepository;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver.CurrentUser;
import uk.gegc.learnhub.shared.config.ProgressProperties;
import uk.gegc.learnhub.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class LearningAnalyticsServiceImpl implements LearningAnalyticsService {

    private final LessonProgressRepository progressRepository;
    private final CourseEnrollmentRepository enrollmentRepository;
    private final EnrollmentService enrollmentService;
    private final CatalogLookup catalogLookup;
    private final ProgressProperties properties;
    private final Clock clock;

    @Override
    public CourseProgressSummaryDto getCourseSummary(UUID userId, UUID courseId) {
        catalogLookup.requireCourse(courseId);
        List<LessonProgress> records = progressRepository.findByUserIdAndCourseId(userId, courseId);
        return ProgressRollup.summarizeCourse(courseId, catalogLookup.listPublishedLessons(courseId), records);
    }

    @Override
    public LearningAnalyticsDto getLearningAnalytics(UUID userId, LocalDate from, LocalDate to) {
        ZoneId zone = clock.getZone();
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.minusDays(properties.getAnalyticsWindowDays());
        if (start.isAfter(end)) {
            throw new ValidationException("'from' must not be after 'to'");
        }

        List<LessonProgress> records = progressRepository.findAccessedBetween(
                userId,
                start.atStartOfDay(zone).toInstant(),
                end.plusDays(1).atStartOfDay(zone).toInstant());
        log.debug("Learning analytics userId={} from={} to={} records={}", userId, start, end, records.size());
        return new LearningAnalyticsDto(start, end, ProgressRollup.bucketDaily(records, start, end, zone));
    }

    @Override
    public EnrollmentStatsDto getEnrollmentStats(CurrentUser viewer, UUID enrollmentId) {
        CourseEnrollment enrollment = enrollmentService.requireViewableEnrollment(viewer, enrollmentId);
        long published = catalogLookup.countPublishedLessons(enrollment.getCourseId());
        return ProgressRollup.completionStats(enrollment, published);
    }

    @Override
    public CourseEnrollmentStatsDto getCourseEnrollmentStats(CurrentUser viewer, UUID courseId) {
        Course course = catalogLookup.requireCourse(courseId);
        if (!viewer.isAdmin() && !course.getInstructorId().equals(viewer.id())) {
            throw new AccessDeniedException("Only the course instructor or an admin can view enrollment stats");
        }
        return ProgressRollup.courseEnrollmentStats(courseId, enrollmentRepository.findAllByCourseId(courseId));
    }
}
