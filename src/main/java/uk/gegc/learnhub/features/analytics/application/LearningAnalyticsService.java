package uk.gegc.learnhub.features.analytics.application;

import uk.gegc.learnhub.features.analytics.api.dto.CourseEnrollmentStatsDto;
import uk.gegc.learnhub.features.analytics.api.dto.CourseProgressSummaryDto;
import uk.gegc.learnhub.features.analytics.api.dto.EnrollmentStatsDto;
import uk.gegc.learnhub.features.analytics.api.dto.LearningAnalyticsDto;
import uk.gegc.learnhub.features.user.application.AuthenticatedUserResolver.CurrentUser;

import java.time.LocalDate;
import java.util.UUID;

public interface LearningAnalyticsService {

    CourseProgressSummaryDto getCourseSummary(UUID userId, UUID courseId);

    /**
     * @param from inclusive; defaults to the configured window before {@code to}
     * @param to   inclusive; defaults to today
     */
    LearningAnalyticsDto getLearningAnalytics(UUID userId, LocalDate from, LocalDate to);

    EnrollmentStatsDto getEnrollmentStats(CurrentUser viewer, UUID enrollmentId);

    CourseEnrollmentStatsDto getCourseEnrollmentStats(CurrentUser viewer, UUID courseId);
}
