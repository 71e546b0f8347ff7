package uk.gegc.learnhub.features.analytics.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.learnhub.features.analytics.api.dto.*;
import uk.gegc.learnhub.features.catalog.domain.model.Course;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.enrollment.domain.model.CompletedLesson;
import uk.gegc.learnhub.features.enrollment.domain.model.CourseEnrollment;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentRating;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;
import uk.gegc.learnhub.features.progress.domain.model.LessonProgress;
import uk.gegc.learnhub.features.progress.domain.model.ProgressStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static uk.gegc.learnhub.testsupport.CatalogFixtures.*;

class ProgressRollupTest {

    private final Course course = publishedCourse(UUID.randomUUID());

    private LessonProgress record(Lesson lesson, ProgressStatus status, int watch, Instant lastAccessedAt) {
        LessonProgress progress = new LessonProgress();
        progress.setUserId(UUID.randomUUID());
        progress.setLessonId(lesson.getId());
        progress.setCourseId(course.getId());
        progress.setStatus(status);
        progress.setWatchTimeSeconds(watch);
        progress.setTotalWatchTimeSeconds(watch);
        progress.setCompletionPercentage(status == ProgressStatus.COMPLETED ? 100 : 40);
        progress.setLastAccessedAt(lastAccessedAt);
        return progress;
    }

    private CourseEnrollment enrollment(EnrollmentStatus status, int percentage, Integer rating) {
        CourseEnrollment enrollment = new CourseEnrollment();
        enrollment.setId(UUID.randomUUID());
        enrollment.setCourseId(course.getId());
        enrollment.setStatus(status);
        enrollment.setCompletionPercentage(percentage);
        if (rating != null) {
            enrollment.setRating(new EnrollmentRating(rating, null, Instant.EPOCH));
        }
        return enrollment;
    }

    @Test
    @DisplayName("Course summary lists every published lesson, untouched ones as NOT_STARTED")
    void courseSummary() {
        Lesson first = videoLesson(course, 1, 600);
        Lesson second = textLesson(course, 2);
        Lesson third = textLesson(course, 3);
        Instant earlier = Instant.parse("2025-01-01T08:00:00Z");
        Instant later = Instant.parse("2025-01-02T08:00:00Z");

        CourseProgressSummaryDto summary = ProgressRollup.summarizeCourse(course.getId(),
                List.of(first, second, third),
                List.of(record(first, ProgressStatus.COMPLETED, 500, earlier),
                        record(second, ProgressStatus.IN_PROGRESS, 0, later)));

        assertThat(summary.totalLessons()).isEqualTo(3);
        assertThat(summary.completedLessons()).isEqualTo(1);
        assertThat(summary.overallPercentage()).isEqualTo(33);
        assertThat(summary.lastAccessedAt()).isEqualTo(later);
        assertThat(summary.lessons()).extracting(LessonSummaryDto::status)
                .containsExactly(ProgressStatus.COMPLETED, ProgressStatus.IN_PROGRESS, ProgressStatus.NOT_STARTED);
        assertThat(summary.lessons().get(2).completionPercentage()).isZero();
    }

    @Test
    @DisplayName("Empty course and no records give a zero summary")
    void emptySummary() {
        CourseProgressSummaryDto summary = ProgressRollup.summarizeCourse(course.getId(), List.of(), List.of());

        assertThat(summary.totalLessons()).isZero();
        assertThat(summary.overallPercentage()).isZero();
        assertThat(summary.lastAccessedAt()).isNull();
        assertThat(summary.lessons()).isEmpty();
    }

    @Test
    @DisplayName("Daily buckets group by access day, ascending, within the range")
    void dailyBuckets() {
        Lesson a = videoLesson(course, 1, 600);
        Lesson b = textLesson(course, 2);
        Lesson c = textLesson(course, 3);
        Lesson d = textLesson(course, 4);

        List<DailyLearningDto> days = ProgressRollup.bucketDaily(List.of(
                        record(a, ProgressStatus.COMPLETED, 300, Instant.parse("2025-01-03T09:00:00Z")),
                        record(b, ProgressStatus.IN_PROGRESS, 120, Instant.parse("2025-01-01T23:59:59Z")),
                        record(c, ProgressStatus.IN_PROGRESS, 60, Instant.parse("2025-01-03T18:00:00Z")),
                        record(d, ProgressStatus.COMPLETED, 10, Instant.parse("2025-01-10T00:00:00Z"))),
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 5), ZoneOffset.UTC);

        assertThat(days).extracting(DailyLearningDto::date)
                .containsExactly(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 3));
        assertThat(days.get(1).totalWatchTimeSeconds()).isEqualTo(360L);
        assertThat(days.get(1).lessonsAccessed()).isEqualTo(2);
        assertThat(days.get(1).lessonsCompleted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Enrollment stats sum recorded watch time")
    void enrollmentStats() {
        CourseEnrollment enrollment = enrollment(EnrollmentStatus.ACTIVE, 50, null);
        enrollment.getCompletedLessons().add(new CompletedLesson(UUID.randomUUID(), Instant.EPOCH, 300, null));
        enrollment.getCompletedLessons().add(new CompletedLesson(UUID.randomUUID(), Instant.EPOCH, 200, 4));

        EnrollmentStatsDto stats = ProgressRollup.completionStats(enrollment, 4);

        assertThat(stats.totalLessons()).isEqualTo(4);
        assertThat(stats.completedLessons()).isEqualTo(2);
        assertThat(stats.completionPercentage()).isEqualTo(50);
        assertThat(stats.totalStudyTimeSeconds()).isEqualTo(500L);
    }

    @Test
    @DisplayName("Course enrollment stats group by status and average ratings")
    void courseEnrollmentStats() {
        CourseEnrollmentStatsDto stats = ProgressRollup.courseEnrollmentStats(course.getId(), List.of(
                enrollment(EnrollmentStatus.ACTIVE, 20, 3),
                enrollment(EnrollmentStatus.ACTIVE, 60, null),
                enrollment(EnrollmentStatus.COMPLETED, 100, 5)));

        assertThat(stats.totalEnrollments()).isEqualTo(3);
        assertThat(stats.ratingCount()).isEqualTo(2);
        assertThat(stats.averageRating()).isCloseTo(4.0d, within(0.001d));
        assertThat(stats.byStatus()).extracting(StatusStatsDto::status)
                .containsExactly(EnrollmentStatus.ACTIVE, EnrollmentStatus.COMPLETED);
        assertThat(stats.byStatus().get(0).averageCompletion()).isCloseTo(40.0d, within(0.001d));
    }

    @Test
    @DisplayName("No enrollments give zero counts and averages")
    void emptyCourseStats() {
        CourseEnrollmentStatsDto stats = ProgressRollup.courseEnrollmentStats(course.getId(), List.of());

        assertThat(stats.totalEnrollments()).isZero();
        assertThat(stats.byStatus()).isEmpty();
        assertThat(stats.averageRating()).isZero();
    }
}
