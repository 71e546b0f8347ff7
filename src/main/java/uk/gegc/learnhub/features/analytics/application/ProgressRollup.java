package uk.gegc.learnhub.features.analytics.application;

import uk.gegc.learnhub.features.analytics.api.dto.*;
import uk.gegc.learnhub.features.catalog.domain.model.Lesson;
import uk.gegc.learnhub.features.enrollment.domain.model.CompletedLesson;
import uk.gegc.learnhub.features.enrollment.domain.model.CourseEnrollment;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentRating;
import uk.gegc.learnhub.features.enrollment.domain.model.EnrollmentStatus;
import uk.gegc.learnhub.features.progress.domain.model.LessonProgress;
import uk.gegc.learnhub.features.progress.domain.model.ProgressStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only derivations over progress and enrollment records.
 * Nothing here mutates its input; empty input yields zero-valued results.
 */
public final class ProgressRollup {

    private ProgressRollup() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static CourseProgressSummaryDto summarizeCourse(UUID courseId,
                                                           List<Lesson> publishedLessons,
                                                           List<LessonProgress> records) {
        Map<UUID, LessonProgress> byLesson = records.stream()
                .collect(Collectors.toMap(LessonProgress::getLessonId, Function.identity(), (a, b) -> a));

        List<LessonSummaryDto> lessons = new ArrayList<>(publishedLessons.size());
        int completed = 0;
        for (Lesson lesson : publishedLessons) {
            LessonProgress progress = byLesson.get(lesson.getId());
            if (progress != null && progress.isCompleted()) {
                completed++;
            }
            lessons.add(toLessonSummary(lesson, progress));
        }

        Instant lastAccessedAt = records.stream()
                .map(LessonProgress::getLastAccessedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return new CourseProgressSummaryDto(
                courseId,
                publishedLessons.size(),
                completed,
                percentage(completed, publishedLessons.size()),
                lastAccessedAt,
                lessons
        );
    }

    /**
     * Groups records by the calendar day (in {@code zone}) of their last access, keeping days in
     * {@code [from, to]} that have activity, ascending.
     */
    public static List<DailyLearningDto> bucketDaily(List<LessonProgress> records,
                                                     LocalDate from,
                                                     LocalDate to,
                                                     ZoneId zone) {
        SortedMap<LocalDate, List<LessonProgress>> byDay = new TreeMap<>();
        for (LessonProgress record : records) {
            if (record.getLastAccessedAt() == null) {
                continue;
            }
            LocalDate day = LocalDate.ofInstant(record.getLastAccessedAt(), zone);
            if (day.isBefore(from) || day.isAfter(to)) {
                continue;
            }
            byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(record);
        }

        List<DailyLearningDto> days = new ArrayList<>(byDay.size());
        byDay.forEach((day, dayRecords) -> days.add(new DailyLearningDto(
                day,
                dayRecords.stream().mapToLong(LessonProgress::getTotalWatchTimeSeconds).sum(),
                dayRecords.size(),
                (int) dayRecords.stream().filter(r -> r.getStatus() == ProgressStatus.COMPLETED).count()
        )));
        return days;
    }

    public static EnrollmentStatsDto completionStats(CourseEnrollment enrollment, long publishedLessonCount) {
        int completed = enrollment.getCompletedLessons().size();
        long studyTime = enrollment.getCompletedLessons().stream()
                .mapToLong(CompletedLesson::getWatchTimeSeconds)
                .sum();
        return new EnrollmentStatsDto(
                enrollment.getId(),
                (int) publishedLessonCount,
                completed,
                enrollment.getCompletionPercentage(),
                studyTime,
                enrollment.getEnrolledAt(),
                enrollment.getLastAccessedAt()
        );
    }

    public static CourseEnrollmentStatsDto courseEnrollmentStats(UUID courseId, List<CourseEnrollment> enrollments) {
        Map<EnrollmentStatus, List<CourseEnrollment>> byStatus = new EnumMap<>(EnrollmentStatus.class);
        for (CourseEnrollment enrollment : enrollments) {
            byStatus.computeIfAbsent(enrollment.getStatus(), s -> new ArrayList<>()).add(enrollment);
        }

        List<StatusStatsDto> statusStats = new ArrayList<>(byStatus.size());
        byStatus.forEach((status, group) -> statusStats.add(new StatusStatsDto(
                status,
                group.size(),
                group.stream().mapToInt(CourseEnrollment::getCompletionPercentage).average().orElse(0.0d)
        )));

        List<Integer> ratings = enrollments.stream()
                .map(CourseEnrollment::getRating)
                .filter(Objects::nonNull)
                .map(EnrollmentRating::getScore)
                .filter(Objects::nonNull)
                .toList();
        double averageRating = ratings.stream().mapToInt(Integer::intValue).average().orElse(0.0d);

        return new CourseEnrollmentStatsDto(
                courseId,
                enrollments.size(),
                statusStats,
                ratings.size(),
                averageRating
        );
    }

    private static LessonSummaryDto toLessonSummary(Lesson lesson, LessonProgress progress) {
        if (progress == null) {
            return new LessonSummaryDto(lesson.getId(), lesson.getTitle(), lesson.getLessonOrder(), lesson.getType(),
                    ProgressStatus.NOT_STARTED, 0, 0, null, null);
        }
        return new LessonSummaryDto(
                lesson.getId(),
                lesson.getTitle(),
                lesson.getLessonOrder(),
                lesson.getType(),
                progress.getStatus(),
                progress.getCompletionPercentage(),
                progress.getWatchTimeSeconds(),
                progress.getCompletedAt(),
                progress.getLastAccessedAt()
        );
    }

    private static int percentage(int part, int total) {
        return total > 0 ? (int) Math.round(100.0 * part / total) : 0;
    }
}
