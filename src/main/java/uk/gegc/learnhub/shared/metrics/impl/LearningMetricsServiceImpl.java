package uk.gegc.learnhub.shared.metrics.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.learnhub.shared.metrics.LearningMetricsService;

import java.util.UUID;

@Slf4j
@Service
public class LearningMetricsServiceImpl implements LearningMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter lessonCompletedCounter;
    private final Counter enrollmentCreatedCounter;
    private final Counter enrollmentCompletedCounter;
    private final Counter certificateIssuedCounter;

    public LearningMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.lessonCompletedCounter = Counter.builder("learning.lessons.completed")
                .description("Number of lessons completed")
                .register(meterRegistry);
        this.enrollmentCreatedCounter = Counter.builder("learning.enrollments.created")
                .description("Number of enrollments created")
                .register(meterRegistry);
        this.enrollmentCompletedCounter = Counter.builder("learning.enrollments.completed")
                .description("Number of enrollments that reached 100% completion")
                .register(meterRegistry);
        this.certificateIssuedCounter = Counter.builder("learning.certificates.issued")
                .description("Number of certificates issued")
                .register(meterRegistry);
    }

    @Override
    public void incrementLessonCompleted(UUID userId, UUID lessonId) {
        log.info("METRIC: learning.lessons.completed userId={} lessonId={}", userId, lessonId);
        lessonCompletedCounter.increment();
    }

    @Override
    public void incrementQuizAttempt(UUID userId, UUID lessonId, boolean passed) {
        log.info("METRIC: learning.quiz.attempts userId={} lessonId={} passed={}", userId, lessonId, passed);
        Counter.builder("learning.quiz.attempts")
                .description("Number of quiz attempts recorded")
                .tag("passed", String.valueOf(passed))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementEnrollmentCreated(UUID userId, UUID courseId) {
        log.info("METRIC: learning.enrollments.created userId={} courseId={}", userId, courseId);
        enrollmentCreatedCounter.increment();
    }

    @Override
    public void incrementEnrollmentCompleted(UUID userId, UUID courseId) {
        log.info("METRIC: learning.enrollments.completed userId={} courseId={}", userId, courseId);
        enrollmentCompletedCounter.increment();
    }

    @Override
    public void incrementCertificateIssued(UUID enrollmentId) {
        log.info("METRIC: learning.certificates.issued enrollmentId={}", enrollmentId);
        certificateIssuedCounter.increment();
    }

    @Override
    public void incrementConflictRecovered(String record) {
        log.info("METRIC: learning.records.conflicts_recovered record={}", record);
        Counter.builder("learning.records.conflicts_recovered")
                .description("Duplicate creates resolved by re-reading the existing row")
                .tag("record", record)
                .register(meterRegistry)
                .increment();
    }
}
