package uk.gegc.learnhub.features.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "lessons")
public class Lesson {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "lesson_id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "section", length = 100)
    private String section;

    @Column(name = "lesson_order", nullable = false)
    private int lessonOrder;

    @Enumerated(EnumType.STRING)
    @Column(name = "lesson_type", nullable = false, length = 20)
    private LessonType type;

    @Column(name = "video_duration_seconds")
    private Integer videoDurationSeconds;

    /** Unset means the configured default applies. */
    @Column(name = "required_watch_percent")
    private Integer requiredWatchTimePercent;

    @Column(name = "passing_score_percent")
    private Integer passingScorePercent;

    @Column(name = "is_published", nullable = false)
    private boolean published;

    @Column(name = "is_preview", nullable = false)
    private boolean preview;

    @OneToMany(mappedBy = "lesson", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("questionOrder ASC")
    private List<QuizQuestion> questions = new ArrayList<>();

    public UUID getCourseId() {
        return course != null ? course.getId() : null;
    }

    public boolean hasVideoDuration() {
        return type == LessonType.VIDEO && videoDurationSeconds != null && videoDurationSeconds > 0;
    }
}
