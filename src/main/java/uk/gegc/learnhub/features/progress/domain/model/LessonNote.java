package uk.gegc.learnhub.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "lesson_notes")
public class LessonNote {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "note_id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "progress_id", nullable = false)
    private LessonProgress progress;

    @Column(name = "content", nullable = false, length = 2000)
    private String content;

    @Column(name = "position_seconds")
    private Integer positionSeconds;

    @Column(name = "is_private", nullable = false)
    private boolean privateNote = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
