package uk.gegc.learnhub.shared.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Progress tracking defaults, applied when a lesson leaves the value unset.
 */
@Configuration
@ConfigurationProperties(prefix = "learnhub.progress")
@Validated
@Data
public class ProgressProperties {

    /**
     * Watched share of a video (percent) that completes the lesson.
     */
    @Min(1)
    @Max(100)
    private int defaultRequiredWatchPercent = 80;

    /**
     * Quiz percentage needed to pass.
     */
    @Min(0)
    @Max(100)
    private int defaultPassingScorePercent = 70;

    /**
     * Number of playback interactions kept per lesson record.
     */
    @Positive
    private int interactionHistoryLimit = 100;

    /**
     * Days covered by the learning analytics endpoint when no range is given.
     */
    @Positive
    private int analyticsWindowDays = 30;
}
