package com.cityvibe.dedup;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Tuning knobs for fuzzy duplicate detection and the history window.
 * Defaults are a starting policy; real values come from production data.
 */
public final class DeduplicationSettings {

    /**
     * How two start times are judged to describe the same occurrence
     */
    public enum TimeWindow {
        /** same calendar date in the configured zone */
        SAME_DAY,
        /** absolute difference within the configured tolerance */
        TOLERANCE
    }

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;

    private final double similarityThreshold;
    private final TimeWindow timeWindow;
    private final Duration timeTolerance;
    private final ZoneId zone;
    private final Duration historyWindow;
    private final int historyLimit;

    public DeduplicationSettings(
            double similarityThreshold,
            TimeWindow timeWindow,
            Duration timeTolerance,
            ZoneId zone,
            Duration historyWindow,
            int historyLimit) {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]: " + similarityThreshold);
        }
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must not be negative: " + historyLimit);
        }
        this.similarityThreshold = similarityThreshold;
        this.timeWindow = Objects.requireNonNull(timeWindow, "timeWindow");
        this.timeTolerance = Objects.requireNonNull(timeTolerance, "timeTolerance");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.historyWindow = Objects.requireNonNull(historyWindow, "historyWindow");
        this.historyLimit = historyLimit;
    }

    /**
     * Threshold 0.85, same calendar day in UTC, 30 days / 5000 events of history
     */
    public static DeduplicationSettings defaults() {
        return new DeduplicationSettings(
            DEFAULT_SIMILARITY_THRESHOLD,
            TimeWindow.SAME_DAY,
            Duration.ofHours(3),
            ZoneOffset.UTC,
            Duration.ofDays(30),
            5000);
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    public Duration getTimeTolerance() {
        return timeTolerance;
    }

    public ZoneId getZone() {
        return zone;
    }

    public Duration getHistoryWindow() {
        return historyWindow;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    @Override
    public String toString() {
        return "DeduplicationSettings{threshold=" + similarityThreshold
            + ", timeWindow=" + timeWindow
            + ", tolerance=" + timeTolerance
            + ", zone=" + zone
            + ", historyWindow=" + historyWindow
            + ", historyLimit=" + historyLimit + "}";
    }
}
