package com.di.insightengine.analytics.seasonality;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Periodic bucketings a series is tested against.
 */
public enum SeasonalPeriod {
    /** Five-minute slot within the hour. */
    HOURLY(12),
    /** Hour of day. */
    DAILY(24),
    /** Day of week, Monday first. */
    WEEKLY(7);

    private final int bucketCount;

    SeasonalPeriod(int bucketCount) {
        this.bucketCount = bucketCount;
    }

    public int getBucketCount() {
        return bucketCount;
    }

    public int bucketOf(ZonedDateTime time) {
        switch (this) {
            case HOURLY: return time.getMinute() / 5;
            case DAILY: return time.getHour();
            default: return time.getDayOfWeek().getValue() - 1;
        }
    }

    public String label(int bucket) {
        switch (this) {
            case HOURLY: return String.format(Locale.ROOT, ":%02d", bucket * 5);
            case DAILY: return String.format(Locale.ROOT, "%02d:00", bucket);
            default: return DayOfWeek.of(bucket + 1).getDisplayName(TextStyle.FULL, Locale.ROOT);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
