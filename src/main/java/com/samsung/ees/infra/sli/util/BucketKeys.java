package com.samsung.ees.infra.sli.util;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Utility class deriving the day bucket and minute offset of a sample timestamp.
 * Timestamps are expected to be normalized to UTC by the caller.
 */
public final class BucketKeys {
    public static final int MINUTES_PER_DAY = 24 * 60;

    private BucketKeys() {
        // Private constructor to prevent instantiation
    }

    /**
     * Truncates a timestamp to midnight of the same calendar day.
     */
    public static LocalDateTime day(LocalDateTime timestamp) {
        return timestamp.truncatedTo(ChronoUnit.DAYS);
    }

    /**
     * Whole minutes elapsed since midnight. Seconds and fractions are dropped, not rounded.
     */
    public static int offset(LocalDateTime timestamp) {
        return timestamp.getHour() * 60 + timestamp.getMinute();
    }

    public static LocalDateTime timestampAt(LocalDateTime timebucket, int offset) {
        return timebucket.plusMinutes(offset);
    }
}
