/* (C)2026 */
package com.ammann.vibration.enumeration;

import java.time.Duration;

/**
 * Calendar-relative analysis window, measured back from the latest sample of a sheet.
 */
public enum DurationFilter
{
    LAST_24_HOURS(Duration.ofDays(1)),
    LAST_7_DAYS(Duration.ofDays(7)),
    ALL_DATA(null);

    private final Duration lookback;

    DurationFilter(Duration lookback) {
        this.lookback = lookback;
    }

    /**
     * Returns the lookback relative to the latest timestamp, or {@code null} for {@link #ALL_DATA}.
     */
    public Duration getLookback() { return lookback; }
}
