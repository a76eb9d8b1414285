/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.Axis;
import java.time.Instant;

/**
 * Per-row rolling statistic for each axis, aligned with the sample it ends on.
 *
 * <p>A {@code null} component means the trailing window was not yet full.
 */
public record WindowedStatistic(Instant t, Double x, Double y, Double z)
{
    public boolean isDefined() {
        return x != null && y != null && z != null;
    }

    public Double value(Axis axis) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
            case Z -> z;
        };
    }
}
