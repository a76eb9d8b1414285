/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.Axis;
import java.time.Instant;
import java.util.Objects;

/**
 * A single tri-axial reading on the canonical schema.
 *
 * <p>{@code z} is always the axial channel; {@code x} and {@code y} are radial.
 */
public record NormalizedSample(Instant t, double x, double y, double z)
{
    public NormalizedSample {
        Objects.requireNonNull(t, "timestamp must not be null");
    }

    public double value(Axis axis) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
            case Z -> z;
        };
    }
}
