/* (C)2026 */
package com.ammann.vibration.enumeration;

import java.util.Locale;

/**
 * One of the three orthogonal accelerometer channels.
 *
 * <p>After normalization {@link #Z} always carries the axial channel and
 * {@link #X}/{@link #Y} the two radial channels, regardless of how the
 * sensor was mounted.
 */
public enum Axis
{
    X,
    Y,
    Z;

    /** Lower-case column label used by the source sheets ({@code x}, {@code y}, {@code z}). */
    public String columnLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Per-axis timestamp column label used by the per-axis layout, e.g. {@code t(x)}. */
    public String timeColumnLabel() {
        return "t(" + columnLabel() + ")";
    }

    /**
     * Parses an axis label ignoring case and surrounding whitespace.
     *
     * @param label axis label such as {@code "x"} or {@code "Z"}
     * @return matching axis
     * @throws IllegalArgumentException if the label does not name an axis
     */
    public static Axis fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Axis label must not be blank");
        }
        return Axis.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
