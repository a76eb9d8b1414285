/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.Axis;

/**
 * Dominant bin of a one-sided magnitude spectrum.
 */
public record SpectralPeak(Axis axis, int binIndex, double frequencyHz, double amplitude)
{
    /** Peak frequency expressed as shaft speed in revolutions per minute. */
    public double rpm() {
        return frequencyHz * 60.0;
    }
}
