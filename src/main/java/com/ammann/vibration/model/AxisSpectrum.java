/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.Axis;
import java.util.Arrays;
import java.util.Objects;

/**
 * One-sided magnitude spectrum of a single axis.
 *
 * <p>Both arrays are copied on the way in and on the way out, so a spectrum cannot be
 * changed after construction.
 *
 * @param axis        axis the spectrum belongs to
 * @param frequencies bin centre frequencies in Hz
 * @param magnitudes  magnitudes scaled by {@code 2/N}, same length as {@code frequencies}
 */
public record AxisSpectrum(Axis axis, double[] frequencies, double[] magnitudes)
{
    public AxisSpectrum {
        if (frequencies.length != magnitudes.length) {
            throw new IllegalArgumentException(String.format(
                    "Spectrum length mismatch: %d frequencies vs %d magnitudes",
                    frequencies.length, magnitudes.length));
        }
        frequencies = frequencies.clone();
        magnitudes = magnitudes.clone();
    }

    @Override
    public double[] frequencies() {
        return frequencies.clone();
    }

    @Override
    public double[] magnitudes() {
        return magnitudes.clone();
    }

    public int size() {
        return frequencies.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AxisSpectrum that)) {
            return false;
        }
        return axis == that.axis
                && Arrays.equals(frequencies, that.frequencies)
                && Arrays.equals(magnitudes, that.magnitudes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(axis, Arrays.hashCode(frequencies), Arrays.hashCode(magnitudes));
    }

    @Override
    public String toString() {
        return "AxisSpectrum[axis=" + axis
                + ", frequencies=" + Arrays.toString(frequencies)
                + ", magnitudes=" + Arrays.toString(magnitudes) + "]";
    }
}
