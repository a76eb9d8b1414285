/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.FaultLabel;

/**
 * Per-axis result of the spectral path.
 */
public record SpectralDiagnosis(
        Axis axis,
        double peakFrequencyHz,
        double peakAmplitude,
        double peakRpm,
        FaultLabel label
) {
    public static SpectralDiagnosis of(SpectralPeak peak, FaultLabel label) {
        return new SpectralDiagnosis(peak.axis(), peak.frequencyHz(), peak.amplitude(), peak.rpm(), label);
    }
}
