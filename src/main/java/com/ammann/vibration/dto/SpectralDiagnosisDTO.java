/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.FaultLabel;
import com.ammann.vibration.model.SpectralDiagnosis;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Dominant spectral peak of one axis and its classification")
public record SpectralDiagnosisDTO(
        @Schema(description = "Canonical axis (Z is axial)")
        Axis axis,

        @Schema(description = "Peak frequency in Hz")
        Double peakFrequencyHz,

        @Schema(description = "Peak magnitude, one-sided and scaled by 2/N")
        Double peakAmplitude,

        @Schema(description = "Peak frequency expressed in RPM")
        Double peakRpm,

        @Schema(description = "Human-readable classification", example = "Likely Unbalance")
        String diagnosis,

        @Schema(description = "Classification label")
        FaultLabel label
) {
    public static SpectralDiagnosisDTO from(SpectralDiagnosis diagnosis) {
        return new SpectralDiagnosisDTO(
                diagnosis.axis(),
                diagnosis.peakFrequencyHz(),
                diagnosis.peakAmplitude(),
                diagnosis.peakRpm(),
                diagnosis.label().getDisplayName(),
                diagnosis.label());
    }
}
