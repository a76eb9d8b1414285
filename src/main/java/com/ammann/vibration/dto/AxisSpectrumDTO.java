/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.model.AxisSpectrum;
import java.util.Arrays;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "One-sided magnitude spectrum of one axis, suitable for plotting")
public record AxisSpectrumDTO(
        @Schema(description = "Canonical axis (Z is axial)")
        Axis axis,

        @Schema(description = "Bin frequencies in Hz")
        List<Double> frequencies,

        @Schema(description = "Bin magnitudes, same length as frequencies")
        List<Double> magnitudes
) {
    public static AxisSpectrumDTO from(AxisSpectrum spectrum) {
        return new AxisSpectrumDTO(
                spectrum.axis(),
                Arrays.stream(spectrum.frequencies()).boxed().toList(),
                Arrays.stream(spectrum.magnitudes()).boxed().toList());
    }
}
