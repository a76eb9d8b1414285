/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.enumeration.DurationFilter;
import com.ammann.vibration.enumeration.Orientation;
import com.ammann.vibration.model.AnalysisConfiguration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Diagnosis request for a single asset sheet")
public record SheetDiagnosisRequestDTO(
        @Schema(description = "Sheet to diagnose")
        @NotNull @Valid
        SheetDTO sheet,

        @Schema(description = "Raw axis aligned with the shaft (default: Z)")
        Axis axialAxis,

        @Schema(description = "Shaft speed in revolutions per minute", example = "1800")
        @NotNull @Positive
        Double rpm,

        @Schema(description = "Mounting orientation, informational only (default: HORIZONTAL)")
        Orientation orientation,

        @Schema(description = "Analysis window relative to the latest sample (default: ALL_DATA)")
        DurationFilter duration,

        @Schema(description = "Keep only the most recent N rows")
        @Min(1)
        Integer maxRows,

        @Schema(description = "Analysis mode (default: RMS)")
        DiagnosisMode mode,

        @Schema(description = "Drop Normal rows from time-domain results (default: false)")
        Boolean faultsOnly
) {
    public AnalysisConfiguration toConfiguration() {
        return new AnalysisConfiguration(
                axialAxis,
                rpm == null ? Double.NaN : rpm,
                orientation,
                duration,
                maxRows,
                mode,
                Boolean.TRUE.equals(faultsOnly));
    }
}
