/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.enumeration.DiagnosisStatus;
import com.ammann.vibration.enumeration.Orientation;
import com.ammann.vibration.model.SheetDiagnosis;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Diagnosis result for one asset sheet")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SheetDiagnosisDTO(
        @Schema(description = "Sheet (asset) name")
        String sheetName,

        @Schema(description = "Analysis mode used")
        DiagnosisMode mode,

        @Schema(description = "COMPLETED, or INSUFFICIENT_DATA when no diagnosis was possible")
        DiagnosisStatus status,

        @Schema(description = "Declared mounting orientation, informational only")
        Orientation orientation,

        @Schema(description = "Estimated sample rate in Hz; 0 when undetermined")
        Double sampleRateHz,

        @Schema(description = "Samples in the analysis window")
        Integer analyzedSamples,

        @Schema(description = "Number of time-domain rows or spectral axes with a fault finding")
        Integer faultCount,

        @Schema(description = "Time-domain diagnoses in timestamp order (RMS and STD_DEV modes)")
        List<TimeDomainDiagnosisDTO> diagnoses,

        @Schema(description = "Per-axis spectral diagnoses (SPECTRAL mode)")
        List<SpectralDiagnosisDTO> spectralDiagnoses,

        @Schema(description = "Per-axis spectra (SPECTRAL mode)")
        List<AxisSpectrumDTO> spectra
) {
    public static SheetDiagnosisDTO from(SheetDiagnosis diagnosis) {
        boolean spectral = diagnosis.mode() == DiagnosisMode.SPECTRAL;
        int faultCount = spectral
                ? (int) diagnosis.spectral().stream().filter(d -> d.label().isFault()).count()
                : diagnosis.faults().size();

        return new SheetDiagnosisDTO(
                diagnosis.sheetName(),
                diagnosis.mode(),
                diagnosis.status(),
                diagnosis.orientation(),
                diagnosis.sampleRateHz(),
                diagnosis.analyzedSamples(),
                faultCount,
                spectral ? null : diagnosis.timeDomain().stream().map(TimeDomainDiagnosisDTO::from).toList(),
                spectral ? diagnosis.spectral().stream().map(SpectralDiagnosisDTO::from).toList() : null,
                spectral ? diagnosis.spectra().stream().map(AxisSpectrumDTO::from).toList() : null);
    }
}
