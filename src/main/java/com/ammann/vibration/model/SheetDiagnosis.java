/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.enumeration.DiagnosisStatus;
import com.ammann.vibration.enumeration.Orientation;
import java.util.List;

/**
 * Diagnosis result for one sheet that passed schema validation.
 *
 * <p>Exactly one of {@code timeDomain} or {@code spectral} is populated, depending on
 * {@code mode}; the other is empty. Both are empty when {@code status} is
 * {@link DiagnosisStatus#INSUFFICIENT_DATA}.
 */
public record SheetDiagnosis(
        String sheetName,
        DiagnosisMode mode,
        DiagnosisStatus status,
        Orientation orientation,
        double sampleRateHz,
        int analyzedSamples,
        List<TimeDomainDiagnosis> timeDomain,
        List<SpectralDiagnosis> spectral,
        List<AxisSpectrum> spectra
) {
    public SheetDiagnosis {
        timeDomain = timeDomain == null ? List.of() : List.copyOf(timeDomain);
        spectral = spectral == null ? List.of() : List.copyOf(spectral);
        spectra = spectra == null ? List.of() : List.copyOf(spectra);
    }

    public static SheetDiagnosis timeDomain(
            String sheetName,
            DiagnosisMode mode,
            Orientation orientation,
            double sampleRateHz,
            int analyzedSamples,
            List<TimeDomainDiagnosis> diagnoses) {
        return new SheetDiagnosis(sheetName, mode, DiagnosisStatus.COMPLETED, orientation,
                sampleRateHz, analyzedSamples, diagnoses, List.of(), List.of());
    }

    public static SheetDiagnosis spectral(
            String sheetName,
            Orientation orientation,
            double sampleRateHz,
            int analyzedSamples,
            List<SpectralDiagnosis> diagnoses,
            List<AxisSpectrum> spectra) {
        return new SheetDiagnosis(sheetName, DiagnosisMode.SPECTRAL, DiagnosisStatus.COMPLETED,
                orientation, sampleRateHz, analyzedSamples, List.of(), diagnoses, spectra);
    }

    public static SheetDiagnosis insufficientData(
            String sheetName,
            DiagnosisMode mode,
            Orientation orientation,
            double sampleRateHz,
            int analyzedSamples) {
        return new SheetDiagnosis(sheetName, mode, DiagnosisStatus.INSUFFICIENT_DATA, orientation,
                sampleRateHz, analyzedSamples, List.of(), List.of(), List.of());
    }

    /** Time-domain rows carrying at least one fault label. */
    public List<TimeDomainDiagnosis> faults() {
        return timeDomain.stream().filter(d -> !d.isNormal()).toList();
    }

    public boolean hasFaults() {
        return !faults().isEmpty() || spectral.stream().anyMatch(d -> d.label().isFault());
    }
}
