/* (C)2026 */
package com.ammann.vibration.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.enumeration.DiagnosisStatus;
import com.ammann.vibration.enumeration.DurationFilter;
import com.ammann.vibration.enumeration.FaultLabel;
import com.ammann.vibration.enumeration.Orientation;
import com.ammann.vibration.enumeration.SkipReason;
import com.ammann.vibration.exception.ValidationException;
import com.ammann.vibration.model.AnalysisConfiguration;
import com.ammann.vibration.model.AxisSpectrum;
import com.ammann.vibration.model.Sheet;
import com.ammann.vibration.model.SheetDiagnosis;
import com.ammann.vibration.model.SkippedSheet;
import com.ammann.vibration.model.SpectralDiagnosis;
import com.ammann.vibration.model.TimeDomainDiagnosis;
import com.ammann.vibration.model.WorkbookDiagnosis;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DiagnosisDtoTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void timeDomainSheetCountsFaultRows() {
        SheetDiagnosis diagnosis = SheetDiagnosis.timeDomain("pump", DiagnosisMode.RMS, Orientation.HORIZONTAL,
                1.0, 2, List.of(
                        new TimeDomainDiagnosis(T, List.of(FaultLabel.RADIAL_HIGH, FaultLabel.LOOSENESS)),
                        new TimeDomainDiagnosis(T.plusSeconds(1), List.of())));

        SheetDiagnosisDTO dto = SheetDiagnosisDTO.from(diagnosis);

        assertThat(dto.faultCount()).isEqualTo(1);
        assertThat(dto.diagnoses()).hasSize(2);
        assertThat(dto.diagnoses().get(0).diagnosis()).isEqualTo("Radial High, Looseness");
        assertThat(dto.diagnoses().get(1).diagnosis()).isEqualTo("Normal");
        assertThat(dto.spectralDiagnoses()).isNull();
        assertThat(dto.spectra()).isNull();
    }

    @Test
    void spectralSheetCarriesPeaksAndSpectra() {
        SheetDiagnosis diagnosis = SheetDiagnosis.spectral("motor", Orientation.VERTICAL, 100.0, 4,
                List.of(new SpectralDiagnosis(Axis.X, 30.0, 0.9, 1800.0, FaultLabel.LIKELY_UNBALANCE),
                        new SpectralDiagnosis(Axis.Y, 0.0, 0.0, 0.0, FaultLabel.NO_DOMINANT_FAULT)),
                List.of(new AxisSpectrum(Axis.X, new double[] {0.0, 25.0}, new double[] {0.0, 0.9})));

        SheetDiagnosisDTO dto = SheetDiagnosisDTO.from(diagnosis);

        assertThat(dto.mode()).isEqualTo(DiagnosisMode.SPECTRAL);
        assertThat(dto.faultCount()).isEqualTo(1);
        assertThat(dto.diagnoses()).isNull();
        assertThat(dto.spectralDiagnoses().get(0).diagnosis()).isEqualTo("Likely Unbalance");
        assertThat(dto.spectra().get(0).frequencies()).containsExactly(0.0, 25.0);
        assertThat(dto.spectra().get(0).magnitudes()).containsExactly(0.0, 0.9);
    }

    @Test
    void insufficientDataSheetHasNoRows() {
        SheetDiagnosisDTO dto = SheetDiagnosisDTO.from(
                SheetDiagnosis.insufficientData("tiny", DiagnosisMode.STD_DEV, Orientation.HORIZONTAL, 0.0, 1));

        assertThat(dto.status()).isEqualTo(DiagnosisStatus.INSUFFICIENT_DATA);
        assertThat(dto.diagnoses()).isEmpty();
        assertThat(dto.faultCount()).isZero();
    }

    @Test
    void workbookSummaryCountsSheets() {
        WorkbookDiagnosis workbook = new WorkbookDiagnosis(
                List.of(SheetDiagnosis.timeDomain("a", DiagnosisMode.RMS, null, 1.0, 1,
                        List.of(new TimeDomainDiagnosis(T, List.of(FaultLabel.AXIAL_HIGH))))),
                List.of(new SkippedSheet("b", SkipReason.INVALID_SCHEMA, "Missing columns: z")),
                2);

        WorkbookDiagnosisDTO dto = WorkbookDiagnosisDTO.from(workbook, 12L);

        assertThat(dto.totalSheets()).isEqualTo(2);
        assertThat(dto.diagnosedSheets()).isEqualTo(1);
        assertThat(dto.sheetsWithFaults()).isEqualTo(1);
        assertThat(dto.skipped()).extracting(SkippedSheetDTO::reason).containsExactly(SkipReason.INVALID_SCHEMA);
        assertThat(dto.processingTimeMs()).isEqualTo(12L);
    }

    @Test
    void sheetRequestBuildsConfigurationWithDefaults() {
        SheetDTO sheet = new SheetDTO("pump", List.of(Map.of("X", 1.0)));
        SheetDiagnosisRequestDTO request = new SheetDiagnosisRequestDTO(
                sheet, null, 1800.0, null, DurationFilter.LAST_24_HOURS, null, DiagnosisMode.STD_DEV, null);

        AnalysisConfiguration config = request.toConfiguration();

        assertThat(config.axialAxis()).isEqualTo(Axis.Z);
        assertThat(config.duration()).isEqualTo(DurationFilter.LAST_24_HOURS);
        assertThat(config.mode()).isEqualTo(DiagnosisMode.STD_DEV);
        assertThat(config.faultsOnly()).isFalse();

        Sheet domain = sheet.toSheet();
        assertThat(domain.name()).isEqualTo("pump");
        assertThat(domain.hasColumn("x")).isTrue();
    }

    @Test
    void missingRpmIsRejected() {
        SheetDiagnosisRequestDTO request = new SheetDiagnosisRequestDTO(
                new SheetDTO("pump", List.of()), null, null, null, null, null, null, null);

        assertThatThrownBy(request::toConfiguration).isInstanceOf(ValidationException.class);
    }

    @Test
    void workbookRequestConvertsEverySheet() {
        WorkbookDiagnosisRequestDTO request = new WorkbookDiagnosisRequestDTO(
                List.of(new SheetDTO("a", List.of()), new SheetDTO("b", List.of())),
                Axis.X, 900.0, Orientation.VERTICAL, null, 50, null, true);

        assertThat(request.toSheets()).extracting(Sheet::name).containsExactly("a", "b");
        AnalysisConfiguration config = request.toConfiguration();
        assertThat(config.axialAxis()).isEqualTo(Axis.X);
        assertThat(config.maxRows()).isEqualTo(50);
        assertThat(config.faultsOnly()).isTrue();
    }
}
