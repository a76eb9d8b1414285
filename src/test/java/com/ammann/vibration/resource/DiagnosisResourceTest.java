/* (C)2026 */
package com.ammann.vibration.resource;

import static com.ammann.vibration.support.TestDataFactory.START;
import static com.ammann.vibration.support.TestDataFactory.constantRows;
import static com.ammann.vibration.support.TestDataFactory.perAxisRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.vibration.dto.SampleRateResponseDTO;
import com.ammann.vibration.dto.SheetDTO;
import com.ammann.vibration.dto.SheetDiagnosisDTO;
import com.ammann.vibration.dto.SheetDiagnosisRequestDTO;
import com.ammann.vibration.dto.WorkbookDiagnosisDTO;
import com.ammann.vibration.dto.WorkbookDiagnosisRequestDTO;
import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.enumeration.DiagnosisStatus;
import com.ammann.vibration.enumeration.SchemaLayout;
import com.ammann.vibration.exception.ValidationException;
import com.ammann.vibration.service.DiagnosisAggregatorService;
import com.ammann.vibration.service.DiagnosisService;
import com.ammann.vibration.support.TestDataFactory;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DiagnosisResourceTest {

    @Test
    void diagnoseSheetReturnsDto() {
        DiagnosisResource resource = buildResource();
        SheetDiagnosisRequestDTO request = sheetRequest(
                new SheetDTO("pump", constantRows(3, Duration.ofSeconds(1), 0.6, 0.1, 0.1)), DiagnosisMode.RMS);

        Response response = resource.diagnoseSheet(request);
        SheetDiagnosisDTO dto = (SheetDiagnosisDTO) response.getEntity();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(dto.sheetName()).isEqualTo("pump");
        assertThat(dto.status()).isEqualTo(DiagnosisStatus.COMPLETED);
        assertThat(dto.faultCount()).isEqualTo(3);
        assertThat(dto.diagnoses().get(0).diagnosis()).isEqualTo("Radial High, Looseness");
    }

    @Test
    void diagnoseSheetRejectsMissingColumns() {
        DiagnosisResource resource = buildResource();
        SheetDiagnosisRequestDTO request = sheetRequest(
                new SheetDTO("broken", List.of(Map.of("x", 0.1, "y", 0.1))), DiagnosisMode.RMS);

        assertThatThrownBy(() -> resource.diagnoseSheet(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void diagnoseSheetRejectsNullBody() {
        DiagnosisResource resource = buildResource();

        assertThatThrownBy(() -> resource.diagnoseSheet(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void diagnoseWorkbookSkipsInvalidSheets() {
        DiagnosisResource resource = buildResource();
        WorkbookDiagnosisRequestDTO request = new WorkbookDiagnosisRequestDTO(
                List.of(
                        new SheetDTO("a", constantRows(3, Duration.ofSeconds(1), 0.1, 0.1, 0.1)),
                        new SheetDTO("b", List.of(Map.of("time", "2024-01-01T00:00:00Z", "x", 1.0))),
                        new SheetDTO("c", constantRows(3, Duration.ofSeconds(1), 0.6, 0.1, 0.1))),
                null, 1800.0, null, null, null, null, null);

        WorkbookDiagnosisDTO dto = (WorkbookDiagnosisDTO) resource.diagnoseWorkbook(request).getEntity();

        assertThat(dto.totalSheets()).isEqualTo(3);
        assertThat(dto.diagnosedSheets()).isEqualTo(2);
        assertThat(dto.sheetsWithFaults()).isEqualTo(1);
        assertThat(dto.skipped()).hasSize(1);
        assertThat(dto.skipped().get(0).sheetName()).isEqualTo("b");
    }

    @Test
    void diagnoseWorkbookRejectsEmptyWorkbook() {
        DiagnosisResource resource = buildResource();
        WorkbookDiagnosisRequestDTO request = new WorkbookDiagnosisRequestDTO(
                List.of(), null, 1800.0, null, null, null, null, null);

        assertThatThrownBy(() -> resource.diagnoseWorkbook(request)).isInstanceOf(ValidationException.class);
    }

    @Test
    void estimateSampleRateReportsLayoutAndBounds() {
        DiagnosisResource resource = buildResource();
        SheetDiagnosisRequestDTO request = sheetRequest(
                new SheetDTO("rate", List.of(
                        perAxisRow(START, 0, 0, 0),
                        perAxisRow(START.plusMillis(10), 0, 0, 0),
                        perAxisRow(START.plusMillis(20), 0, 0, 0))),
                null);

        SampleRateResponseDTO dto = (SampleRateResponseDTO) resource.estimateSampleRate(request).getEntity();

        assertThat(dto.sampleRateHz()).isCloseTo(100.0, within(1e-9));
        assertThat(dto.determined()).isTrue();
        assertThat(dto.sampleCount()).isEqualTo(3);
        assertThat(dto.layout()).isEqualTo(SchemaLayout.PER_AXIS);
        assertThat(dto.firstTimestamp()).isEqualTo(START);
        assertThat(dto.lastTimestamp()).isEqualTo(START.plusMillis(20));
    }

    @Test
    void estimateSampleRateOfSingleRowIsUndetermined() {
        DiagnosisResource resource = buildResource();
        SheetDiagnosisRequestDTO request = sheetRequest(
                new SheetDTO("one", List.of(perAxisRow(START, 0, 0, 0))), null);

        SampleRateResponseDTO dto = (SampleRateResponseDTO) resource.estimateSampleRate(request).getEntity();

        assertThat(dto.sampleRateHz()).isZero();
        assertThat(dto.determined()).isFalse();
    }

    private static SheetDiagnosisRequestDTO sheetRequest(SheetDTO sheet, DiagnosisMode mode) {
        return new SheetDiagnosisRequestDTO(sheet, null, 1800.0, null, null, null, mode, null);
    }

    private static DiagnosisResource buildResource() {
        DiagnosisService diagnosisService = TestDataFactory.diagnosisService();
        DiagnosisResource resource = new DiagnosisResource();
        resource.diagnosisService = diagnosisService;
        resource.aggregatorService = new DiagnosisAggregatorService(diagnosisService);
        return resource;
    }
}
