/* (C)2026 */
package com.ammann.vibration.service;

import static com.ammann.vibration.support.TestDataFactory.START;
import static com.ammann.vibration.support.TestDataFactory.constantSheet;
import static com.ammann.vibration.support.TestDataFactory.sheet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.enumeration.SkipReason;
import com.ammann.vibration.model.AnalysisConfiguration;
import com.ammann.vibration.model.Sheet;
import com.ammann.vibration.model.SheetDiagnosis;
import com.ammann.vibration.model.SheetOutcome;
import com.ammann.vibration.model.WorkbookDiagnosis;
import com.ammann.vibration.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link DiagnosisAggregatorService}.
 */
class DiagnosisAggregatorServiceTest {

    private DiagnosisAggregatorService aggregator;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        aggregator = new DiagnosisAggregatorService(TestDataFactory.diagnosisService());
        meterRegistry = new SimpleMeterRegistry();
        aggregator.meterRegistry = meterRegistry;
    }

    @Test
    void invalidSheetIsSkippedAndOthersAreDiagnosed() {
        List<Sheet> sheets = List.of(
                constantSheet("pump", 3, Duration.ofSeconds(1), 0.6, 0.1, 0.1),
                missingAxisSheet("broken"),
                constantSheet("fan", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1));

        WorkbookDiagnosis workbook = aggregator.diagnoseWorkbook(sheets, AnalysisConfiguration.defaults(1800));

        assertThat(workbook.totalSheets()).isEqualTo(3);
        assertThat(workbook.sheets()).extracting(SheetDiagnosis::sheetName).containsExactly("pump", "fan");
        assertThat(workbook.skipped()).hasSize(1);
        assertThat(workbook.skipped().get(0).sheetName()).isEqualTo("broken");
        assertThat(workbook.skipped().get(0).reason()).isEqualTo(SkipReason.INVALID_SCHEMA);
        assertThat(workbook.skipped().get(0).detail()).contains("t(z)", "z");
    }

    @Test
    void sheetsWithoutFaultsStillGetAnEntry() {
        WorkbookDiagnosis workbook = aggregator.diagnoseWorkbook(
                List.of(constantSheet("quiet", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1)),
                AnalysisConfiguration.defaults(1800));

        assertThat(workbook.sheets()).hasSize(1);
        assertThat(workbook.sheetsWithFaults()).isEmpty();
    }

    @Test
    void sheetsWithFaultsAreSummarized() {
        WorkbookDiagnosis workbook = aggregator.diagnoseWorkbook(List.of(
                constantSheet("loud", 3, Duration.ofSeconds(1), 0.6, 0.1, 0.1),
                constantSheet("quiet", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1)),
                AnalysisConfiguration.defaults(1800));

        assertThat(workbook.sheetsWithFaults()).extracting(SheetDiagnosis::sheetName).containsExactly("loud");
    }

    @Test
    void processingErrorIsRecordedAndBatchContinues() {
        DiagnosisService failing = mock(DiagnosisService.class);
        Sheet good = constantSheet("good", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1);
        Sheet bad = constantSheet("bad", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1);
        SheetDiagnosis diagnosis = SheetDiagnosis.timeDomain(
                "good", DiagnosisMode.RMS, null, 1.0, 3, List.of());

        when(failing.diagnose(argThat(s -> s != null && "good".equals(s.name())), any()))
                .thenReturn(SheetOutcome.of(diagnosis));
        when(failing.diagnose(argThat(s -> s != null && "bad".equals(s.name())), any()))
                .thenThrow(new IllegalStateException("corrupt sheet"));

        DiagnosisAggregatorService service = new DiagnosisAggregatorService(failing);
        WorkbookDiagnosis workbook = service.diagnoseWorkbook(List.of(bad, good), AnalysisConfiguration.defaults(1800));

        assertThat(workbook.sheets()).extracting(SheetDiagnosis::sheetName).containsExactly("good");
        assertThat(workbook.skipped()).hasSize(1);
        assertThat(workbook.skipped().get(0).reason()).isEqualTo(SkipReason.PROCESSING_ERROR);
        assertThat(workbook.skipped().get(0).detail()).isEqualTo("corrupt sheet");
    }

    @Test
    void defaultRowCapAppliesWhenNoneIsGiven() {
        aggregator.defaultMaxRows = 4;

        WorkbookDiagnosis workbook = aggregator.diagnoseWorkbook(
                List.of(constantSheet("long", 10, Duration.ofSeconds(1), 0.1, 0.1, 0.1)),
                AnalysisConfiguration.defaults(1800));

        assertThat(workbook.sheets().get(0).analyzedSamples()).isEqualTo(4);
    }

    @Test
    void explicitRowCapOverridesDefault() {
        aggregator.defaultMaxRows = 4;

        WorkbookDiagnosis workbook = aggregator.diagnoseWorkbook(
                List.of(constantSheet("long", 10, Duration.ofSeconds(1), 0.1, 0.1, 0.1)),
                AnalysisConfiguration.defaults(1800).withMaxRows(8));

        assertThat(workbook.sheets().get(0).analyzedSamples()).isEqualTo(8);
    }

    @Test
    void progressIsReportedAfterEverySheet() {
        List<String> updates = new ArrayList<>();

        aggregator.diagnoseWorkbook(
                List.of(constantSheet("a", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1), missingAxisSheet("b")),
                AnalysisConfiguration.defaults(1800),
                (processed, total, sheetName) -> updates.add(processed + "/" + total + " " + sheetName));

        assertThat(updates).containsExactly("1/2 a", "2/2 b");
    }

    @Test
    void emptyWorkbookYieldsEmptySummary() {
        WorkbookDiagnosis workbook = aggregator.diagnoseWorkbook(List.of(), AnalysisConfiguration.defaults(1800));

        assertThat(workbook.totalSheets()).isZero();
        assertThat(workbook.sheets()).isEmpty();
        assertThat(workbook.skipped()).isEmpty();
    }

    @Test
    void countersTrackDiagnosedAndSkippedSheets() {
        aggregator.diagnoseWorkbook(List.of(
                constantSheet("a", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1),
                constantSheet("b", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1),
                missingAxisSheet("c")),
                AnalysisConfiguration.defaults(1800));

        assertThat(meterRegistry.get("vibration_sheets_diagnosed_total").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("vibration_sheets_skipped_total")
                .tag("reason", "invalid_schema").counter().count()).isEqualTo(1.0);
    }

    @Test
    void worksWithoutMeterRegistry() {
        aggregator.meterRegistry = null;

        WorkbookDiagnosis workbook = aggregator.diagnoseWorkbook(
                List.of(constantSheet("a", 3, Duration.ofSeconds(1), 0.1, 0.1, 0.1)),
                AnalysisConfiguration.defaults(1800));

        assertThat(workbook.sheets()).hasSize(1);
    }

    private static Sheet missingAxisSheet(String name) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("t(x)", START.toString());
        row.put("x", 0.1);
        row.put("t(y)", START.toString());
        row.put("y", 0.1);
        return sheet(name, List.of(row));
    }
}
