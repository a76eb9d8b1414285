/* (C)2026 */
package com.ammann.vibration.service;

import com.ammann.vibration.enumeration.SkipReason;
import com.ammann.vibration.model.AnalysisConfiguration;
import com.ammann.vibration.model.Sheet;
import com.ammann.vibration.model.SheetDiagnosis;
import com.ammann.vibration.model.SheetOutcome;
import com.ammann.vibration.model.SkippedSheet;
import com.ammann.vibration.model.WorkbookDiagnosis;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Diagnoses every sheet of a workbook as an independent asset.
 *
 * <p>Sheets are processed sequentially. A sheet with missing columns, or one whose
 * processing fails for any other reason, is recorded as skipped and the batch moves on;
 * no per-sheet failure escapes {@link #diagnoseWorkbook}. When the configuration carries no
 * row cap, the configured default cap ({@code vibration.analysis.default-max-rows}) applies.
 */
@ApplicationScoped
public class DiagnosisAggregatorService {

    private static final Logger LOG = Logger.getLogger(DiagnosisAggregatorService.class);

    static final int DEFAULT_MAX_ROWS = 500;

    @ConfigProperty(name = "vibration.analysis.default-max-rows", defaultValue = "500")
    int defaultMaxRows = DEFAULT_MAX_ROWS;

    @Inject MeterRegistry meterRegistry;

    private final DiagnosisService diagnosisService;

    @Inject
    public DiagnosisAggregatorService(DiagnosisService diagnosisService) {
        this.diagnosisService = diagnosisService;
    }

    public WorkbookDiagnosis diagnoseWorkbook(List<Sheet> sheets, AnalysisConfiguration config) {
        return diagnoseWorkbook(sheets, config, ProgressListener.NONE);
    }

    /**
     * Diagnoses all sheets in order.
     *
     * @param sheets   sheets of the workbook
     * @param config   operator choices shared by every sheet
     * @param progress receives an update after each sheet
     * @return diagnosed sheets in input order plus the skipped ones
     */
    public WorkbookDiagnosis diagnoseWorkbook(
            List<Sheet> sheets, AnalysisConfiguration config, ProgressListener progress) {
        AnalysisConfiguration effective =
                config.maxRows() == null && defaultMaxRows > 0 ? config.withMaxRows(defaultMaxRows) : config;

        int total = sheets.size();
        List<SheetDiagnosis> diagnosed = new ArrayList<>(total);
        List<SkippedSheet> skipped = new ArrayList<>();

        long startTime = System.nanoTime();
        int processed = 0;

        for (Sheet sheet : sheets) {
            try {
                SheetOutcome outcome = diagnosisService.diagnose(sheet, effective);
                if (outcome.isValid()) {
                    diagnosed.add(outcome.diagnosis());
                    recordProcessed();
                } else {
                    skipped.add(new SkippedSheet(sheet.name(), SkipReason.INVALID_SCHEMA,
                            "Missing columns: " + String.join(", ", outcome.missingColumns())));
                    recordSkipped(SkipReason.INVALID_SCHEMA);
                }
            } catch (RuntimeException e) {
                LOG.warnf(e, "Sheet '%s' skipped after processing error: %s", sheet.name(), e.getMessage());
                skipped.add(new SkippedSheet(sheet.name(), SkipReason.PROCESSING_ERROR, e.getMessage()));
                recordSkipped(SkipReason.PROCESSING_ERROR);
            }

            processed++;
            progress.onSheetProcessed(processed, total, sheet.name());
            LOG.debugf("Processed %d/%d sheets", processed, total);
        }

        LOG.infof("Workbook diagnosis completed in %.2fms: %d sheets, %d diagnosed, %d skipped",
                (System.nanoTime() - startTime) / 1_000_000.0, total, diagnosed.size(), skipped.size());

        return new WorkbookDiagnosis(diagnosed, skipped, total);
    }

    private void recordProcessed() {
        if (meterRegistry == null) {
            return;
        }

        Counter.builder("vibration_sheets_diagnosed_total")
                .description("Total number of workbook sheets diagnosed")
                .register(meterRegistry)
                .increment();
    }

    private void recordSkipped(SkipReason reason) {
        if (meterRegistry == null) {
            return;
        }

        Counter.builder("vibration_sheets_skipped_total")
                .description("Total number of workbook sheets skipped by reason")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }
}
