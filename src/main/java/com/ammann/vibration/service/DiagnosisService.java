/* (C)2026 */
package com.ammann.vibration.service;

import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.model.AnalysisConfiguration;
import com.ammann.vibration.model.NormalizationResult;
import com.ammann.vibration.model.NormalizedSample;
import com.ammann.vibration.model.Sheet;
import com.ammann.vibration.model.SheetDiagnosis;
import com.ammann.vibration.model.SheetOutcome;
import com.ammann.vibration.model.TimeDomainDiagnosis;
import com.ammann.vibration.model.WindowedStatistic;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runs the diagnosis pipeline over a single sheet.
 *
 * <p>Normalization and sample-rate estimation are shared by every mode. The estimate is
 * taken over the whole normalized sheet, after which the duration filter and row cap bound
 * the samples fed to either the rolling-statistic path or the spectral path.
 *
 * <p>Schema problems are returned as an invalid {@link SheetOutcome}; too little data is
 * returned as an {@code INSUFFICIENT_DATA} diagnosis. Neither is thrown.
 */
@ApplicationScoped
public class DiagnosisService {

    private static final Logger LOG = Logger.getLogger(DiagnosisService.class);

    static final int MIN_SAMPLES = 2;

    @ConfigProperty(name = "vibration.analysis.rpm.expected-min", defaultValue = "100")
    double expectedMinRpm = 100;

    @ConfigProperty(name = "vibration.analysis.rpm.expected-max", defaultValue = "10000")
    double expectedMaxRpm = 10_000;

    private final AxisNormalizerService normalizer;
    private final SampleRateEstimatorService rateEstimator;
    private final WindowSelectionService windowSelection;
    private final RollingStatisticService rollingStatistics;
    private final ThresholdClassifierService thresholdClassifier;
    private final SpectralAnalyzerService spectralAnalyzer;

    @Inject
    public DiagnosisService(
            AxisNormalizerService normalizer,
            SampleRateEstimatorService rateEstimator,
            WindowSelectionService windowSelection,
            RollingStatisticService rollingStatistics,
            ThresholdClassifierService thresholdClassifier,
            SpectralAnalyzerService spectralAnalyzer) {
        this.normalizer = normalizer;
        this.rateEstimator = rateEstimator;
        this.windowSelection = windowSelection;
        this.rollingStatistics = rollingStatistics;
        this.thresholdClassifier = thresholdClassifier;
        this.spectralAnalyzer = spectralAnalyzer;
    }

    /**
     * Diagnoses one sheet.
     *
     * @param sheet  raw sheet
     * @param config operator choices for this run
     * @return the diagnosis, or an invalid outcome listing missing columns
     */
    public SheetOutcome diagnose(Sheet sheet, AnalysisConfiguration config) {
        warnOnUnusualRpm(sheet.name(), config.rpm());

        NormalizationResult normalized = normalizer.normalize(sheet, config.axialAxis());
        if (!normalized.valid()) {
            LOG.warnf("Sheet '%s' is missing required columns %s", sheet.name(), normalized.missingColumns());
            return SheetOutcome.invalidSchema(sheet.name(), normalized.missingColumns());
        }

        double sampleRate = rateEstimator.estimate(normalized.samples());
        List<NormalizedSample> window =
                windowSelection.select(normalized.samples(), config.duration(), config.maxRows());

        SheetDiagnosis diagnosis = config.mode().isTimeDomain()
                ? diagnoseTimeDomain(sheet.name(), window, sampleRate, config)
                : diagnoseSpectral(sheet.name(), window, sampleRate, config);

        LOG.infof("Sheet '%s' diagnosed in %s mode: status=%s, samples=%d, rate=%.3f Hz",
                sheet.name(), config.mode(), diagnosis.status(), diagnosis.analyzedSamples(), sampleRate);
        return SheetOutcome.of(diagnosis);
    }

    /**
     * Normalizes a sheet without running any analysis.
     */
    public NormalizationResult normalize(Sheet sheet, AnalysisConfiguration config) {
        return normalizer.normalize(sheet, config.axialAxis());
    }

    public double estimateSampleRate(List<NormalizedSample> samples) {
        return rateEstimator.estimate(samples);
    }

    private SheetDiagnosis diagnoseTimeDomain(
            String sheetName, List<NormalizedSample> window, double sampleRate, AnalysisConfiguration config) {
        if (window.size() < MIN_SAMPLES) {
            LOG.warnf("Sheet '%s': only %d samples in window, no diagnosis possible", sheetName, window.size());
            return SheetDiagnosis.insufficientData(
                    sheetName, config.mode(), config.orientation(), sampleRate, window.size());
        }

        List<WindowedStatistic> statistics = rollingStatistics.compute(window, config.mode(), sampleRate);
        List<TimeDomainDiagnosis> diagnoses = thresholdClassifier.classify(window, statistics, config.mode());
        if (config.faultsOnly()) {
            diagnoses = diagnoses.stream().filter(d -> !d.isNormal()).toList();
        }

        return SheetDiagnosis.timeDomain(
                sheetName, config.mode(), config.orientation(), sampleRate, window.size(), diagnoses);
    }

    private SheetDiagnosis diagnoseSpectral(
            String sheetName, List<NormalizedSample> window, double sampleRate, AnalysisConfiguration config) {
        if (window.size() < MIN_SAMPLES || sampleRate <= SampleRateEstimatorService.UNDETERMINED) {
            LOG.warnf("Sheet '%s': %d samples at rate %.3f Hz, no spectrum possible",
                    sheetName, window.size(), sampleRate);
            return SheetDiagnosis.insufficientData(
                    sheetName, DiagnosisMode.SPECTRAL, config.orientation(), sampleRate, window.size());
        }

        SpectralAnalyzerService.SpectralAnalysis analysis =
                spectralAnalyzer.analyze(window, sampleRate, config.rpm());

        return SheetDiagnosis.spectral(
                sheetName, config.orientation(), sampleRate, window.size(),
                analysis.diagnoses(), analysis.spectra());
    }

    private void warnOnUnusualRpm(String sheetName, double rpm) {
        if (rpm < expectedMinRpm || rpm > expectedMaxRpm) {
            LOG.warnf("Sheet '%s': shaft speed %.1f RPM outside expected range %.0f-%.0f",
                    sheetName, rpm, expectedMinRpm, expectedMaxRpm);
        }
    }
}
