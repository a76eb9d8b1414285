/* (C)2026 */
package com.ammann.vibration.service;

import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.enumeration.FaultLabel;
import com.ammann.vibration.model.NormalizedSample;
import com.ammann.vibration.model.TimeDomainDiagnosis;
import com.ammann.vibration.model.WindowedStatistic;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Maps one row of per-axis statistics onto qualitative fault labels.
 *
 * <p>Every rule is evaluated on every row and several labels may co-occur. Labels are
 * emitted in radial, axial, looseness order. All comparisons are strict, so a value sitting
 * exactly on a threshold does not trigger. A row without any triggered rule is
 * {@link FaultLabel#NORMAL}.
 *
 * <p>Thresholds are in the raw engineering units of the input signal; no unit
 * conversion is performed.
 */
@ApplicationScoped
public class ThresholdClassifierService {

    private static final Logger LOG = Logger.getLogger(ThresholdClassifierService.class);

    public static final double RADIAL_LIMIT = 0.5;
    public static final double AXIAL_LIMIT = 0.35;
    public static final double RADIAL_IMBALANCE_LIMIT = 0.2;
    public static final double STD_DEV_LIMIT = 0.05;

    /**
     * Classifies one row of RMS values. {@code z} is the axial channel.
     *
     * @return triggered labels, or {@code [NORMAL]}
     */
    public List<FaultLabel> classifyRms(double xRms, double yRms, double zRms) {
        List<FaultLabel> labels = new ArrayList<>(3);

        if (xRms > RADIAL_LIMIT || yRms > RADIAL_LIMIT) {
            labels.add(FaultLabel.RADIAL_HIGH);
        }
        if (zRms > AXIAL_LIMIT) {
            labels.add(FaultLabel.AXIAL_HIGH);
        }
        if (Math.abs(xRms - yRms) > RADIAL_IMBALANCE_LIMIT) {
            labels.add(FaultLabel.LOOSENESS);
        }

        return labels.isEmpty() ? List.of(FaultLabel.NORMAL) : List.copyOf(labels);
    }

    /**
     * Classifies one row in standard deviation mode: raw values against the level
     * limits, plus any axis deviation above {@link #STD_DEV_LIMIT}.
     *
     * @return triggered labels, or {@code [NORMAL]}
     */
    public List<FaultLabel> classifyStdDev(NormalizedSample raw, double xStd, double yStd, double zStd) {
        List<FaultLabel> labels = new ArrayList<>(3);

        if (raw.x() > RADIAL_LIMIT || raw.y() > RADIAL_LIMIT) {
            labels.add(FaultLabel.RADIAL_HIGH);
        }
        if (raw.z() > AXIAL_LIMIT) {
            labels.add(FaultLabel.AXIAL_HIGH);
        }
        if (xStd > STD_DEV_LIMIT || yStd > STD_DEV_LIMIT || zStd > STD_DEV_LIMIT) {
            labels.add(FaultLabel.LOOSENESS_OR_VARIABLE_LOAD);
        }

        return labels.isEmpty() ? List.of(FaultLabel.NORMAL) : List.copyOf(labels);
    }

    /**
     * Classifies every row that has a defined statistic. Rows whose trailing window
     * is not yet full are skipped, not reported as Normal.
     *
     * @param samples    samples the statistics were computed from
     * @param statistics statistics aligned with {@code samples} by index
     * @param mode       time-domain mode the statistics belong to
     * @return one diagnosis per classified row, in timestamp order
     */
    public List<TimeDomainDiagnosis> classify(
            List<NormalizedSample> samples, List<WindowedStatistic> statistics, DiagnosisMode mode) {
        if (samples.size() != statistics.size()) {
            throw new IllegalArgumentException(String.format(
                    "Statistics not aligned with samples: %d vs %d", statistics.size(), samples.size()));
        }

        List<TimeDomainDiagnosis> diagnoses = new ArrayList<>(statistics.size());
        int skipped = 0;

        for (int i = 0; i < statistics.size(); i++) {
            WindowedStatistic row = statistics.get(i);
            if (!row.isDefined()) {
                skipped++;
                continue;
            }

            List<FaultLabel> labels = switch (mode) {
                case RMS -> classifyRms(row.x(), row.y(), row.z());
                case STD_DEV -> classifyStdDev(samples.get(i), row.x(), row.y(), row.z());
                case SPECTRAL -> throw new IllegalArgumentException("Spectral mode is not threshold-classified");
            };
            diagnoses.add(new TimeDomainDiagnosis(row.t(), labels));
        }

        long faulty = diagnoses.stream().filter(d -> !d.isNormal()).count();
        LOG.debugf("Classified %d rows in %s mode: %d with faults, %d without a full window",
                diagnoses.size(), mode, faulty, skipped);
        return diagnoses;
    }
}
