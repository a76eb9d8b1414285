/* (C)2026 */
package com.ammann.vibration.service;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.model.NormalizedSample;
import com.ammann.vibration.model.WindowedStatistic;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.jboss.logging.Logger;

/**
 * Computes trailing per-axis statistics for the time-domain diagnosis path.
 *
 * <p>Two modes are supported:
 * <ul>
 *   <li>RMS: causal window of {@code max(1, floor(rate * 60))} samples, with a minimum
 *       of one sample so every row is defined</li>
 *   <li>standard deviation: fixed window of three samples; the first two rows are undefined</li>
 * </ul>
 *
 * <p>Standard deviation uses the population convention (divisor {@code n}), not the
 * bias-corrected sample convention. A window of {@code [1, 2, 3]} therefore yields
 * {@code sqrt(2/3)} rather than {@code 1.0}.
 */
@ApplicationScoped
public class RollingStatisticService {

    private static final Logger LOG = Logger.getLogger(RollingStatisticService.class);

    /** Nominal RMS window in seconds. */
    public static final int RMS_WINDOW_SECONDS = 60;

    /** Fixed window of the standard deviation mode, in samples. */
    public static final int STD_DEV_WINDOW = 3;

    /**
     * Computes the statistic selected by the diagnosis mode.
     *
     * @param samples      samples sorted ascending by timestamp
     * @param mode         {@link DiagnosisMode#RMS} or {@link DiagnosisMode#STD_DEV}
     * @param sampleRateHz estimated sample rate, {@code 0} when undetermined
     * @return one statistic per sample, aligned by index
     */
    public List<WindowedStatistic> compute(List<NormalizedSample> samples, DiagnosisMode mode, double sampleRateHz) {
        return switch (mode) {
            case RMS -> rollingRms(samples, rmsWindowLength(sampleRateHz));
            case STD_DEV -> rollingStdDev(samples, STD_DEV_WINDOW);
            case SPECTRAL -> throw new IllegalArgumentException("Spectral mode has no rolling statistic");
        };
    }

    /**
     * Converts the nominal 60 second window into a sample count for the given rate.
     * An undetermined rate of {@code 0} yields a single-sample window.
     */
    public int rmsWindowLength(double sampleRateHz) {
        if (!(sampleRateHz > 0) || !Double.isFinite(sampleRateHz)) {
            return 1;
        }
        double samplesInWindow = Math.floor(sampleRateHz * RMS_WINDOW_SECONDS);
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, samplesInWindow));
    }

    /**
     * Trailing RMS per axis with a minimum period of one sample.
     */
    public List<WindowedStatistic> rollingRms(List<NormalizedSample> samples, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("RMS window must be at least one sample, got " + window);
        }

        double[] x = rollingRms(column(samples, Axis.X), window);
        double[] y = rollingRms(column(samples, Axis.Y), window);
        double[] z = rollingRms(column(samples, Axis.Z), window);

        List<WindowedStatistic> result = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            result.add(new WindowedStatistic(samples.get(i).t(), x[i], y[i], z[i]));
        }

        LOG.debugf("Rolling RMS computed over %d samples (window=%d)", samples.size(), window);
        return result;
    }

    /**
     * Trailing population standard deviation per axis; rows before the window fills are {@code null}.
     */
    public List<WindowedStatistic> rollingStdDev(List<NormalizedSample> samples, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Standard deviation window must be at least one sample, got " + window);
        }

        Double[] x = rollingStdDev(column(samples, Axis.X), window);
        Double[] y = rollingStdDev(column(samples, Axis.Y), window);
        Double[] z = rollingStdDev(column(samples, Axis.Z), window);

        List<WindowedStatistic> result = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            result.add(new WindowedStatistic(samples.get(i).t(), x[i], y[i], z[i]));
        }

        LOG.debugf("Rolling standard deviation computed over %d samples (window=%d)", samples.size(), window);
        return result;
    }

    /**
     * Trailing root-mean-square of a single channel. Partial windows at the start
     * average over the samples seen so far.
     */
    static double[] rollingRms(double[] values, int window) {
        double[] rms = new double[values.length];
        double sumOfSquares = 0.0;

        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i + 1 - window);
            if (i % window == 0) {
                // re-anchor once per window length so rounding drift cannot accumulate
                sumOfSquares = 0.0;
                for (int j = start; j <= i; j++) {
                    sumOfSquares += values[j] * values[j];
                }
            } else {
                sumOfSquares += values[i] * values[i];
                if (i >= window) {
                    double leaving = values[i - window];
                    sumOfSquares -= leaving * leaving;
                }
            }
            int count = i + 1 - start;
            rms[i] = Math.sqrt(Math.max(0.0, sumOfSquares) / count);
        }
        return rms;
    }

    /**
     * Trailing population standard deviation of a single channel.
     */
    static Double[] rollingStdDev(double[] values, int window) {
        StandardDeviation populationStdDev = new StandardDeviation(false);
        Double[] result = new Double[values.length];

        for (int i = 0; i < values.length; i++) {
            if (i + 1 < window) {
                result[i] = null;
                continue;
            }
            result[i] = populationStdDev.evaluate(values, i + 1 - window, window);
        }
        return result;
    }

    private static double[] column(List<NormalizedSample> samples, Axis axis) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            values[i] = samples.get(i).value(axis);
        }
        return values;
    }
}
