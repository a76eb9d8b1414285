/* (C)2026 */
package com.ammann.vibration.service;

import com.ammann.vibration.model.NormalizedSample;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.jboss.logging.Logger;

/**
 * Derives an effective sampling frequency from irregular timestamps.
 *
 * <p>The canonical policy takes the median of consecutive intervals, which resists
 * missing-data gaps and duplicate timestamps. A rate of exactly {@code 0.0} means
 * "undetermined" (fewer than two samples, or a non-positive median interval) and
 * must never be used as a divisor.
 *
 * <p>Mean-interval and first-interval estimates are exposed for comparison only;
 * the diagnosis pipeline uses {@link #estimate(List)}.
 */
@ApplicationScoped
public class SampleRateEstimatorService {

    private static final Logger LOG = Logger.getLogger(SampleRateEstimatorService.class);

    /** Rate returned when no rate can be determined. */
    public static final double UNDETERMINED = 0.0;

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    /**
     * Estimates the sample rate from the median interval.
     *
     * @param samples samples sorted ascending by timestamp
     * @return rate in Hz, or {@link #UNDETERMINED}
     */
    public double estimate(List<NormalizedSample> samples) {
        double[] intervals = intervalsSeconds(samples);
        if (intervals.length == 0) {
            return UNDETERMINED;
        }

        double medianInterval = new Median().evaluate(intervals);
        double rate = toRate(medianInterval);

        LOG.debugf("Sample rate estimated at %.4f Hz from %d intervals (median=%.6f s)",
                rate, intervals.length, medianInterval);
        return rate;
    }

    /**
     * Estimates the sample rate from the mean interval. Sensitive to outlier gaps.
     */
    public double meanIntervalRate(List<NormalizedSample> samples) {
        double[] intervals = intervalsSeconds(samples);
        return intervals.length == 0 ? UNDETERMINED : toRate(StatUtils.mean(intervals));
    }

    /**
     * Estimates the sample rate from the first interval only.
     */
    public double firstIntervalRate(List<NormalizedSample> samples) {
        double[] intervals = intervalsSeconds(samples);
        return intervals.length == 0 ? UNDETERMINED : toRate(intervals[0]);
    }

    /**
     * Computes consecutive timestamp differences in seconds with nanosecond precision.
     *
     * @param samples samples sorted ascending by timestamp
     * @return {@code n-1} differences, empty for fewer than two samples
     */
    double[] intervalsSeconds(List<NormalizedSample> samples) {
        if (samples == null || samples.size() < 2) {
            return new double[0];
        }

        double[] intervals = new double[samples.size() - 1];
        for (int i = 1; i < samples.size(); i++) {
            Duration delta = Duration.between(samples.get(i - 1).t(), samples.get(i).t());
            intervals[i - 1] = delta.getSeconds() + delta.getNano() / NANOS_PER_SECOND;
        }
        return intervals;
    }

    private double toRate(double intervalSeconds) {
        return intervalSeconds > 0 && Double.isFinite(intervalSeconds) ? 1.0 / intervalSeconds : UNDETERMINED;
    }
}
