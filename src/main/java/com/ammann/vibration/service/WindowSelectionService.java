/* (C)2026 */
package com.ammann.vibration.service;

import com.ammann.vibration.enumeration.DurationFilter;
import com.ammann.vibration.model.NormalizedSample;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Bounds the samples handed to the rolling and spectral computations.
 *
 * <p>The duration filter is applied first, relative to the latest timestamp of the sheet,
 * followed by the most-recent row cap. Both operate on samples already sorted ascending,
 * and the result stays sorted.
 */
@ApplicationScoped
public class WindowSelectionService {

    private static final Logger LOG = Logger.getLogger(WindowSelectionService.class);

    /**
     * Applies the duration filter and row cap.
     *
     * @param samples  samples sorted ascending by timestamp
     * @param duration calendar-relative window
     * @param maxRows  most-recent row cap, {@code null} for no cap
     * @return selected samples, still ascending
     */
    public List<NormalizedSample> select(List<NormalizedSample> samples, DurationFilter duration, Integer maxRows) {
        List<NormalizedSample> filtered = filterByDuration(samples, duration);
        List<NormalizedSample> selected = mostRecent(filtered, maxRows);

        if (selected.size() != samples.size()) {
            LOG.debugf("Window selection kept %d of %d samples (duration=%s, maxRows=%s)",
                    selected.size(), samples.size(), duration, maxRows);
        }
        return selected;
    }

    /**
     * Keeps samples with {@code t >= latest - lookback}.
     */
    public List<NormalizedSample> filterByDuration(List<NormalizedSample> samples, DurationFilter duration) {
        if (samples.isEmpty() || duration == null || duration.getLookback() == null) {
            return samples;
        }

        Instant latest = samples.get(samples.size() - 1).t();
        Duration lookback = duration.getLookback();
        Instant start = latest.minus(lookback);

        return samples.stream().filter(s -> !s.t().isBefore(start)).toList();
    }

    /**
     * Returns the tail of at most {@code maxRows} samples.
     */
    public List<NormalizedSample> mostRecent(List<NormalizedSample> samples, Integer maxRows) {
        if (maxRows == null || samples.size() <= maxRows) {
            return samples;
        }
        return List.copyOf(samples.subList(samples.size() - maxRows, samples.size()));
    }
}
