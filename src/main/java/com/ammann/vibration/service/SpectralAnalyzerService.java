/* (C)2026 */
package com.ammann.vibration.service;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.FaultLabel;
import com.ammann.vibration.model.AxisSpectrum;
import com.ammann.vibration.model.NormalizedSample;
import com.ammann.vibration.model.SpectralDiagnosis;
import com.ammann.vibration.model.SpectralPeak;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.stat.StatUtils;
import org.jboss.logging.Logger;

/**
 * Frequency-domain fault classification referenced to shaft speed.
 *
 * <p>For each axis the mean is removed, the full selected window is transformed, and the
 * first {@code ceil(N/2)} bins are kept with magnitudes scaled by {@code 2/N}. The single
 * largest bin is the dominant peak, classified first-match-wins:
 * <ol>
 *   <li>within 5 RPM of shaft speed: likely unbalance</li>
 *   <li>within 5 RPM of twice shaft speed: possible misalignment</li>
 *   <li>above 500 Hz: possible bearing fault</li>
 *   <li>between 0 and 10 Hz with amplitude above 0.1: possible looseness</li>
 *   <li>otherwise no dominant fault</li>
 * </ol>
 *
 * <p>The peak search includes bin 0. After mean removal that bin is close to zero, but
 * for signals whose every other bin is even smaller it can still win and is then reported
 * as a 0 Hz peak.
 */
@ApplicationScoped
public class SpectralAnalyzerService {

    private static final Logger LOG = Logger.getLogger(SpectralAnalyzerService.class);

    public static final double RPM_TOLERANCE = 5.0;
    public static final double BEARING_FREQUENCY_HZ = 500.0;
    public static final double LOOSENESS_FREQUENCY_HZ = 10.0;
    public static final double LOOSENESS_AMPLITUDE = 0.1;

    /**
     * Analyzes all three axes of a window.
     *
     * @param samples      the full selected window, sorted ascending, at least two samples
     * @param sampleRateHz positive sample rate
     * @param rpm          declared shaft speed
     * @return per-axis diagnoses and spectra, in x, y, z order
     */
    public SpectralAnalysis analyze(List<NormalizedSample> samples, double sampleRateHz, double rpm) {
        if (samples.size() < 2) {
            throw new IllegalArgumentException("Spectral analysis needs at least two samples, got " + samples.size());
        }
        if (!(sampleRateHz > 0)) {
            throw new IllegalArgumentException("Spectral analysis needs a positive sample rate, got " + sampleRateHz);
        }

        long startTime = System.nanoTime();
        List<SpectralDiagnosis> diagnoses = new ArrayList<>(Axis.values().length);
        List<AxisSpectrum> spectra = new ArrayList<>(Axis.values().length);

        for (Axis axis : Axis.values()) {
            double[] signal = new double[samples.size()];
            for (int i = 0; i < signal.length; i++) {
                signal[i] = samples.get(i).value(axis);
            }

            AxisSpectrum spectrum = spectrum(axis, signal, sampleRateHz);
            SpectralPeak peak = dominantPeak(spectrum);
            FaultLabel label = classify(peak, rpm);

            spectra.add(spectrum);
            diagnoses.add(SpectralDiagnosis.of(peak, label));

            LOG.debugf("Axis %s: peak %.3f Hz (%.1f RPM), amplitude %.4f -> %s",
                    axis, peak.frequencyHz(), peak.rpm(), peak.amplitude(), label.getDisplayName());
        }

        LOG.infof("Spectral analysis of %d samples at %.3f Hz completed in %.2fms",
                samples.size(), sampleRateHz, (System.nanoTime() - startTime) / 1_000_000.0);
        return new SpectralAnalysis(diagnoses, spectra);
    }

    /**
     * One-sided magnitude spectrum of a mean-removed signal.
     */
    public AxisSpectrum spectrum(Axis axis, double[] signal, double sampleRateHz) {
        int n = signal.length;
        double mean = StatUtils.mean(signal);
        double[] centred = new double[n];
        for (int i = 0; i < n; i++) {
            centred[i] = signal[i] - mean;
        }

        Complex[] bins = DiscreteFourierTransform.forward(centred);
        int half = (n + 1) / 2;
        double resolution = sampleRateHz / n;

        double[] frequencies = new double[half];
        double[] magnitudes = new double[half];
        for (int k = 0; k < half; k++) {
            frequencies[k] = k * resolution;
            magnitudes[k] = bins[k].abs() * 2.0 / n;
        }
        return new AxisSpectrum(axis, frequencies, magnitudes);
    }

    /**
     * Largest bin of the spectrum, bin 0 included; the lowest index wins ties.
     */
    public SpectralPeak dominantPeak(AxisSpectrum spectrum) {
        double[] magnitudes = spectrum.magnitudes();
        int best = 0;
        for (int k = 1; k < magnitudes.length; k++) {
            if (magnitudes[k] > magnitudes[best]) {
                best = k;
            }
        }
        return new SpectralPeak(spectrum.axis(), best, spectrum.frequencies()[best], magnitudes[best]);
    }

    /**
     * Classifies a peak against shaft speed. Rules are checked in order and the first match wins.
     */
    public FaultLabel classify(SpectralPeak peak, double rpm) {
        double peakRpm = peak.rpm();
        double frequency = peak.frequencyHz();

        if (Math.abs(peakRpm - rpm) < RPM_TOLERANCE) {
            return FaultLabel.LIKELY_UNBALANCE;
        }
        if (Math.abs(peakRpm - 2 * rpm) < RPM_TOLERANCE) {
            return FaultLabel.POSSIBLE_MISALIGNMENT;
        }
        if (frequency > BEARING_FREQUENCY_HZ) {
            return FaultLabel.POSSIBLE_BEARING_FAULT;
        }
        if (frequency > 0 && frequency < LOOSENESS_FREQUENCY_HZ && peak.amplitude() > LOOSENESS_AMPLITUDE) {
            return FaultLabel.POSSIBLE_LOOSENESS;
        }
        return FaultLabel.NO_DOMINANT_FAULT;
    }

    /**
     * Per-axis diagnoses together with the spectra they were derived from.
     */
    public record SpectralAnalysis(List<SpectralDiagnosis> diagnoses, List<AxisSpectrum> spectra)
    {
    }
}
