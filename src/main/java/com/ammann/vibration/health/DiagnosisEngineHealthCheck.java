/* (C)2026 */
package com.ammann.vibration.health;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.FaultLabel;
import com.ammann.vibration.model.AxisSpectrum;
import com.ammann.vibration.model.SpectralPeak;
import com.ammann.vibration.service.SpectralAnalyzerService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check that runs the spectral engine on a synthetic shaft-speed sinusoid.
 *
 * <p>A 1800 RPM (30 Hz) tone sampled at 1000 Hz over 1000 samples, a length that is not a
 * power of two, must come back as a 30 Hz peak classified as likely unbalance. Anything else
 * means the transform is not usable and the service reports DOWN.
 */
@Readiness
@ApplicationScoped
public class DiagnosisEngineHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(DiagnosisEngineHealthCheck.class);

    private static final String HEALTH_CHECK_NAME = "diagnosis-engine";
    static final double SELF_TEST_RPM = 1800.0;
    static final double SELF_TEST_RATE_HZ = 1000.0;
    static final int SELF_TEST_SAMPLES = 1000;

    @Inject
    SpectralAnalyzerService spectralAnalyzer;

    @Override
    public HealthCheckResponse call() {
        long startTime = System.currentTimeMillis();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(HEALTH_CHECK_NAME)
                .withData("self-test-rpm", (long) SELF_TEST_RPM);

        try {
            double shaftHz = SELF_TEST_RPM / 60.0;
            double[] signal = new double[SELF_TEST_SAMPLES];
            for (int i = 0; i < signal.length; i++) {
                signal[i] = Math.sin(2 * Math.PI * shaftHz * i / SELF_TEST_RATE_HZ);
            }

            AxisSpectrum spectrum = spectralAnalyzer.spectrum(Axis.X, signal, SELF_TEST_RATE_HZ);
            SpectralPeak peak = spectralAnalyzer.dominantPeak(spectrum);
            FaultLabel label = spectralAnalyzer.classify(peak, SELF_TEST_RPM);

            builder.withData("peak-frequency-hz", String.format("%.3f", peak.frequencyHz()))
                    .withData("label", label.getDisplayName())
                    .withData("response-time-ms", System.currentTimeMillis() - startTime);

            if (label != FaultLabel.LIKELY_UNBALANCE) {
                LOG.warnf("Diagnosis engine self-test failed: peak %.3f Hz classified as %s",
                        peak.frequencyHz(), label);
                return builder.down().build();
            }
            return builder.up().build();

        } catch (RuntimeException e) {
            LOG.warnf(e, "Diagnosis engine self-test raised %s", e.getClass().getSimpleName());
            return builder.withData("error", String.valueOf(e.getMessage())).down().build();
        }
    }
}
