/* (C)2026 */
package com.ammann.vibration.enumeration;

/**
 * Selects which analysis path a diagnosis run takes.
 *
 * <p>Both time-domain modes share the threshold classifier; {@link #SPECTRAL}
 * replaces the rolling statistics with a single FFT over the selected window.
 */
public enum DiagnosisMode
{
    /** Causal rolling RMS over a nominal 60 second window. */
    RMS,
    /** Fixed three-sample rolling population standard deviation. */
    STD_DEV,
    /** One-sided FFT peak referenced to shaft speed. */
    SPECTRAL;

    public boolean isTimeDomain() {
        return this != SPECTRAL;
    }
}
