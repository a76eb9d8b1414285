/* (C)2026 */
package com.ammann.vibration.enumeration;

/**
 * Outcome of a diagnosis run over one sheet that passed schema validation.
 */
public enum DiagnosisStatus
{
    /** Diagnoses were computed. */
    COMPLETED,
    /** Fewer than two usable samples, or no determinable sample rate for spectral analysis. */
    INSUFFICIENT_DATA
}
