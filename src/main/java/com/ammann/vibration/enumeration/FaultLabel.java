/* (C)2026 */
package com.ammann.vibration.enumeration;

/**
 * Qualitative fault labels produced by the threshold and spectral classifiers.
 *
 * <p>The display name is the human-readable text handed to the reporting layer.
 */
public enum FaultLabel
{
    /** Zero-fault sentinel. */
    NORMAL("Normal"),

    RADIAL_HIGH("Radial High"),
    AXIAL_HIGH("Axial High"),
    LOOSENESS("Looseness"),
    LOOSENESS_OR_VARIABLE_LOAD("Looseness or Variable Load"),

    LIKELY_UNBALANCE("Likely Unbalance"),
    POSSIBLE_MISALIGNMENT("Possible Misalignment"),
    POSSIBLE_BEARING_FAULT("Possible Bearing Fault"),
    POSSIBLE_LOOSENESS("Possible Looseness"),
    NO_DOMINANT_FAULT("No dominant fault detected");

    private final String displayName;

    FaultLabel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    /**
     * Whether this label denotes an actual finding rather than a clean result.
     */
    public boolean isFault() {
        return this != NORMAL && this != NO_DOMINANT_FAULT;
    }
}
