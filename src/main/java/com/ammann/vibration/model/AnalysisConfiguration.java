/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.DiagnosisMode;
import com.ammann.vibration.enumeration.DurationFilter;
import com.ammann.vibration.enumeration.Orientation;
import com.ammann.vibration.exception.ValidationException;

/**
 * Immutable set of operator choices for one diagnosis run.
 *
 * @param axialAxis   raw axis aligned with the shaft, relabeled to {@code z}
 * @param rpm         shaft speed in revolutions per minute, must be positive
 * @param orientation mounting orientation, informational only
 * @param duration    calendar-relative window measured back from the latest sample
 * @param maxRows     most-recent row cap, {@code null} for no cap
 * @param mode        analysis path
 * @param faultsOnly  drop Normal rows from time-domain results
 */
public record AnalysisConfiguration(
        Axis axialAxis,
        double rpm,
        Orientation orientation,
        DurationFilter duration,
        Integer maxRows,
        DiagnosisMode mode,
        boolean faultsOnly
) {
    public AnalysisConfiguration {
        if (axialAxis == null) axialAxis = Axis.Z;
        if (orientation == null) orientation = Orientation.HORIZONTAL;
        if (duration == null) duration = DurationFilter.ALL_DATA;
        if (mode == null) mode = DiagnosisMode.RMS;

        if (!Double.isFinite(rpm) || rpm <= 0) {
            throw ValidationException.invalidParameter("rpm", rpm, "positive finite value");
        }
        if (maxRows != null && maxRows < 1) {
            throw ValidationException.invalidParameter("maxRows", maxRows, "at least 1");
        }
    }

    /**
     * Configuration with the given shaft speed and all other choices at their defaults
     * (axial {@code z}, all data, no row cap, RMS mode).
     */
    public static AnalysisConfiguration defaults(double rpm) {
        return new AnalysisConfiguration(null, rpm, null, null, null, null, false);
    }

    public AnalysisConfiguration withMaxRows(Integer rows) {
        return new AnalysisConfiguration(axialAxis, rpm, orientation, duration, rows, mode, faultsOnly);
    }

    public AnalysisConfiguration withMode(DiagnosisMode newMode) {
        return new AnalysisConfiguration(axialAxis, rpm, orientation, duration, maxRows, newMode, faultsOnly);
    }

    public AnalysisConfiguration withAxialAxis(Axis axis) {
        return new AnalysisConfiguration(axis, rpm, orientation, duration, maxRows, mode, faultsOnly);
    }

    public AnalysisConfiguration withDuration(DurationFilter filter) {
        return new AnalysisConfiguration(axialAxis, rpm, orientation, filter, maxRows, mode, faultsOnly);
    }
}
