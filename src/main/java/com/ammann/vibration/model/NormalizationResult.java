/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.SchemaLayout;
import java.util.List;

/**
 * Outcome of normalizing a sheet: either the canonical samples or the list of missing columns.
 *
 * @param valid          whether the sheet carried every required column
 * @param layout         detected layout, {@code null} when invalid
 * @param samples        canonical samples sorted by timestamp, empty when invalid
 * @param droppedRows    rows removed for null values or unparseable timestamps
 * @param missingColumns required columns that were absent, empty when valid
 */
public record NormalizationResult(
        boolean valid,
        SchemaLayout layout,
        List<NormalizedSample> samples,
        int droppedRows,
        List<String> missingColumns
) {
    public NormalizationResult {
        samples = samples == null ? List.of() : List.copyOf(samples);
        missingColumns = missingColumns == null ? List.of() : List.copyOf(missingColumns);
    }

    public static NormalizationResult valid(
            SchemaLayout layout, List<NormalizedSample> samples, int droppedRows) {
        return new NormalizationResult(true, layout, samples, droppedRows, List.of());
    }

    public static NormalizationResult invalidSchema(List<String> missingColumns) {
        return new NormalizationResult(false, null, List.of(), 0, missingColumns);
    }
}
