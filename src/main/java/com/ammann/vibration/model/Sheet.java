/* (C)2026 */
package com.ammann.vibration.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named table of raw rows describing one monitored asset.
 *
 * <p>The column set of a sheet is the union of the labels found on its rows,
 * so a column that is present but empty on some rows still counts as present.
 */
public record Sheet(String name, List<RawRecord> rows)
{
    public Sheet {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /** Folded column labels appearing on at least one row. */
    public Set<String> columnLabels() {
        Set<String> labels = new LinkedHashSet<>();
        for (RawRecord row : rows) {
            labels.addAll(row.columns());
        }
        return labels;
    }

    public boolean hasColumn(String label) {
        return columnLabels().contains(RawRecord.fold(label));
    }

    public int rowCount() {
        return rows.size();
    }
}
