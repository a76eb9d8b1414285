/* (C)2026 */
package com.ammann.vibration.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One row of source data as delivered by the ingestion layer.
 *
 * <p>Column labels are folded to trimmed lower case on construction so lookups are
 * case-insensitive. Values are kept as delivered and may be {@code null}.
 */
public record RawRecord(Map<String, Object> values)
{
    public RawRecord {
        Map<String, Object> folded = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((label, value) -> {
                if (label != null) {
                    folded.put(fold(label), value);
                }
            });
        }
        values = Collections.unmodifiableMap(folded);
    }

    /**
     * Returns the value for a column label, ignoring case, or {@code null} when absent.
     */
    public Object get(String label) {
        return label == null ? null : values.get(fold(label));
    }

    public boolean hasColumn(String label) {
        return label != null && values.containsKey(fold(label));
    }

    /** Folded column labels present on this row. */
    public Set<String> columns() {
        return values.keySet();
    }

    public static RawRecord of(Map<String, Object> values) {
        return new RawRecord(values);
    }

    static String fold(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }
}
