/* (C)2026 */
package com.ammann.vibration.model;

import java.util.List;

/**
 * Result of running the pipeline over a single sheet.
 *
 * <p>An invalid schema is reported here rather than thrown, so a batch caller
 * can record the sheet as skipped and move on.
 */
public record SheetOutcome(String sheetName, SheetDiagnosis diagnosis, List<String> missingColumns)
{
    public SheetOutcome {
        missingColumns = missingColumns == null ? List.of() : List.copyOf(missingColumns);
    }

    public static SheetOutcome of(SheetDiagnosis diagnosis) {
        return new SheetOutcome(diagnosis.sheetName(), diagnosis, List.of());
    }

    public static SheetOutcome invalidSchema(String sheetName, List<String> missingColumns) {
        return new SheetOutcome(sheetName, null, missingColumns);
    }

    public boolean isValid() {
        return diagnosis != null;
    }
}
