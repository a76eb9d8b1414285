/* (C)2026 */
package com.ammann.vibration.model;

import java.util.List;

/**
 * Aggregate result of diagnosing every sheet of a workbook, in sheet order.
 */
public record WorkbookDiagnosis(List<SheetDiagnosis> sheets, List<SkippedSheet> skipped, int totalSheets)
{
    public WorkbookDiagnosis {
        sheets = sheets == null ? List.of() : List.copyOf(sheets);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    /** Sheets that produced at least one fault finding. */
    public List<SheetDiagnosis> sheetsWithFaults() {
        return sheets.stream().filter(SheetDiagnosis::hasFaults).toList();
    }
}
