/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.enumeration.SkipReason;
import com.ammann.vibration.model.SkippedSheet;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Workbook sheet excluded from the summary")
public record SkippedSheetDTO(
        @Schema(description = "Sheet (asset) name")
        String sheetName,

        @Schema(description = "Why the sheet was skipped")
        SkipReason reason,

        @Schema(description = "Missing columns or error message")
        String detail
) {
    public static SkippedSheetDTO from(SkippedSheet skipped) {
        return new SkippedSheetDTO(skipped.sheetName(), skipped.reason(), skipped.detail());
    }
}
