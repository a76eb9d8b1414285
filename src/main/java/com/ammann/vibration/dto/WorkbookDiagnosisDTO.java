/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.model.WorkbookDiagnosis;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Diagnosis summary across all sheets of a workbook")
public record WorkbookDiagnosisDTO(
        @Schema(description = "Sheets submitted")
        Integer totalSheets,

        @Schema(description = "Sheets diagnosed")
        Integer diagnosedSheets,

        @Schema(description = "Sheets with at least one fault finding")
        Integer sheetsWithFaults,

        @Schema(description = "Diagnosed sheets in submission order")
        List<SheetDiagnosisDTO> sheets,

        @Schema(description = "Sheets skipped for missing columns or processing errors")
        List<SkippedSheetDTO> skipped,

        @Schema(description = "Processing time in milliseconds")
        Long processingTimeMs
) {
    public static WorkbookDiagnosisDTO from(WorkbookDiagnosis workbook, long processingTimeMs) {
        return new WorkbookDiagnosisDTO(
                workbook.totalSheets(),
                workbook.sheets().size(),
                workbook.sheetsWithFaults().size(),
                workbook.sheets().stream().map(SheetDiagnosisDTO::from).toList(),
                workbook.skipped().stream().map(SkippedSheetDTO::from).toList(),
                processingTimeMs);
    }
}
