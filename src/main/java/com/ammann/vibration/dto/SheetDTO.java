/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.model.RawRecord;
import com.ammann.vibration.model.Sheet;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "One asset sheet as tabulated by the ingestion layer")
public record SheetDTO(
        @Schema(description = "Sheet (asset) name", example = "Pump-01")
        @NotBlank
        String name,

        @Schema(description = "Rows as column label to value maps; labels are matched case-insensitively. "
                + "Expected columns are t(x), x, t(y), y, t(z), z, or a shared t/time/timestamp plus x, y, z")
        @NotNull
        List<Map<String, Object>> rows
) {
    /**
     * Converts the transport shape into the domain sheet.
     */
    public Sheet toSheet() {
        List<RawRecord> records = rows.stream().map(RawRecord::of).toList();
        return new Sheet(name, records);
    }
}
