/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.enumeration.SchemaLayout;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Sample-rate estimate for a normalized sheet")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SampleRateResponseDTO(
        @Schema(description = "Sheet (asset) name")
        String sheetName,

        @Schema(description = "Median-interval sample rate in Hz; 0 when undetermined")
        Double sampleRateHz,

        @Schema(description = "Whether a positive rate could be determined")
        Boolean determined,

        @Schema(description = "Valid samples after normalization")
        Integer sampleCount,

        @Schema(description = "Rows dropped for missing or unparseable values")
        Integer droppedRows,

        @Schema(description = "Detected column layout")
        SchemaLayout layout,

        @Schema(description = "Earliest sample timestamp")
        Instant firstTimestamp,

        @Schema(description = "Latest sample timestamp")
        Instant lastTimestamp
) {
}
