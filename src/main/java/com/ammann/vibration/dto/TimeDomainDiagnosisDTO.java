/* (C)2026 */
package com.ammann.vibration.dto;

import com.ammann.vibration.enumeration.FaultLabel;
import com.ammann.vibration.model.TimeDomainDiagnosis;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Diagnosis of one timestamped row")
public record TimeDomainDiagnosisDTO(
        @Schema(description = "Row timestamp")
        Instant timestamp,

        @Schema(description = "Triggered labels joined for display, or 'Normal'", example = "Radial High, Looseness")
        String diagnosis,

        @Schema(description = "Triggered labels in radial, axial, looseness order")
        List<FaultLabel> labels
) {
    public static TimeDomainDiagnosisDTO from(TimeDomainDiagnosis diagnosis) {
        return new TimeDomainDiagnosisDTO(diagnosis.timestamp(), diagnosis.label(), diagnosis.labels());
    }
}
