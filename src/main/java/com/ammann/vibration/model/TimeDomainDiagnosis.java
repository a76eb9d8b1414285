/* (C)2026 */
package com.ammann.vibration.model;

import com.ammann.vibration.enumeration.FaultLabel;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Diagnosis for one timestamped row of the time-domain path.
 *
 * <p>The label list is never empty; a row with no triggered rule carries
 * {@link FaultLabel#NORMAL}.
 */
public record TimeDomainDiagnosis(Instant timestamp, List<FaultLabel> labels)
{
    public TimeDomainDiagnosis {
        labels = (labels == null || labels.isEmpty()) ? List.of(FaultLabel.NORMAL) : List.copyOf(labels);
    }

    /** Labels joined for display, e.g. {@code "Radial High, Looseness"}. */
    public String label() {
        return labels.stream().map(FaultLabel::getDisplayName).collect(Collectors.joining(", "));
    }

    public boolean isNormal() {
        return labels.size() == 1 && labels.get(0) == FaultLabel.NORMAL;
    }
}
