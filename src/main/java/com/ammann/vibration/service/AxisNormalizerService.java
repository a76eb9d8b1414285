/* (C)2026 */
package com.ammann.vibration.service;

import com.ammann.vibration.enumeration.Axis;
import com.ammann.vibration.enumeration.SchemaLayout;
import com.ammann.vibration.model.NormalizationResult;
import com.ammann.vibration.model.NormalizedSample;
import com.ammann.vibration.model.RawRecord;
import com.ammann.vibration.model.Sheet;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Maps raw sheets onto the canonical {@code t, x, y, z} schema.
 *
 * <p>Column labels are matched case-insensitively. Two layouts are recognised:
 * <ul>
 *   <li>per-axis timestamps: {@code t(x), x, t(y), y, t(z), z}, where the timestamp
 *       column of the axial axis becomes {@code t}</li>
 *   <li>a shared timestamp column named {@code t}, {@code time} or {@code timestamp},
 *       plus {@code x, y, z}</li>
 * </ul>
 *
 * <p>The axial channel is always stored under {@code z}; the two radial channels take
 * {@code x} and {@code y} in their original x, y, z order. This is a relabeling, not a rotation.
 * A sheet lacking required columns yields {@link NormalizationResult#invalidSchema(List)}.
 */
@ApplicationScoped
public class AxisNormalizerService {

    private static final Logger LOG = Logger.getLogger(AxisNormalizerService.class);

    static final List<String> SHARED_TIME_LABELS = List.of("t", "time", "timestamp");

    /**
     * Normalizes a sheet for the given axial axis.
     *
     * @param sheet     raw sheet
     * @param axialAxis raw axis aligned with the shaft
     * @return canonical samples sorted by timestamp, or the list of missing columns
     */
    public NormalizationResult normalize(Sheet sheet, Axis axialAxis) {
        Set<String> columns = sheet.columnLabels();

        List<String> perAxisMissing = missingPerAxisColumns(columns);
        String timeColumn;
        SchemaLayout layout;

        if (perAxisMissing.isEmpty()) {
            layout = SchemaLayout.PER_AXIS;
            timeColumn = axialAxis.timeColumnLabel();
        } else {
            String sharedTime = SHARED_TIME_LABELS.stream().filter(columns::contains).findFirst().orElse(null);
            if (sharedTime == null) {
                LOG.debugf("Sheet '%s' rejected: missing columns %s", sheet.name(), perAxisMissing);
                return NormalizationResult.invalidSchema(perAxisMissing);
            }
            List<String> sharedMissing = missingValueColumns(columns);
            if (!sharedMissing.isEmpty()) {
                LOG.debugf("Sheet '%s' rejected: missing columns %s", sheet.name(), sharedMissing);
                return NormalizationResult.invalidSchema(sharedMissing);
            }
            layout = SchemaLayout.SHARED;
            timeColumn = sharedTime;
        }

        List<Axis> radials = radialAxes(axialAxis);
        List<NormalizedSample> samples = new ArrayList<>(sheet.rowCount());
        int dropped = 0;

        for (RawRecord row : sheet.rows()) {
            Object rawTime = row.get(timeColumn);
            Double axial = RawValueParser.toDouble(row.get(axialAxis.columnLabel()));
            Double firstRadial = RawValueParser.toDouble(row.get(radials.get(0).columnLabel()));
            Double secondRadial = RawValueParser.toDouble(row.get(radials.get(1).columnLabel()));

            if (rawTime == null || axial == null || firstRadial == null || secondRadial == null) {
                dropped++;
                continue;
            }

            Instant t = RawValueParser.toInstant(rawTime);
            if (t == null) {
                dropped++;
                continue;
            }

            samples.add(new NormalizedSample(t, firstRadial, secondRadial, axial));
        }

        // List.sort is stable, so duplicate timestamps keep their input order
        samples.sort(Comparator.comparing(NormalizedSample::t));

        if (dropped > 0) {
            LOG.debugf("Sheet '%s': dropped %d of %d rows with missing or unparseable values",
                    sheet.name(), dropped, sheet.rowCount());
        }

        return NormalizationResult.valid(layout, samples, dropped);
    }

    /**
     * Returns the two radial axes for an axial choice, in x, y, z order.
     */
    static List<Axis> radialAxes(Axis axialAxis) {
        List<Axis> radials = new ArrayList<>(2);
        for (Axis axis : Axis.values()) {
            if (axis != axialAxis) {
                radials.add(axis);
            }
        }
        return radials;
    }

    private List<String> missingPerAxisColumns(Set<String> columns) {
        List<String> missing = new ArrayList<>();
        for (Axis axis : Axis.values()) {
            if (!columns.contains(axis.timeColumnLabel())) {
                missing.add(axis.timeColumnLabel());
            }
            if (!columns.contains(axis.columnLabel())) {
                missing.add(axis.columnLabel());
            }
        }
        return missing;
    }

    private List<String> missingValueColumns(Set<String> columns) {
        List<String> missing = new ArrayList<>();
        for (Axis axis : Axis.values()) {
            if (!columns.contains(axis.columnLabel())) {
                missing.add(axis.columnLabel());
            }
        }
        return missing;
    }
}
