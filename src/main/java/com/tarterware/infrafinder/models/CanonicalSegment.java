package com.tarterware.infrafinder.models;

import java.util.Map;
import java.util.Set;

import org.locationtech.jts.geom.Geometry;

import lombok.Builder;
import lombok.Value;

/**
 * The merged, one-record-per-segment representation of a street segment.
 *
 * <p>
 * A field that maps to the empty string was present in at least one contributing
 * dataset but blank everywhere; a field missing from {@link #getFields()} was never
 * provided by any contributing dataset.
 * </p>
 */
@Value
@Builder
public class CanonicalSegment
{
    String segmentId;

    // Lineal geometry in the planar CRS, taken from the first row that carried one.
    Geometry geometry;

    Map<SegmentField, String> fields;

    // Datasets that contributed at least one row to this segment.
    Set<DatasetKind> sources;

    /**
     * @return the raw value of the field, "" if present but blank, or null if absent.
     */
    public String getField(SegmentField field)
    {
        return fields.get(field);
    }

    public boolean hasField(SegmentField field)
    {
        return fields.containsKey(field);
    }

    public boolean isFrom(DatasetKind dataset)
    {
        return sources.contains(dataset);
    }
}
