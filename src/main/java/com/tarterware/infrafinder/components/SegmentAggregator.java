package com.tarterware.infrafinder.components;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.locationtech.jts.geom.Geometry;

import com.tarterware.infrafinder.exceptions.FatalStartupException;
import com.tarterware.infrafinder.models.CanonicalSegment;
import com.tarterware.infrafinder.models.CanonicalStore;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.RawFeatureRecord;
import com.tarterware.infrafinder.models.SegmentField;
import com.tarterware.infrafinder.utilities.DateUtilities;

/**
 * Merges raw rows from any number of datasets into one {@link CanonicalSegment} per
 * segment id.
 *
 * <p>
 * Merge policy, applied across all rows sharing a segment id, within and across
 * datasets:
 * <ul>
 * <li>Geometry: the first successfully parsed geometry is kept; later ones are
 * ignored. Rows whose geometry is missing or unparsable are skipped entirely.</li>
 * <li>Date fields: the most recent non-empty value wins.</li>
 * <li>Every other field: the first non-empty value wins.</li>
 * </ul>
 * </p>
 *
 * <p>
 * One instance serves one ingestion run and is not thread-safe.
 * </p>
 */
public class SegmentAggregator
{
    private final WktGeometryParser geometryParser;

    private final Map<String, Accumulator> accumulators = new LinkedHashMap<>();

    private final Map<DatasetKind, Long> acceptedCounts = new EnumMap<>(DatasetKind.class);

    private final Map<DatasetKind, Long> geometryFailureCounts = new EnumMap<>(DatasetKind.class);

    public SegmentAggregator(WktGeometryParser geometryParser)
    {
        this.geometryParser = geometryParser;
    }

    /**
     * Merge one row into the segment it belongs to.
     *
     * @param record Row to merge.
     * @return true if the row was merged; false if it was skipped for lack of a usable
     *         geometry.
     */
    public boolean accept(RawFeatureRecord record)
    {
        Optional<Geometry> geometry = geometryParser.parse(record.getWkt());
        if (geometry.isEmpty())
        {
            geometryFailureCounts.merge(record.getSource(), 1L, Long::sum);
            return false;
        }

        Accumulator accumulator = accumulators.computeIfAbsent(record.getSegmentId(), Accumulator::new);
        accumulator.merge(record, geometry.get());
        acceptedCounts.merge(record.getSource(), 1L, Long::sum);
        return true;
    }

    public long getAcceptedCount(DatasetKind kind)
    {
        return acceptedCounts.getOrDefault(kind, 0L);
    }

    public long getGeometryFailureCount(DatasetKind kind)
    {
        return geometryFailureCounts.getOrDefault(kind, 0L);
    }

    /**
     * Produce the canonical store from everything merged so far.
     *
     * @return The immutable store.
     * @throws FatalStartupException if no row was merged at all.
     */
    public CanonicalStore build()
    {
        if (accumulators.isEmpty())
        {
            throw new FatalStartupException("Aggregation produced no segments; no query could ever succeed");
        }

        Map<String, CanonicalSegment> segments = new LinkedHashMap<>();
        for (Accumulator accumulator : accumulators.values())
        {
            segments.put(accumulator.segmentId, accumulator.toSegment());
        }
        return CanonicalStore.of(segments);
    }

    /**
     * Mutable per-segment state while rows are being merged.
     */
    private static class Accumulator
    {
        private final String segmentId;
        private final Map<SegmentField, String> fields = new EnumMap<>(SegmentField.class);
        private final Set<DatasetKind> sources = EnumSet.noneOf(DatasetKind.class);
        private Geometry geometry;

        Accumulator(String segmentId)
        {
            this.segmentId = segmentId;
        }

        void merge(RawFeatureRecord record, Geometry parsedGeometry)
        {
            sources.add(record.getSource());

            if (geometry == null)
            {
                geometry = parsedGeometry;
            }

            for (Map.Entry<SegmentField, String> entry : record.getValues().entrySet())
            {
                SegmentField field = entry.getKey();
                String incoming = entry.getValue() == null ? "" : entry.getValue();
                String current = fields.get(field);

                if (field.getMergePolicy() == SegmentField.MergePolicy.MOST_RECENT)
                {
                    String merged = DateUtilities.mostRecent(current, incoming);
                    fields.put(field, merged == null ? "" : merged);
                }
                else if (current == null || current.isEmpty())
                {
                    fields.put(field, incoming);
                }
            }
        }

        CanonicalSegment toSegment()
        {
            return CanonicalSegment.builder()
                    .segmentId(segmentId)
                    .geometry(geometry)
                    .fields(Collections.unmodifiableMap(new EnumMap<>(fields)))
                    .sources(Collections.unmodifiableSet(EnumSet.copyOf(sources)))
                    .build();
        }
    }
}
