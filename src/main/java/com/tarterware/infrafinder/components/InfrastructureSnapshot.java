package com.tarterware.infrafinder.components;

import java.time.Instant;
import java.util.Collections;

import com.tarterware.infrafinder.models.CanonicalStore;
import com.tarterware.infrafinder.models.IngestionReport;

import lombok.Getter;

/**
 * An immutable (store, index) pair produced by one ingestion run. Readers obtain a
 * snapshot once per request and use it throughout, so a concurrent reload can never
 * show them a store and an index from different runs.
 */
@Getter
public final class InfrastructureSnapshot
{
    private static final InfrastructureSnapshot EMPTY = new InfrastructureSnapshot(CanonicalStore.empty(),
            IngestionReport.builder().datasets(Collections.emptyList()).completedAt(Instant.EPOCH).build());

    private final CanonicalStore store;

    private final SegmentSpatialIndex index;

    private final IngestionReport report;

    private final NearestSegmentResolver resolver;

    private final ServiceArea serviceArea;

    /**
     * Snapshot without a service area.
     */
    public InfrastructureSnapshot(CanonicalStore store, IngestionReport report)
    {
        this(store, ServiceArea.missing(), report);
    }

    /**
     * Build the index for the store and bind a resolver to both.
     *
     * @param store       Canonical store of this run.
     * @param serviceArea Region polygons loaded by the same run.
     * @param report      Ingestion report; its index and area counts are filled in here.
     */
    public InfrastructureSnapshot(CanonicalStore store, ServiceArea serviceArea, IngestionReport report)
    {
        this.store = store;
        this.serviceArea = serviceArea;
        this.index = new SegmentSpatialIndex(store);
        this.report = report.toBuilder()
                .segmentCount(store.size())
                .indexedSegmentCount(index.getIndexedCount())
                .serviceAreaPresent(serviceArea.isPresent())
                .serviceAreaPolygonCount(serviceArea.getPolygonCount())
                .build();
        this.resolver = new NearestSegmentResolver(store, index);
    }

    /**
     * Snapshot with no data. Every resolution against it comes back empty.
     */
    public static InfrastructureSnapshot empty()
    {
        return EMPTY;
    }

    public boolean isEmpty()
    {
        return store.isEmpty();
    }

    @Override
    public String toString()
    {
        return "InfrastructureSnapshot[" + store + ", " + index + ", " + serviceArea + ", completedAt=" + report.getCompletedAt() + "]";
    }
}
