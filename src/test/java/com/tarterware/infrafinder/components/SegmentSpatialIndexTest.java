package com.tarterware.infrafinder.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;

import com.tarterware.infrafinder.models.CanonicalSegment;
import com.tarterware.infrafinder.models.CanonicalStore;
import com.tarterware.infrafinder.models.DatasetKind;

import utils.TestUtils;

class SegmentSpatialIndexTest
{
    @Test
    void testQueryReturnsIntersectingBoxes()
    {
        CanonicalStore store = TestUtils.store(
                TestUtils.segment("a", "LINESTRING (0 0, 10 0)", DatasetKind.LIGHTING),
                TestUtils.segment("b", "LINESTRING (100 100, 110 110)", DatasetKind.LIGHTING),
                TestUtils.segment("c", "MULTILINESTRING ((0 50, 5 50), (500 500, 510 510))", DatasetKind.LIGHTING));
        SegmentSpatialIndex index = new SegmentSpatialIndex(store);

        assertEquals(3, index.getIndexedCount());
        assertEquals(Set.of("a"), new HashSet<>(index.query(new Envelope(-1, 1, -1, 1))));
        assertEquals(Set.of("a", "c"), new HashSet<>(index.queryAround(5, 20, 30)));
        assertTrue(index.query(new Envelope(1000, 2000, 1000, 2000)).isEmpty());
    }

    @Test
    void testSegmentsWithoutUsableEnvelopeAreExcluded()
    {
        GeometryFactory factory = new GeometryFactory();
        CanonicalSegment broken = CanonicalSegment.builder()
                .segmentId("broken")
                .geometry(factory.createLineString(
                        new Coordinate[] { new Coordinate(0, 0), new Coordinate(Double.NaN, 1) }))
                .fields(Collections.emptyMap())
                .sources(Set.of(DatasetKind.CURB))
                .build();
        CanonicalStore store = TestUtils.store(broken,
                TestUtils.segment("ok", "LINESTRING (0 0, 1 1)", DatasetKind.CURB));

        SegmentSpatialIndex index = new SegmentSpatialIndex(store);
        assertEquals(1, index.getIndexedCount());
        assertEquals(1, index.getExcludedCount());
        assertEquals(List.of("ok"), index.queryAround(0, 0, 10));

        // Still in the store.
        assertEquals(2, store.size());
    }

    @Test
    void testEmptyIndex()
    {
        SegmentSpatialIndex index = new SegmentSpatialIndex(CanonicalStore.empty());
        assertTrue(index.isEmpty());
        assertTrue(index.queryAround(0, 0, 1e9).isEmpty());
    }
}
