package com.tarterware.infrafinder.components;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import com.tarterware.infrafinder.models.CanonicalSegment;
import com.tarterware.infrafinder.models.CanonicalStore;
import com.tarterware.infrafinder.models.SpatialIndexEntry;
import com.tarterware.infrafinder.utilities.TopologyUtilities;

/**
 * Static bounding-box index over the geometries of a {@link CanonicalStore}.
 *
 * <p>
 * The index is built once, in the constructor, with a Sort-Tile-Recursive packed
 * R-tree, and is never modified afterwards; a data refresh builds a new instance.
 * Because the tree is fully built before the constructor returns, any number of
 * threads may query it concurrently.
 * </p>
 *
 * <p>
 * Segments without at least one part holding two valid coordinates have no usable
 * bounding box. They are left out of the index but stay in the store.
 * </p>
 */
public final class SegmentSpatialIndex
{
    private static final int NODE_CAPACITY = 10;

    private final STRtree tree;

    private final int indexedCount;

    private final int excludedCount;

    /**
     * Build the index for every segment of the store.
     *
     * @param store Canonical store to index; referenced by id only.
     */
    public SegmentSpatialIndex(CanonicalStore store)
    {
        STRtree strTree = new STRtree(NODE_CAPACITY);
        int indexed = 0;
        int excluded = 0;

        for (CanonicalSegment segment : store.segments())
        {
            Envelope envelope = TopologyUtilities.getUsableEnvelope(segment.getGeometry());
            if (envelope == null)
            {
                excluded++;
                continue;
            }
            strTree.insert(envelope, new SpatialIndexEntry(envelope, segment.getSegmentId()));
            indexed++;
        }

        // Build eagerly; a lazily built STRtree would be mutated by the first query.
        strTree.build();

        this.tree = strTree;
        this.indexedCount = indexed;
        this.excludedCount = excluded;
    }

    /**
     * Find the segments whose bounding box intersects the rectangle.
     *
     * @param rect Query rectangle.
     * @return Ids of intersecting segments, in the tree's traversal order.
     */
    public List<String> query(Envelope rect)
    {
        List<String> ids = new ArrayList<>();
        if (indexedCount == 0)
        {
            return ids;
        }

        tree.query(rect, item -> ids.add(((SpatialIndexEntry) item).getSegmentId()));
        return ids;
    }

    /**
     * Query the axis-aligned square of half-width {@code radius} centered on (x, y).
     */
    public List<String> queryAround(double x, double y, double radius)
    {
        return query(new Envelope(x - radius, x + radius, y - radius, y + radius));
    }

    public int getIndexedCount()
    {
        return indexedCount;
    }

    public int getExcludedCount()
    {
        return excludedCount;
    }

    public boolean isEmpty()
    {
        return indexedCount == 0;
    }

    @Override
    public String toString()
    {
        return "SegmentSpatialIndex[indexed=" + indexedCount + ", excluded=" + excludedCount + "]";
    }
}
