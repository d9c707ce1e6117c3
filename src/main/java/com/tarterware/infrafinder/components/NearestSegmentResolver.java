package com.tarterware.infrafinder.components;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tarterware.infrafinder.models.CanonicalSegment;
import com.tarterware.infrafinder.models.CanonicalStore;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.NearestMatch;
import com.tarterware.infrafinder.models.SearchParameters;
import com.tarterware.infrafinder.utilities.DistanceUtilities;
import com.tarterware.infrafinder.utilities.TopologyUtilities;

/**
 * Finds the segment closest to a planar point with an expanding-ring search over a
 * {@link SegmentSpatialIndex}, followed by exact point-to-polyline distance on each
 * candidate.
 *
 * <p>
 * Search: the square {@code [x-r, y-r, x+r, y+r]} is queried starting at the initial
 * radius. Candidates accumulate across rounds and are examined once. While fewer than
 * the target number of candidates have been examined, the radius doubles, clamped to
 * the maximum radius; the round at the maximum radius is the last one.
 * </p>
 *
 * <p>
 * A candidate reached through its bounding box can lie farther away than the last
 * radius. In that case one more query is run at the best distance (capped at the
 * maximum radius), so the reported segment is the true nearest among all indexed
 * segments within the maximum radius. Matches beyond the maximum radius are dropped.
 * </p>
 *
 * <p>
 * No distance threshold is applied here; callers compare {@code distanceMeters} with
 * their own threshold. Instances are immutable and safe for concurrent use.
 * </p>
 */
public final class NearestSegmentResolver
{
    private final CanonicalStore store;

    private final SegmentSpatialIndex index;

    private static final Logger logger = LoggerFactory.getLogger(NearestSegmentResolver.class);

    public NearestSegmentResolver(CanonicalStore store, SegmentSpatialIndex index)
    {
        this.store = store;
        this.index = index;
    }

    /**
     * Resolve the nearest segment among all indexed segments, with default parameters.
     */
    public Optional<NearestMatch> resolveNearest(Coordinate point)
    {
        return resolveNearest(point, null, SearchParameters.defaults());
    }

    /**
     * Resolve the nearest segment.
     *
     * @param point    Query point in the planar CRS of the datasets.
     * @param selector Only segments that received rows from this dataset are
     *                 considered; null considers every indexed segment.
     * @param params   Search tuning; null means defaults.
     * @return The nearest match, or empty if nothing lies within the maximum radius, the
     *         store is empty, or the point is not a finite coordinate.
     * @throws IllegalArgumentException if the parameters are out of range.
     */
    public Optional<NearestMatch> resolveNearest(Coordinate point, DatasetKind selector, SearchParameters params)
    {
        SearchParameters search = params == null ? SearchParameters.defaults() : params;
        search.validate();

        if (index.isEmpty() || !TopologyUtilities.isValidCoordinate(point))
        {
            return Optional.empty();
        }

        Search state = new Search(point, selector);

        double radius = search.getInitialRadius();
        while (true)
        {
            state.scan(radius);
            if (state.examined >= search.getTargetCandidates() || radius >= search.getMaxRadius())
            {
                break;
            }
            radius = Math.min(radius * 2.0, search.getMaxRadius());
        }

        // The best candidate may sit outside the last ring; make sure nothing closer was missed.
        if (state.best != null && state.bestDistance > radius && radius < search.getMaxRadius())
        {
            radius = Math.min(state.bestDistance, search.getMaxRadius());
            state.scan(radius);
        }

        if (state.best == null || state.bestDistance > search.getMaxRadius())
        {
            logger.debug("No segment within {} of ({}, {}) for {}", search.getMaxRadius(), point.x, point.y,
                    selector);
            return Optional.empty();
        }

        logger.debug("Nearest segment {} at {} (radius {}, {} candidates) for {}", state.best.getSegmentId(),
                state.bestDistance, radius, state.examined, selector);
        return Optional.of(new NearestMatch(state.best, state.bestDistance, radius, state.examined));
    }

    /**
     * Mutable state of one resolution. Never shared between threads.
     */
    private class Search
    {
        private final Coordinate point;
        private final DatasetKind selector;
        private final Set<String> seen = new HashSet<>();

        private CanonicalSegment best;
        private double bestDistance = Double.POSITIVE_INFINITY;
        private int examined;

        Search(Coordinate point, DatasetKind selector)
        {
            this.point = point;
            this.selector = selector;
        }

        void scan(double radius)
        {
            for (String segmentId : index.queryAround(point.x, point.y, radius))
            {
                if (!seen.add(segmentId))
                {
                    continue;
                }

                CanonicalSegment segment = store.get(segmentId);
                if (segment == null || (selector != null && !segment.isFrom(selector)))
                {
                    continue;
                }

                examined++;
                double distance = DistanceUtilities.pointToGeometryDistance(point, segment.getGeometry());

                // Strictly smaller, so the first candidate encountered wins a tie.
                if (distance < bestDistance)
                {
                    bestDistance = distance;
                    best = segment;
                }
            }
        }
    }
}
