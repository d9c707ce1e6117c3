package com.tarterware.infrafinder.models;

import lombok.Value;

/**
 * Result of a nearest-segment search.
 */
@Value
public class NearestMatch
{
    CanonicalSegment segment;

    // True minimum planar distance from the query point to the segment geometry.
    double distanceMeters;

    // Radius of the last ring queried before the search stopped.
    double searchRadius;

    // Number of distinct candidates whose exact distance was computed.
    int candidatesExamined;

    public String getSegmentId()
    {
        return segment.getSegmentId();
    }
}
