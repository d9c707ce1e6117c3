package com.tarterware.infrafinder.models;

import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * Planar nearest-segment lookup result, as exposed over HTTP.
 */
@Value
@Builder
public class NearestSegmentResponse
{
    String segmentId;
    double distanceMeters;
    double searchRadius;
    int candidatesExamined;
    Set<DatasetKind> sources;
    Map<SegmentField, String> fields;

    public static NearestSegmentResponse from(NearestMatch match)
    {
        return NearestSegmentResponse.builder()
                .segmentId(match.getSegmentId())
                .distanceMeters(match.getDistanceMeters())
                .searchRadius(match.getSearchRadius())
                .candidatesExamined(match.getCandidatesExamined())
                .sources(match.getSegment().getSources())
                .fields(match.getSegment().getFields())
                .build();
    }
}
