package com.tarterware.infrafinder.models;

import org.locationtech.jts.geom.Envelope;

import lombok.Value;

/**
 * Bounding box of a segment plus a non-owning reference to it by id.
 */
@Value
public class SpatialIndexEntry
{
    Envelope envelope;

    String segmentId;
}
