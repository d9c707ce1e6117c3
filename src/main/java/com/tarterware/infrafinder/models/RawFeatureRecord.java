package com.tarterware.infrafinder.models;

import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One row read from one dataset. Transient: it is handed to the aggregator and
 * discarded once merged.
 */
@Value
@Builder
public class RawFeatureRecord
{
    // Dataset the row was read from.
    DatasetKind source;

    // Shared segment identifier (ID_BASE_TRECHO).
    String segmentId;

    // Raw geometry serialization, still unparsed.
    String wkt;

    // Service-specific values keyed by canonical field. Blank values are kept as "".
    @Singular
    Map<SegmentField, String> values;
}
