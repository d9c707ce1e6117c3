package com.tarterware.infrafinder.models;

/**
 * The fixed set of optional attributes a {@link CanonicalSegment} can carry. Each
 * field declares how conflicting values from several rows are merged during
 * aggregation.
 */
public enum SegmentField
{
    LIGHTING_ID,
    LIGHTING_INDICATOR,

    CURB_ID,
    CURB_INDICATOR,

    PAVING_ID,
    PAVING_WIDTH_START,
    PAVING_WIDTH_END,
    PAVING_INDICATOR,
    PAVING_SIDE,
    PAVING_TYPE,
    PAVING_DATE(MergePolicy.MOST_RECENT),

    WATER_ID,
    WATER_SIDE,
    WATER_INDICATOR,
    WATER_DATE(MergePolicy.MOST_RECENT),

    ELECTRICITY_ID,
    ELECTRICITY_INDICATOR,

    SEWAGE_ID,
    SEWAGE_SIDE,
    SEWAGE_INDICATOR,
    SEWAGE_DATE(MergePolicy.MOST_RECENT),

    TELEPHONY_ID,
    TELEPHONY_INDICATOR,

    COLLECTION_PROGRAM,
    COLLECTION_SHIFT,
    COLLECTION_DISTRICT,
    COLLECTION_COOPERATIVE;

    /**
     * How values from different rows sharing a segment id are reconciled.
     */
    public enum MergePolicy
    {
        FIRST_NON_EMPTY,
        MOST_RECENT
    }

    private final MergePolicy mergePolicy;

    SegmentField()
    {
        this(MergePolicy.FIRST_NON_EMPTY);
    }

    SegmentField(MergePolicy mergePolicy)
    {
        this.mergePolicy = mergePolicy;
    }

    public MergePolicy getMergePolicy()
    {
        return mergePolicy;
    }
}
