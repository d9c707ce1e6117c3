package com.tarterware.infrafinder.models;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning of the expanding-ring search.
 */
@Value
@Builder
public class SearchParameters
{
    public static final double DEFAULT_INITIAL_RADIUS = 50.0;
    public static final double DEFAULT_MAX_RADIUS = 2000.0;
    public static final int DEFAULT_TARGET_CANDIDATES = 256;

    @Builder.Default
    double initialRadius = DEFAULT_INITIAL_RADIUS;

    @Builder.Default
    double maxRadius = DEFAULT_MAX_RADIUS;

    @Builder.Default
    int targetCandidates = DEFAULT_TARGET_CANDIDATES;

    public static SearchParameters defaults()
    {
        return SearchParameters.builder().build();
    }

    /**
     * Check that the parameters describe a usable search.
     *
     * @throws IllegalArgumentException if any parameter is out of range.
     */
    public void validate()
    {
        if (!(initialRadius > 0.0) || !Double.isFinite(initialRadius))
        {
            throw new IllegalArgumentException("initialRadius must be a positive number: " + initialRadius);
        }
        if (!(maxRadius >= initialRadius) || !Double.isFinite(maxRadius))
        {
            throw new IllegalArgumentException("maxRadius must be at least initialRadius: " + maxRadius);
        }
        if (targetCandidates < 1)
        {
            throw new IllegalArgumentException("targetCandidates must be at least 1: " + targetCandidates);
        }
    }
}
