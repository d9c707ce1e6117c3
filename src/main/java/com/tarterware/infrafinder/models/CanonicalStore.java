package com.tarterware.infrafinder.models;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable mapping from segment id to {@link CanonicalSegment}. Iteration follows the
 * order in which segments were first seen during aggregation.
 */
public final class CanonicalStore
{
    private static final CanonicalStore EMPTY = new CanonicalStore(Collections.emptyMap());

    private final Map<String, CanonicalSegment> segments;

    private CanonicalStore(Map<String, CanonicalSegment> segments)
    {
        this.segments = segments;
    }

    /**
     * Create a store holding a copy of the given segments.
     *
     * @param segments Segments by id, in the order they should be iterated.
     * @return An immutable store.
     */
    public static CanonicalStore of(Map<String, CanonicalSegment> segments)
    {
        if (segments == null || segments.isEmpty())
        {
            return EMPTY;
        }
        return new CanonicalStore(Collections.unmodifiableMap(new LinkedHashMap<>(segments)));
    }

    public static CanonicalStore empty()
    {
        return EMPTY;
    }

    public CanonicalSegment get(String segmentId)
    {
        return segments.get(segmentId);
    }

    public Collection<CanonicalSegment> segments()
    {
        return segments.values();
    }

    public int size()
    {
        return segments.size();
    }

    public boolean isEmpty()
    {
        return segments.isEmpty();
    }

    @Override
    public String toString()
    {
        return "CanonicalStore[segments=" + segments.size() + "]";
    }
}
