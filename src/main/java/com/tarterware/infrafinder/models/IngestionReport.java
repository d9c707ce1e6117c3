package com.tarterware.infrafinder.models;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Summary of one ingestion run and the index built from it.
 */
@Value
@Builder(toBuilder = true)
public class IngestionReport
{
    @Singular("dataset")
    List<DatasetStatistics> datasets;

    int segmentCount;

    int indexedSegmentCount;

    boolean serviceAreaPresent;

    int serviceAreaPolygonCount;

    Instant completedAt;

    public long getTotalRowsAccepted()
    {
        return datasets.stream().mapToLong(DatasetStatistics::getRowsAccepted).sum();
    }

    public long getTotalRowsSkipped()
    {
        return datasets.stream().mapToLong(d -> d.getRowsMalformed() + d.getRowsWithoutGeometry()).sum();
    }
}
