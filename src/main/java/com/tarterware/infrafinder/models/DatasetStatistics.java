package com.tarterware.infrafinder.models;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row counts for one dataset of an ingestion run.
 */
@NoArgsConstructor
@Data
public class DatasetStatistics
{
    private DatasetKind kind;

    // False when the file did not exist; such a dataset contributes no rows.
    private boolean present;

    private long rowsRead;

    private long rowsAccepted;

    // Rows without a segment id, or rows the reader could not decode.
    private long rowsMalformed;

    // Rows whose geometry was missing or could not be parsed.
    private long rowsWithoutGeometry;

    public DatasetStatistics(DatasetKind kind)
    {
        this.kind = kind;
    }
}
