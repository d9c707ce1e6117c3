package com.tarterware.infrafinder.models;

import java.nio.file.Path;

import lombok.Value;

/**
 * A dataset selected for ingestion: which kind it is and where it lives.
 */
@Value
public class DatasetDescriptor
{
    DatasetKind kind;

    Path path;
}
