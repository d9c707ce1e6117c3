package com.tarterware.infrafinder.components;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tarterware.infrafinder.models.DatasetDescriptor;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.DatasetStatistics;
import com.tarterware.infrafinder.models.RawFeatureRecord;
import com.tarterware.infrafinder.models.SegmentField;
import com.tarterware.infrafinder.utilities.StringUtilities;

/**
 * Streams the rows of a delimited dataset file as {@link RawFeatureRecord}s, using the
 * column mapping of the dataset's {@link DatasetKind}.
 *
 * <p>
 * A missing file is not an error: it is reported as absent and contributes no rows.
 * Rows that cannot be decoded, or that carry no segment id, are counted as malformed
 * and skipped.
 * </p>
 */
@Component
public class DatasetReader
{
    // Give up on a file after this many undecodable rows in a row.
    static final int MAX_CONSECUTIVE_FAILURES = 100;

    private final CsvMapper csvMapper;

    private final CsvSchema schema;

    private static final Logger logger = LoggerFactory.getLogger(DatasetReader.class);

    public DatasetReader(@Value("${com.tarterware.infrafinder.csv-separator:;}") char separator)
    {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);
    }

    /**
     * Read every row of the dataset and hand the decoded records to the consumer.
     *
     * @param descriptor Dataset to read.
     * @param consumer   Receives each record in file order.
     * @return Read counts for the dataset.
     */
    public DatasetStatistics read(DatasetDescriptor descriptor, Consumer<RawFeatureRecord> consumer)
    {
        DatasetKind kind = descriptor.getKind();
        DatasetStatistics statistics = new DatasetStatistics(kind);

        if (!Files.isRegularFile(descriptor.getPath()))
        {
            logger.warn("Skipping dataset {}: {} not found", kind, descriptor.getPath());
            return statistics;
        }
        statistics.setPresent(true);

        try (Reader reader = Files.newBufferedReader(descriptor.getPath(), StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema)
                        .readValues(reader))
        {
            int consecutiveFailures = 0;
            while (true)
            {
                Map<String, String> row;
                try
                {
                    if (!rows.hasNextValue())
                    {
                        break;
                    }
                    row = rows.nextValue();
                    consecutiveFailures = 0;
                }
                catch (IOException | RuntimeJsonMappingException e)
                {
                    statistics.setRowsRead(statistics.getRowsRead() + 1);
                    statistics.setRowsMalformed(statistics.getRowsMalformed() + 1);
                    if (++consecutiveFailures >= MAX_CONSECUTIVE_FAILURES)
                    {
                        logger.warn("Abandoning dataset {} after {} unreadable rows: {}", kind, consecutiveFailures,
                                e.getMessage());
                        break;
                    }
                    continue;
                }

                statistics.setRowsRead(statistics.getRowsRead() + 1);

                RawFeatureRecord record = toRecord(kind, row);
                if (record == null)
                {
                    statistics.setRowsMalformed(statistics.getRowsMalformed() + 1);
                    continue;
                }
                consumer.accept(record);
            }
        }
        catch (IOException e)
        {
            // Rows read before the failure have already been handed over.
            logger.warn("Unable to finish reading dataset {} from {}: {}", kind, descriptor.getPath(),
                    e.getMessage());
        }

        return statistics;
    }

    /**
     * Convert a decoded row into a record.
     *
     * @return The record, or null if the row has no segment id.
     */
    RawFeatureRecord toRecord(DatasetKind kind, Map<String, String> rawRow)
    {
        Map<String, String> row = new HashMap<>();
        for (Map.Entry<String, String> entry : rawRow.entrySet())
        {
            row.put(StringUtilities.normalizeHeader(entry.getKey()), entry.getValue());
        }

        String segmentId = StringUtilities.normalizeValue(row.get(DatasetKind.SEGMENT_ID_COLUMN));
        if (segmentId.isEmpty())
        {
            return null;
        }

        RawFeatureRecord.RawFeatureRecordBuilder builder = RawFeatureRecord.builder()
                .source(kind)
                .segmentId(segmentId)
                .wkt(StringUtilities.normalizeValue(row.get(DatasetKind.GEOMETRY_COLUMN)));

        // Only columns that exist in the file become fields; blanks are kept as "".
        for (Map.Entry<String, SegmentField> column : kind.getColumnMapping().entrySet())
        {
            if (row.containsKey(column.getKey()))
            {
                builder.value(column.getValue(), StringUtilities.normalizeValue(row.get(column.getKey())));
            }
        }

        return builder.build();
    }
}
