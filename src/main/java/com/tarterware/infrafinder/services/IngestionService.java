package com.tarterware.infrafinder.services;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import com.tarterware.infrafinder.components.DatasetReader;
import com.tarterware.infrafinder.components.InfrastructureSnapshot;
import com.tarterware.infrafinder.components.SegmentAggregator;
import com.tarterware.infrafinder.components.ServiceArea;
import com.tarterware.infrafinder.components.ServiceAreaReader;
import com.tarterware.infrafinder.components.WktGeometryParser;
import com.tarterware.infrafinder.exceptions.FatalStartupException;
import com.tarterware.infrafinder.models.CanonicalStore;
import com.tarterware.infrafinder.models.DatasetDescriptor;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.DatasetStatistics;
import com.tarterware.infrafinder.models.IngestionReport;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Runs one ingestion: reads every configured dataset, aggregates the rows into a
 * canonical store and builds the spatial index over it.
 */
@Service
public class IngestionService
{
    public static final String PROPERTY_PREFIX = "com.tarterware.infrafinder.datasets.";

    // Region polygons, e.g. com.tarterware.infrafinder.datasets.service-area.
    public static final String SERVICE_AREA_KEY = "service-area";

    public static final String DEFAULT_SERVICE_AREA_FILE = "20250701_trecho_logradouro.csv";

    public static final String ENDPOINT_ROWS_SKIPPED = "infrafinder.ingestion.rows.skipped";

    @Value("${com.tarterware.infrafinder.data-dir:data}")
    private String dataDir;

    private final DatasetReader datasetReader;

    private final ServiceAreaReader serviceAreaReader;

    private final WktGeometryParser geometryParser;

    private final Environment environment;

    private final Counter rowsSkippedCounter;

    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    public IngestionService(DatasetReader datasetReader, ServiceAreaReader serviceAreaReader,
            WktGeometryParser geometryParser, Environment environment, MeterRegistry meterRegistry)
    {
        this.datasetReader = datasetReader;
        this.serviceAreaReader = serviceAreaReader;
        this.geometryParser = geometryParser;
        this.environment = environment;
        this.rowsSkippedCounter = meterRegistry.counter(ENDPOINT_ROWS_SKIPPED);
    }

    /**
     * Build the list of datasets to ingest. Each kind reads
     * {@code <data-dir>/<file>}, where the file name defaults to the kind's own and can
     * be overridden with {@code com.tarterware.infrafinder.datasets.<kind>}.
     *
     * @return One descriptor per dataset kind.
     */
    public List<DatasetDescriptor> getDatasetDescriptors()
    {
        Path directory = Paths.get(dataDir);
        List<DatasetDescriptor> descriptors = new ArrayList<>();
        for (DatasetKind kind : DatasetKind.values())
        {
            String fileName = environment.getProperty(PROPERTY_PREFIX + kind.getPropertyKey(),
                    kind.getDefaultFileName());
            descriptors.add(new DatasetDescriptor(kind, directory.resolve(fileName)));
        }
        return descriptors;
    }

    /**
     * @return {@code <data-dir>/<file>} of the region polygons, the file name being
     *         overridable with {@code com.tarterware.infrafinder.datasets.service-area}.
     */
    public Path getServiceAreaPath()
    {
        return Paths.get(dataDir).resolve(
                environment.getProperty(PROPERTY_PREFIX + SERVICE_AREA_KEY, DEFAULT_SERVICE_AREA_FILE));
    }

    /**
     * Ingest the configured datasets.
     *
     * @return A fully built snapshot.
     * @throws FatalStartupException if no usable data was found.
     */
    public InfrastructureSnapshot ingest()
    {
        return ingest(getDatasetDescriptors());
    }

    /**
     * Ingest the given datasets into a new snapshot. Nothing is shared with any
     * snapshot already in use.
     *
     * @param descriptors Datasets to read, in merge order.
     * @return A fully built snapshot.
     * @throws FatalStartupException if the store is empty or nothing can be indexed.
     */
    public InfrastructureSnapshot ingest(List<DatasetDescriptor> descriptors)
    {
        SegmentAggregator aggregator = new SegmentAggregator(geometryParser);
        IngestionReport.IngestionReportBuilder report = IngestionReport.builder();

        for (DatasetDescriptor descriptor : descriptors)
        {
            logger.info("Ingesting {} from {}", descriptor.getKind(), descriptor.getPath());

            DatasetStatistics statistics = datasetReader.read(descriptor, aggregator::accept);
            statistics.setRowsAccepted(aggregator.getAcceptedCount(descriptor.getKind()));
            statistics.setRowsWithoutGeometry(aggregator.getGeometryFailureCount(descriptor.getKind()));
            report.dataset(statistics);

            long skipped = statistics.getRowsMalformed() + statistics.getRowsWithoutGeometry();
            rowsSkippedCounter.increment(skipped);

            logger.info("Done {}: read={} accepted={} malformed={} withoutGeometry={}", descriptor.getKind(),
                    statistics.getRowsRead(), statistics.getRowsAccepted(), statistics.getRowsMalformed(),
                    statistics.getRowsWithoutGeometry());
        }

        CanonicalStore store = aggregator.build();
        ServiceArea serviceArea = serviceAreaReader.read(getServiceAreaPath());
        InfrastructureSnapshot snapshot = new InfrastructureSnapshot(store, serviceArea,
                report.completedAt(Instant.now()).build());

        if (snapshot.getIndex().isEmpty())
        {
            throw new FatalStartupException(
                    "None of the " + store.size() + " segments has a usable geometry; the index cannot be built");
        }

        logger.info("Ingestion complete: {} segments, {} indexed, {} without usable geometry", store.size(),
                snapshot.getIndex().getIndexedCount(), snapshot.getIndex().getExcludedCount());

        return snapshot;
    }
}
