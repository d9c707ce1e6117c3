package com.tarterware.infrafinder.services;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.tarterware.infrafinder.components.IndicatorMapper;
import com.tarterware.infrafinder.components.InfrastructureRegistry;
import com.tarterware.infrafinder.components.InfrastructureSnapshot;
import com.tarterware.infrafinder.models.AvailabilityDescriptor;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.NearestMatch;
import com.tarterware.infrafinder.models.SearchParameters;
import com.tarterware.infrafinder.models.ServiceCategory;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;

/**
 * Evaluates the availability of every service category around a planar point.
 *
 * <p>
 * Categories are independent reads of the same snapshot and are resolved
 * concurrently; the result is returned once all of them are done. A match farther
 * away than the availability threshold counts as no match.
 * </p>
 */
@Service
public class AvailabilityService
{
    public static final String ENDPOINT_EVALUATION_TIME = "infrafinder.availability.evaluation.time";

    private final InfrastructureRegistry registry;

    private final SearchParameters searchParameters;

    private final double thresholdMeters;

    // Dedicated pool for per-category resolutions.
    private final ExecutorService resolutionExecutor;

    private final Timer evaluationTimer;

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityService.class);

    public AvailabilityService(InfrastructureRegistry registry, MeterRegistry meterRegistry,
            @Value("${com.tarterware.infrafinder.search.initial-radius:50}") double initialRadius,
            @Value("${com.tarterware.infrafinder.search.max-radius:2000}") double maxRadius,
            @Value("${com.tarterware.infrafinder.search.target-candidates:256}") int targetCandidates,
            @Value("${com.tarterware.infrafinder.availability.threshold-meters:50}") double thresholdMeters,
            @Value("${com.tarterware.infrafinder.availability.threads:8}") int threads)
    {
        this.registry = registry;
        this.searchParameters = SearchParameters.builder()
                .initialRadius(initialRadius)
                .maxRadius(maxRadius)
                .targetCandidates(targetCandidates)
                .build();
        this.searchParameters.validate();

        if (!(thresholdMeters >= 0.0))
        {
            throw new IllegalArgumentException("Availability threshold must not be negative: " + thresholdMeters);
        }
        this.thresholdMeters = thresholdMeters;

        this.resolutionExecutor = Executors.newFixedThreadPool(Math.max(1, threads));
        this.evaluationTimer = meterRegistry.timer(ENDPOINT_EVALUATION_TIME);

        logger.info("AvailabilityService using {} with threshold {} m on {} threads", searchParameters,
                thresholdMeters, threads);
    }

    @PreDestroy
    public void shutdown()
    {
        resolutionExecutor.shutdownNow();
    }

    /**
     * Evaluate every service category around a point.
     *
     * @param planarPoint Point in the planar CRS of the datasets.
     * @return Descriptors keyed by response key, in category declaration order.
     */
    public Map<String, AvailabilityDescriptor> evaluateAll(Coordinate planarPoint)
    {
        // One snapshot for the whole request, even if a reload swaps it meanwhile.
        return evaluateAll(registry.current(), planarPoint);
    }

    /**
     * Evaluate every service category around a point against a snapshot the caller
     * already holds.
     *
     * @param snapshot    Snapshot to read.
     * @param planarPoint Point in the planar CRS of the datasets.
     * @return Descriptors keyed by response key, in category declaration order.
     */
    public Map<String, AvailabilityDescriptor> evaluateAll(InfrastructureSnapshot snapshot, Coordinate planarPoint)
    {
        return evaluationTimer.record(() ->
        {
            Map<ServiceCategory, Future<AvailabilityDescriptor>> futures = new EnumMap<>(ServiceCategory.class);
            for (ServiceCategory category : ServiceCategory.values())
            {
                futures.put(category, resolutionExecutor.submit(() -> evaluate(snapshot, category, planarPoint)));
            }

            Map<String, AvailabilityDescriptor> descriptors = new LinkedHashMap<>();
            for (Map.Entry<ServiceCategory, Future<AvailabilityDescriptor>> entry : futures.entrySet())
            {
                try
                {
                    descriptors.put(entry.getKey().getResponseKey(), entry.getValue().get());
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while evaluating " + entry.getKey(), e);
                }
                catch (ExecutionException e)
                {
                    throw new IllegalStateException("Failed to evaluate " + entry.getKey(), e.getCause());
                }
            }
            return descriptors;
        });
    }

    /**
     * Evaluate a single category against a snapshot.
     *
     * @param snapshot    Snapshot to read.
     * @param category    Service category.
     * @param planarPoint Point in the planar CRS of the datasets.
     * @return The descriptor; NOT_FOUND when nothing lies within the threshold.
     */
    public AvailabilityDescriptor evaluate(InfrastructureSnapshot snapshot, ServiceCategory category,
            Coordinate planarPoint)
    {
        Optional<NearestMatch> match = snapshot.getResolver().resolveNearest(planarPoint, category.getDataset(),
                searchParameters);

        if (match.isPresent() && match.get().getDistanceMeters() <= thresholdMeters)
        {
            return IndicatorMapper.mapIndicator(category, match.get().getSegment());
        }
        return IndicatorMapper.mapIndicator(category, null);
    }

    /**
     * Resolve the nearest segment of a dataset in the current snapshot, without any
     * threshold.
     *
     * @param planarPoint Point in the planar CRS of the datasets.
     * @param dataset     Dataset selector; null for any segment.
     * @return The nearest match, if any lies within the maximum search radius.
     */
    public Optional<NearestMatch> resolveNearest(Coordinate planarPoint, DatasetKind dataset)
    {
        return registry.current().getResolver().resolveNearest(planarPoint, dataset, searchParameters);
    }
}
