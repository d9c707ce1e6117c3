package com.tarterware.infrafinder.components;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.infrafinder.services.IngestionService;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;

/**
 * Holds the snapshot currently served to readers.
 *
 * <p>
 * The snapshot is loaded once before the service takes traffic. A reload builds a
 * complete new snapshot off to the side and only then swaps the reference, so
 * readers see either the old pair or the new pair, never a mix or a partial build.
 * </p>
 */
@Component
public class InfrastructureRegistry
{
    public static final String ENDPOINT_SEGMENT_COUNT = "infrafinder.segments.count";
    public static final String ENDPOINT_INDEXED_SEGMENT_COUNT = "infrafinder.segments.indexed.count";

    @Value("${com.tarterware.infrafinder.load-on-startup:true}")
    private boolean loadOnStartup;

    private final IngestionService ingestionService;

    private final AtomicReference<InfrastructureSnapshot> current = new AtomicReference<>(
            InfrastructureSnapshot.empty());

    // Serializes reloads; readers never take it.
    private final Object reloadLock = new Object();

    private static final Logger logger = LoggerFactory.getLogger(InfrastructureRegistry.class);

    public InfrastructureRegistry(IngestionService ingestionService, MeterRegistry meterRegistry)
    {
        this.ingestionService = ingestionService;

        meterRegistry.gauge(ENDPOINT_SEGMENT_COUNT, current, ref -> ref.get().getStore().size());
        meterRegistry.gauge(ENDPOINT_INDEXED_SEGMENT_COUNT, current, ref -> ref.get().getIndex().getIndexedCount());
    }

    @PostConstruct
    public void init()
    {
        if (!loadOnStartup)
        {
            logger.info("Startup load disabled; serving an empty snapshot until reloaded");
            return;
        }

        // A FatalStartupException escapes here and aborts context startup.
        InfrastructureSnapshot snapshot = ingestionService.ingest();
        current.set(snapshot);
        logger.info("Serving {}", snapshot);
    }

    /**
     * @return The snapshot to use for the whole of one request.
     */
    public InfrastructureSnapshot current()
    {
        return current.get();
    }

    /**
     * Re-ingest all datasets and atomically replace the served snapshot. If ingestion
     * fails, the previous snapshot stays in place and the exception propagates.
     *
     * @return The newly served snapshot.
     */
    public InfrastructureSnapshot reload()
    {
        synchronized (reloadLock)
        {
            InfrastructureSnapshot snapshot = ingestionService.ingest();
            InfrastructureSnapshot previous = current.getAndSet(snapshot);
            logger.info("Reloaded: {} replaced {}", snapshot, previous);
            return snapshot;
        }
    }

    /**
     * Install a snapshot built elsewhere.
     */
    public void replace(InfrastructureSnapshot snapshot)
    {
        if (snapshot == null)
        {
            throw new IllegalArgumentException("snapshot cannot be null!");
        }
        current.set(snapshot);
    }
}
