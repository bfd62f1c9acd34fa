package com.security.anomaly.persistence;

import com.security.anomaly.domain.NormalizedEvent;

import java.time.Instant;
import java.util.List;

/**
 * Durable store of normalized security events. The only state shared between ingestion and
 * the risk job.
 */
public interface EventStore {

    /**
     * @throws EventStoreException when the event could not be written
     */
    void save(NormalizedEvent event);

    /**
     * Events with {@code from <= occurredAt < to}.
     *
     * @throws EventStoreException when the window could not be read
     */
    List<NormalizedEvent> findWindow(Instant from, Instant to);
}
