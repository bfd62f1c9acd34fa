package com.security.anomaly.ingestion;

/**
 * What happened to a single delivery. Neither outcome causes redelivery.
 */
public enum IngestionOutcome {
    /** Normalized and stored. */
    ACCEPTED,
    /** Dropped: undecodable, invalid, or the store failed. */
    REJECTED
}
