package com.security.anomaly.risk.job;

/**
 * What one inference cycle ended with.
 */
public enum CycleResult {
    /** No artifact on disk, or it failed to load. */
    NO_ARTIFACT,
    /** No events in the window. */
    EMPTY_WINDOW,
    /** Events scored, but no IP reached a threshold outside its cooldown. */
    NOTHING_TO_PUBLISH,
    PUBLISHED,
    /** Fetch, scoring or publish failed; the next cycle runs as usual. */
    FAILED
}
