package com.security.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Canonical form of an inbound security event, as persisted to {@code anormal_events}.
 * Enum fields are always resolved integer codes.
 */
@Value
@Builder
public class NormalizedEvent {

    String serviceName;
    String ip;
    /** {@link SecurityEventType} code. */
    int eventType;
    /** {@link Severity} code. */
    int severity;
    String description;
    Instant occurredAt;

    String requestId;
    String method;
    String path;
    /** HTTP status of the offending request; null when absent or unparseable. */
    Integer statusCode;
    String userAgent;
    /** JSON-compatible value (Map, List, ...) or null. */
    Object request;
}
