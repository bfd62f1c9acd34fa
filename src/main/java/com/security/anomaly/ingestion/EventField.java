package com.security.anomaly.ingestion;

import java.util.List;
import java.util.Map;

/**
 * Inbound event fields and the keys each may arrive under. The first key present wins.
 */
public enum EventField {
    SERVICE_NAME("ServiceName", "serviceName", "service_name"),
    IP("Ip", "ip"),
    DESCRIPTION("Description", "description"),
    EVENT_TYPE("EventType", "eventType", "event_type"),
    SEVERITY("Severity", "severity"),
    OCCURRED_AT("OccurredAt", "occurredAt", "occurred_at"),
    REQUEST_ID("RequestId", "requestId", "request_id"),
    METHOD("Method", "method"),
    PATH("Path", "path"),
    STATUS_CODE("StatusCode", "statusCode", "status_code"),
    USER_AGENT("UserAgent", "userAgent", "user_agent"),
    REQUEST("Request", "request");

    private final List<String> aliases;

    EventField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    /** Name used in validation errors (the PascalCase wire name). */
    public String wireName() {
        return aliases.get(0);
    }

    /** Value under the first alias present in {@code raw}; null when none is. */
    public Object lookup(Map<String, ?> raw) {
        for (String key : aliases) {
            if (raw.containsKey(key)) {
                return raw.get(key);
            }
        }
        return null;
    }
}
