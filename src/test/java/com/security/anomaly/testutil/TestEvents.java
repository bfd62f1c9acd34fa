package com.security.anomaly.testutil;

import com.security.anomaly.domain.NormalizedEvent;
import com.security.anomaly.domain.SecurityEventType;
import com.security.anomaly.domain.Severity;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event fixtures shared by the ingestion and risk tests.
 */
public final class TestEvents {

    public static final Instant NOW = Instant.parse("2025-12-25T19:10:30Z");

    private TestEvents() {
    }

    /** A valid raw event as the API gateway sends it (PascalCase keys, enums by name). */
    public static Map<String, Object> rawEvent() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("ServiceName", "api-gateway");
        raw.put("Ip", "1.2.3.4");
        raw.put("Description", "SQL injection pattern in query string");
        raw.put("EventType", "SQLInjection");
        raw.put("Severity", "Attack");
        raw.put("OccurredAt", "2025-12-25T19:10:30.123Z");
        raw.put("Method", "GET");
        raw.put("Path", "/api/users");
        raw.put("StatusCode", 403);
        raw.put("UserAgent", "curl/8.0");
        return raw;
    }

    public static NormalizedEvent.NormalizedEventBuilder event(String ip) {
        return NormalizedEvent.builder()
                .serviceName("api-gateway")
                .ip(ip)
                .eventType(SecurityEventType.Unknown.getCode())
                .severity(Severity.Info.getCode())
                .description("test event")
                .occurredAt(NOW.minusSeconds(5))
                .method("GET")
                .path("/")
                .statusCode(200)
                .userAgent("Mozilla/5.0");
    }
}
