package com.security.anomaly.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Row of {@code anormal_events}: one normalized security event. The table is owned and
 * migrated outside this service.
 */
@Entity
@Table(name = "anormal_events", indexes = {
    @Index(name = "idx_anormal_events_ip", columnList = "ip"),
    @Index(name = "idx_anormal_events_occurred_at", columnList = "occurred_at"),
    @Index(name = "idx_anormal_events_severity", columnList = "severity")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnormalEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "service_name", nullable = false, length = 100)
    private String serviceName;

    @Column(name = "ip", nullable = false)
    private String ip;

    @Column(name = "event_type", nullable = false)
    private Integer eventType;

    @Column(name = "severity", nullable = false)
    private Integer severity;

    @Column(name = "description", nullable = false, columnDefinition = "text")
    private String description;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "request_id")
    private String requestId;

    @Column(name = "method", length = 16)
    private String method;

    @Column(name = "path", columnDefinition = "text")
    private String path;

    @Column(name = "status_code")
    private Integer statusCode;

    @Column(name = "user_agent", columnDefinition = "text")
    private String userAgent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "request", columnDefinition = "jsonb")
    private Object request;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
