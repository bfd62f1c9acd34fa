package com.security.anomaly.persistence.service;

import com.security.anomaly.domain.NormalizedEvent;
import com.security.anomaly.domain.SecurityEventType;
import com.security.anomaly.domain.Severity;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.security.anomaly.testutil.TestEvents.NOW;
import static com.security.anomaly.testutil.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * EventPersistenceService against a real anormal_events table: inet and jsonb mapping and the
 * half-open window query. Requires Docker.
 * Run with: mvn test -Pintegration
 */
@Tag("integration")
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(EventPersistenceService.class)
@Testcontainers
class EventPersistenceServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
            .withInitScript("db/anormal_events.sql");

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", () -> postgres.getJdbcUrl() + "&stringtype=unspecified");
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private EventPersistenceService eventStore;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void savedEventRoundTripsThroughInetAndJsonb() {
        eventStore.save(event("203.0.113.9")
                .eventType(SecurityEventType.SQLInjection.getCode())
                .severity(Severity.Attack.getCode())
                .occurredAt(NOW)
                .statusCode(403)
                .request(Map.of("query", "' OR 1=1 --"))
                .build());
        entityManager.flush();
        entityManager.clear();

        List<NormalizedEvent> window = eventStore.findWindow(NOW.minusSeconds(60), NOW.plusSeconds(1));

        assertThat(window).hasSize(1);
        NormalizedEvent stored = window.get(0);
        assertThat(stored.getIp()).isEqualTo("203.0.113.9");
        assertThat(stored.getEventType()).isEqualTo(1);
        assertThat(stored.getSeverity()).isEqualTo(3);
        assertThat(stored.getStatusCode()).isEqualTo(403);
        assertThat(stored.getOccurredAt()).isEqualTo(NOW);
        assertThat(stored.getRequest()).isEqualTo(Map.of("query", "' OR 1=1 --"));
    }

    @Test
    void windowIncludesStartAndExcludesEnd() {
        Instant from = NOW.minusSeconds(60);
        eventStore.save(event("10.0.0.1").occurredAt(from.minusSeconds(1)).build());
        eventStore.save(event("10.0.0.2").occurredAt(from).build());
        eventStore.save(event("10.0.0.3").occurredAt(NOW.minusSeconds(1)).build());
        eventStore.save(event("10.0.0.4").occurredAt(NOW).build());
        entityManager.flush();
        entityManager.clear();

        List<NormalizedEvent> window = eventStore.findWindow(from, NOW);

        assertThat(window).extracting(NormalizedEvent::getIp)
                .containsExactlyInAnyOrder("10.0.0.2", "10.0.0.3");
    }
}
