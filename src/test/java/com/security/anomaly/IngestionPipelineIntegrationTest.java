package com.security.anomaly;

import com.security.anomaly.persistence.entity.AnormalEventEntity;
import com.security.anomaly.persistence.repository.AnormalEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration test: REST -> ingestion topic -> consumer -> anormal_events.
 * Uses Embedded Kafka and Testcontainers PostgreSQL. Requires Docker.
 * Run with: mvn test -Pintegration
 */
@Tag("integration")
@SpringBootTest(classes = IpRiskEngineApplication.class, properties = "anomaly.risk.job.enabled=false")
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = {"security-events", "security-integration"},
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers
class IngestionPipelineIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
            .withInitScript("db/anormal_events.sql");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AnormalEventRepository repository;

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", () -> postgres.getJdbcUrl() + "&stringtype=unspecified");
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Test
    @DisplayName("Event raised over REST is normalized and stored")
    void raisedEventIsStored() throws Exception {
        mockMvc.perform(post("/api/v1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "ServiceName": "api-gateway",
                                  "Ip": "203.0.113.9",
                                  "Description": "SQL injection pattern",
                                  "EventType": "SQLInjection",
                                  "Severity": "Attack",
                                  "OccurredAt": "2025-12-25T19:10:30Z",
                                  "StatusCode": "403",
                                  "Request": "{\\"query\\": \\"' OR 1=1 --\\"}"
                                }
                                """))
                .andExpect(status().isAccepted());

        await().atMost(Duration.ofSeconds(20)).pollInterval(Duration.ofMillis(500)).untilAsserted(() -> {
            List<AnormalEventEntity> stored = repository.findWindow(
                    Instant.parse("2025-12-25T19:00:00Z"), Instant.parse("2025-12-25T20:00:00Z"));
            assertThat(stored).hasSize(1);
            assertThat(stored.get(0).getIp()).isEqualTo("203.0.113.9");
            assertThat(stored.get(0).getEventType()).isEqualTo(1);
            assertThat(stored.get(0).getSeverity()).isEqualTo(3);
            assertThat(stored.get(0).getStatusCode()).isEqualTo(403);
        });
    }
}
