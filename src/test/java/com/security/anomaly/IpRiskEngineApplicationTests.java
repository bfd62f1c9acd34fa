package com.security.anomaly;

import com.security.anomaly.risk.job.RiskInferenceJob;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test: verifies that the application context loads against Embedded Kafka and a
 * Testcontainers PostgreSQL. Requires Docker.
 * Run with: mvn test -Pintegration
 */
@Tag("integration")
@SpringBootTest(classes = IpRiskEngineApplication.class,
        properties = "anomaly.risk.model.path=target/no-such-model.json")
@EmbeddedKafka(partitions = 1, topics = {"security-events", "security-integration"},
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers
class IpRiskEngineApplicationTests {

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
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(RiskInferenceJob.class)).isNotNull();
    }
}
