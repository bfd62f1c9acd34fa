package com.security.anomaly.risk.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.security.anomaly.risk.domain.RiskAlertBatch;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka config for the risk job: the integration topic and a producer for alert batches
 * (plain JSON, no type headers, for non-Java consumers).
 */
@Configuration
public class RiskKafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${anomaly.kafka.topic.integration:security-integration}")
    private String integrationTopic;

    @Value("${anomaly.kafka.topic.partitions:1}")
    private int partitions;

    @Value("${anomaly.kafka.topic.replicas:1}")
    private int replicas;

    @Bean
    public NewTopic integrationTopic() {
        return TopicBuilder.name(integrationTopic)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }

    @Bean
    public ProducerFactory<String, RiskAlertBatch> riskAlertProducerFactory(ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        JsonSerializer<RiskAlertBatch> serializer = new JsonSerializer<>(objectMapper);
        serializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, RiskAlertBatch> riskAlertKafkaTemplate(
            ProducerFactory<String, RiskAlertBatch> riskAlertProducerFactory) {
        return new KafkaTemplate<>(riskAlertProducerFactory);
    }
}
