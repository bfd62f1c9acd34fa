package com.security.anomaly.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Raises raw security events onto the ingestion topic, keyed by the fixed routing key.
 * Validation is left to the ingestion side.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityEventProducer {

    private final KafkaTemplate<String, Map<String, Object>> securityEventKafkaTemplate;

    @Value("${anomaly.kafka.topic.security-events:security-events}")
    private String topic;

    @Value("${anomaly.kafka.routing-key:anormal.event}")
    private String routingKey;

    public CompletableFuture<SendResult<String, Map<String, Object>>> raise(Map<String, Object> rawEvent) {
        log.debug("Raising security event: topic={}, key={}", topic, routingKey);
        CompletableFuture<SendResult<String, Map<String, Object>>> future =
                securityEventKafkaTemplate.send(topic, routingKey, rawEvent);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to raise security event key={}", routingKey, ex);
            } else {
                log.debug("Raised security event partition={} offset={}",
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
        return future;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
