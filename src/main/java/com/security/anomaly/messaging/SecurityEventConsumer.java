package com.security.anomaly.messaging;

import com.security.anomaly.ingestion.IngestionGateway;
import com.security.anomaly.ingestion.IngestionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Consumes raw security events from the ingestion topic, one record at a time. The offset is
 * committed whatever the outcome, so a rejected record is dropped rather than redelivered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "anomaly.ingestion.enabled", havingValue = "true", matchIfMissing = true)
public class SecurityEventConsumer {

    private final IngestionGateway ingestionGateway;

    @KafkaListener(
            topics = "${anomaly.kafka.topic.security-events:security-events}",
            groupId = "${anomaly.kafka.consumer-group:anomaly-ingestion}",
            containerFactory = "securityEventListenerContainerFactory"
    )
    public void onSecurityEvent(
            @Payload(required = false) byte[] body,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        IngestionOutcome outcome = ingestionGateway.handle(body);
        if (outcome == IngestionOutcome.REJECTED) {
            log.warn("Dropped security event key={} partition={} offset={}", key, partition, offset);
        } else {
            log.debug("Ingested security event key={} partition={} offset={}", key, partition, offset);
        }
    }
}
