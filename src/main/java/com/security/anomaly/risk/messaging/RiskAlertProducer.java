package com.security.anomaly.risk.messaging;

import com.security.anomaly.risk.domain.RiskAlertBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;

/**
 * Publishes alert batches to the integration topic, where firewalls, SIEMs and dashboards
 * each read every batch with their own consumer group. Blocks until the broker acknowledges.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskAlertProducer {

    private final KafkaTemplate<String, RiskAlertBatch> riskAlertKafkaTemplate;

    @Value("${anomaly.kafka.topic.integration:security-integration}")
    private String topic;

    /**
     * @throws AlertPublishException when the send fails or is interrupted
     */
    public void publish(RiskAlertBatch batch) {
        try {
            SendResult<String, RiskAlertBatch> result = riskAlertKafkaTemplate.send(topic, batch).get();
            log.debug("Sent alert batch ts={} partition={} offset={}", batch.getTs(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertPublishException("Interrupted while publishing alert batch", e);
        } catch (ExecutionException e) {
            throw new AlertPublishException("Failed to publish alert batch to " + topic, e.getCause());
        } catch (RuntimeException e) {
            throw new AlertPublishException("Failed to publish alert batch to " + topic, e);
        }
    }
}
