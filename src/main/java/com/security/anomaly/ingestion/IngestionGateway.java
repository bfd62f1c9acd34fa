package com.security.anomaly.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.security.anomaly.domain.NormalizedEvent;
import com.security.anomaly.persistence.EventStore;
import com.security.anomaly.persistence.EventStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Decodes, normalizes and stores one delivery at a time. Every failure rejects the delivery;
 * nothing is retried here.
 */
@Slf4j
@Service
public class IngestionGateway {

    private static final TypeReference<Map<String, Object>> RAW_EVENT = new TypeReference<>() {
    };

    private final ObjectReader rawEventReader;
    private final EventNormalizer normalizer;
    private final EventStore eventStore;

    public IngestionGateway(ObjectMapper objectMapper, EventNormalizer normalizer, EventStore eventStore) {
        // one JSON object per body, nothing after it
        this.rawEventReader = objectMapper.readerFor(RAW_EVENT)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.normalizer = normalizer;
        this.eventStore = eventStore;
    }

    /** Broker delivery: the body must be valid UTF-8. */
    public IngestionOutcome handle(byte[] body) {
        try {
            NormalizedEvent event = normalizer.normalize(decode(utf8(body)));
            eventStore.save(event);
            log.info("Event saved: eventType={} severity={} ip={}", event.getEventType(), event.getSeverity(), event.getIp());
            return IngestionOutcome.ACCEPTED;
        } catch (EventDecodeException e) {
            log.warn("Rejected security event (decode): {}", e.getMessage());
        } catch (EventValidationException e) {
            log.warn("Rejected security event (validation): field={} {}", e.getField(), e.getMessage());
        } catch (EventStoreException e) {
            log.error("Rejected security event (store): {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Rejected security event (unexpected)", e);
        }
        return IngestionOutcome.REJECTED;
    }

    private static String utf8(byte[] body) {
        if (body == null) {
            throw new EventDecodeException("Message body is empty");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EventDecodeException("Message body is not valid UTF-8", e);
        }
    }

    private Map<String, Object> decode(String body) {
        if (body == null || body.isBlank()) {
            throw new EventDecodeException("Message body is empty");
        }
        try {
            Map<String, Object> raw = rawEventReader.readValue(body);
            if (raw == null) {
                throw new EventDecodeException("Message body is JSON null");
            }
            return raw;
        } catch (JsonProcessingException e) {
            throw new EventDecodeException("Message body is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }
}
