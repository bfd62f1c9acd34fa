package com.security.anomaly.api;

import com.security.anomaly.messaging.SecurityEventProducer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Entry point for services that report security events over HTTP instead of writing to the
 * ingestion topic directly.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Raise anomalous security events")
public class SecurityEventController {

    private final SecurityEventProducer eventProducer;

    @PostMapping
    @Operation(summary = "Raise security event",
            description = "Publishes the JSON object unchanged to the ingestion topic. Fields are validated by the "
                    + "ingestion consumer, so an invalid event is accepted here and rejected there.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Queued. Body: { \"status\": \"accepted\", \"key\": routing key }"),
            @ApiResponse(responseCode = "400", description = "Body is not a JSON object")
    })
    public ResponseEntity<Map<String, String>> raise(@RequestBody Map<String, Object> rawEvent) {
        eventProducer.raise(rawEvent);
        log.debug("Accepted security event via REST: keys={}", rawEvent.keySet());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "accepted", "key", eventProducer.getRoutingKey()));
    }
}
