package com.security.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the IP risk engine. Runs:
 * <ul>
 *   <li>the ingestion consumer that normalizes security events into {@code anormal_events}</li>
 *   <li>the scheduled risk job that scores source IPs and publishes alert batches</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class IpRiskEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(IpRiskEngineApplication.class, args);
    }
}
