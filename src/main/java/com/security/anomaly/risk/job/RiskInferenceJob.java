package com.security.anomaly.risk.job;

import com.security.anomaly.domain.NormalizedEvent;
import com.security.anomaly.persistence.EventStore;
import com.security.anomaly.risk.alert.AlertLeveler;
import com.security.anomaly.risk.alert.CooldownTracker;
import com.security.anomaly.risk.domain.FeatureVector;
import com.security.anomaly.risk.domain.RiskAlertBatch;
import com.security.anomaly.risk.domain.RiskAlertItem;
import com.security.anomaly.risk.domain.ScoredFeatures;
import com.security.anomaly.risk.engine.RiskScorer;
import com.security.anomaly.risk.features.IpWindowAggregator;
import com.security.anomaly.risk.messaging.AlertPublishException;
import com.security.anomaly.risk.messaging.RiskAlertProducer;
import com.security.anomaly.risk.model.ModelArtifact;
import com.security.anomaly.risk.model.ModelArtifactCache;
import com.security.anomaly.risk.store.RecentAlertsStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Periodic IP risk inference: load the model if it changed, aggregate the last window of
 * stored events per IP, score, level and publish one batch per cycle. Runs on the single
 * scheduling thread with a fixed delay, so cycles never overlap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "anomaly.risk.job.enabled", havingValue = "true", matchIfMissing = true)
public class RiskInferenceJob {

    private final ModelArtifactCache artifactCache;
    private final EventStore eventStore;
    private final IpWindowAggregator aggregator;
    private final RiskScorer scorer;
    private final AlertLeveler leveler;
    private final CooldownTracker cooldownTracker;
    private final RiskAlertProducer alertProducer;
    private final RecentAlertsStore recentAlertsStore;

    @Value("${anomaly.risk.window-sec:60}")
    private int windowSec;
    @Value("${anomaly.risk.model.version:}")
    private String modelVersion;
    @Value("${anomaly.risk.producer:risk-job}")
    private String producer;

    private ModelArtifact lastCheckedArtifact;

    @PostConstruct
    void checkWindow() {
        if (windowSec <= 0) {
            throw new IllegalStateException("anomaly.risk.window-sec must be positive, got " + windowSec);
        }
        log.info("Risk job started: window={}s model={}", windowSec, artifactCache.getPath());
    }

    @Scheduled(fixedDelayString = "${anomaly.risk.job.every-sec:10}", timeUnit = TimeUnit.SECONDS)
    public void run() {
        runCycle(Instant.now());
    }

    public CycleResult runCycle(Instant now) {
        // IPs whose cooldown was taken this cycle but whose alert has not reached the broker yet
        List<String> unpublished = List.of();
        try {
            Optional<ModelArtifact> loaded = artifactCache.refreshIfChanged();
            if (loaded.isEmpty()) {
                log.debug("Model artifact not available at {}, waiting", artifactCache.getPath());
                return CycleResult.NO_ARTIFACT;
            }
            ModelArtifact artifact = loaded.get();
            warnOnWindowMismatch(artifact);

            List<NormalizedEvent> events = eventStore.findWindow(now.minusSeconds(windowSec), now);
            if (events.isEmpty()) {
                log.debug("No events in the last {}s", windowSec);
                return CycleResult.EMPTY_WINDOW;
            }

            List<FeatureVector> features = aggregator.aggregate(events, windowSec,
                    artifact.getAttackEventTypes(), artifact.getSuspiciousEventTypes());
            List<ScoredFeatures> scored = scorer.score(artifact, features);

            long nowEpochSec = now.getEpochSecond();
            List<RiskAlertItem> items = leveler.level(scored, nowEpochSec, windowSec);
            unpublished = items.stream().map(RiskAlertItem::getIp).collect(Collectors.toList());
            cooldownTracker.evictExpired(nowEpochSec);
            if (items.isEmpty()) {
                log.debug("Scored {} IPs from {} events, nothing to publish", scored.size(), events.size());
                return CycleResult.NOTHING_TO_PUBLISH;
            }

            RiskAlertBatch batch = RiskAlertBatch.builder()
                    .producer(producer)
                    .ts(DateTimeFormatter.ISO_INSTANT.format(now.truncatedTo(ChronoUnit.SECONDS)))
                    .modelPath(artifactCache.getPath().toString())
                    .modelVersion(resolveModelVersion(artifact))
                    .windowSec(windowSec)
                    .items(items)
                    .build();
            alertProducer.publish(batch);
            unpublished = List.of();

            recentAlertsStore.add(batch);
            RiskAlertItem top = items.get(0);
            log.info("Published {} risky IP(s). top={} score={} level={}", items.size(), top.getIp(),
                    String.format("%.3f", top.getRiskScore()), top.getRiskLevel().getWireName());
            return CycleResult.PUBLISHED;
        } catch (AlertPublishException e) {
            log.error("Failed to publish {} risky IP(s): {}", unpublished.size(), e.getMessage(), e);
            return CycleResult.FAILED;
        } catch (RuntimeException e) {
            log.error("Risk inference cycle failed", e);
            return CycleResult.FAILED;
        } finally {
            if (!unpublished.isEmpty()) {
                cooldownTracker.release(unpublished);
                log.warn("Released cooldown for {} unpublished IP(s)", unpublished.size());
            }
        }
    }

    String resolveModelVersion(ModelArtifact artifact) {
        if (modelVersion != null && !modelVersion.isBlank()) {
            return modelVersion;
        }
        return artifact.getMode().getWireName() + "_v1";
    }

    private void warnOnWindowMismatch(ModelArtifact artifact) {
        if (artifact == lastCheckedArtifact) {
            return;
        }
        lastCheckedArtifact = artifact;
        if (artifact.getWindowSec() != null && !Objects.equals(artifact.getWindowSec(), windowSec)) {
            log.warn("Model was trained on a {}s window but the job aggregates {}s; scores may drift",
                    artifact.getWindowSec(), windowSec);
        }
    }
}
