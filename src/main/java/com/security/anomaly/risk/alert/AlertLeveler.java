package com.security.anomaly.risk.alert;

import com.security.anomaly.risk.domain.AlertLevel;
import com.security.anomaly.risk.domain.FeatureVector;
import com.security.anomaly.risk.domain.RiskAlertItem;
import com.security.anomaly.risk.domain.ScoredFeatures;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Buckets scored IPs into high and medium alerts, applies the per-IP cooldown and attaches
 * the reasons. High alerts come first; each bucket is ordered by descending score.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertLeveler {

    static final int MAX_REASONS = 3;

    private final CooldownTracker cooldownTracker;

    @Value("${anomaly.risk.threshold.high:0.90}")
    private double highThreshold;
    @Value("${anomaly.risk.threshold.medium:0.80}")
    private double mediumThreshold;
    @Value("${anomaly.risk.ttl.high-sec:1800}")
    private int highTtlSec;
    @Value("${anomaly.risk.ttl.medium-sec:600}")
    private int mediumTtlSec;

    @PostConstruct
    void checkThresholds() {
        if (highThreshold <= mediumThreshold) {
            throw new IllegalStateException("anomaly.risk.threshold.high (" + highThreshold
                    + ") must be greater than anomaly.risk.threshold.medium (" + mediumThreshold + ")");
        }
        log.info("Alert thresholds: high>={} (ttl {}s) medium>={} (ttl {}s)",
                highThreshold, highTtlSec, mediumThreshold, mediumTtlSec);
    }

    /**
     * @param nowEpochSec cycle time, used for the cooldown
     * @param windowSec   copied into every item
     */
    public List<RiskAlertItem> level(List<ScoredFeatures> scored, long nowEpochSec, int windowSec) {
        List<ScoredFeatures> ranked = scored.stream()
                .sorted(Comparator.comparingDouble(ScoredFeatures::getRiskScore).reversed())
                .collect(Collectors.toList());

        List<RiskAlertItem> items = new ArrayList<>();
        for (ScoredFeatures s : ranked) {
            if (s.getRiskScore() >= highThreshold) {
                addIfCooledDown(items, s, AlertLevel.HIGH, highTtlSec, nowEpochSec, windowSec);
            }
        }
        for (ScoredFeatures s : ranked) {
            if (s.getRiskScore() >= mediumThreshold && s.getRiskScore() < highThreshold) {
                addIfCooledDown(items, s, AlertLevel.MEDIUM, mediumTtlSec, nowEpochSec, windowSec);
            }
        }
        return items;
    }

    private void addIfCooledDown(List<RiskAlertItem> items, ScoredFeatures s, AlertLevel level, int ttlSec,
                                 long nowEpochSec, int windowSec) {
        if (!cooldownTracker.tryAcquire(s.getIp(), nowEpochSec)) {
            log.debug("Suppressed {} alert for ip={} (cooldown)", level.getWireName(), s.getIp());
            return;
        }
        items.add(RiskAlertItem.builder()
                .ip(s.getIp())
                .riskScore(s.getRiskScore())
                .riskLevel(level)
                .ttlSec(ttlSec)
                .reasons(reasons(s.getFeatures()))
                .windowSec(windowSec)
                .build());
    }

    /** Human-readable causes in fixed priority order, at most three. */
    static List<String> reasons(FeatureVector f) {
        List<String> reasons = new ArrayList<>();
        if (f.getAttackTypeCount() > 0) reasons.add("attack_event");
        if (f.getSuspiciousTypeCount() > 0) reasons.add("suspicious_events");
        if (f.getEventsRate() >= 2.0) reasons.add("high_rate");
        if (f.getRatio403() >= 0.3) reasons.add("403_spike");
        if (f.getUniqPath() >= 20) reasons.add("scan_like");
        if (f.getMaxSeverity() >= 3) reasons.add("high_severity");
        return reasons.size() > MAX_REASONS ? List.copyOf(reasons.subList(0, MAX_REASONS)) : List.copyOf(reasons);
    }
}
