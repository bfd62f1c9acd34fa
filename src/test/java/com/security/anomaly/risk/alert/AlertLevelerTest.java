package com.security.anomaly.risk.alert;

import com.security.anomaly.risk.domain.AlertLevel;
import com.security.anomaly.risk.domain.FeatureVector;
import com.security.anomaly.risk.domain.RiskAlertItem;
import com.security.anomaly.risk.domain.ScoredFeatures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for AlertLeveler: bucketing, ordering, cooldown and reasons.
 */
class AlertLevelerTest {

    private static final long NOW = 1_766_689_830L;

    private CooldownTracker cooldownTracker;
    private AlertLeveler leveler;

    @BeforeEach
    void setUp() {
        cooldownTracker = new CooldownTracker();
        ReflectionTestUtils.setField(cooldownTracker, "cooldownSec", 60L);
        leveler = new AlertLeveler(cooldownTracker);
        ReflectionTestUtils.setField(leveler, "highThreshold", 0.90);
        ReflectionTestUtils.setField(leveler, "mediumThreshold", 0.80);
        ReflectionTestUtils.setField(leveler, "highTtlSec", 1800);
        ReflectionTestUtils.setField(leveler, "mediumTtlSec", 600);
    }

    private static ScoredFeatures scored(String ip, double score) {
        return new ScoredFeatures(FeatureVector.builder().ip(ip).eventsCount(1).build(), score);
    }

    @Test
    void bucketsHighThenMediumByDescendingScore() {
        List<RiskAlertItem> items = leveler.level(List.of(
                scored("m1", 0.81),
                scored("h1", 0.91),
                scored("low", 0.5),
                scored("m2", 0.89),
                scored("h2", 0.99)), NOW, 60);

        assertThat(items).extracting(RiskAlertItem::getIp).containsExactly("h2", "h1", "m2", "m1");
        assertThat(items).extracting(RiskAlertItem::getRiskLevel)
                .containsExactly(AlertLevel.HIGH, AlertLevel.HIGH, AlertLevel.MEDIUM, AlertLevel.MEDIUM);
        assertThat(items).extracting(RiskAlertItem::getTtlSec).containsExactly(1800, 1800, 600, 600);
        assertThat(items).extracting(RiskAlertItem::getWindowSec).containsOnly(60);
    }

    @Test
    void thresholdsAreInclusive() {
        List<RiskAlertItem> items = leveler.level(List.of(scored("h", 0.90), scored("m", 0.80)), NOW, 60);

        assertThat(items).extracting(RiskAlertItem::getRiskLevel).containsExactly(AlertLevel.HIGH, AlertLevel.MEDIUM);
    }

    @Test
    void cooldownSpansCyclesAndBuckets() {
        assertThat(leveler.level(List.of(scored("1.2.3.4", 0.95)), NOW, 60)).hasSize(1);

        assertThat(leveler.level(List.of(scored("1.2.3.4", 0.85)), NOW + 10, 60)).isEmpty();
        assertThat(leveler.level(List.of(scored("1.2.3.4", 0.95)), NOW + 59, 60)).isEmpty();
        assertThat(leveler.level(List.of(scored("1.2.3.4", 0.95)), NOW + 60, 60)).hasSize(1);
    }

    @Test
    void reasonsFollowPriorityAndAreCapped() {
        FeatureVector f = FeatureVector.builder()
                .ip("1.2.3.4")
                .attackTypeCount(2)
                .suspiciousTypeCount(1)
                .eventsRate(3.0)
                .ratio403(0.5)
                .uniqPath(25)
                .maxSeverity(3)
                .build();

        assertThat(AlertLeveler.reasons(f)).containsExactly("attack_event", "suspicious_events", "high_rate");
    }

    @Test
    void reasonsUseThresholdBoundaries() {
        FeatureVector f = FeatureVector.builder()
                .ip("1.2.3.4")
                .eventsRate(1.99)
                .ratio403(0.3)
                .uniqPath(20)
                .maxSeverity(2)
                .build();

        assertThat(AlertLeveler.reasons(f)).containsExactly("403_spike", "scan_like");
        assertThat(AlertLeveler.reasons(FeatureVector.builder().ip("x").build())).isEmpty();
    }

    @Test
    void rejectsInvertedThresholds() {
        ReflectionTestUtils.setField(leveler, "mediumThreshold", 0.95);

        assertThatThrownBy(() -> leveler.checkThresholds()).isInstanceOf(IllegalStateException.class);
    }
}
