package com.security.anomaly.risk.features;

import com.security.anomaly.domain.NormalizedEvent;
import com.security.anomaly.domain.SecurityEventType;
import com.security.anomaly.risk.domain.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reduces the events of one inference window to a feature vector per source IP: how many
 * events, how many were attacks or suspicious, how severe, how many 403/4xx responses and how
 * varied the paths, methods and user agents were.
 */
@Slf4j
@Component
public class IpWindowAggregator {

    /**
     * @param events     events of the window, any order
     * @param windowSec  window length, used for {@code events_rate}
     * @param attackTypes     event-type codes counted as attacks; defaults when null or empty
     * @param suspiciousTypes event-type codes counted as suspicious; defaults when null or empty
     * @return one vector per IP, in first-seen order
     */
    public List<FeatureVector> aggregate(List<NormalizedEvent> events, int windowSec,
                                         Set<Integer> attackTypes, Set<Integer> suspiciousTypes) {
        if (windowSec <= 0) {
            throw new IllegalArgumentException("windowSec must be positive, got " + windowSec);
        }
        Set<Integer> attack = attackTypes == null || attackTypes.isEmpty()
                ? SecurityEventType.DEFAULT_ATTACK_TYPES : attackTypes;
        Set<Integer> suspicious = suspiciousTypes == null || suspiciousTypes.isEmpty()
                ? SecurityEventType.DEFAULT_SUSPICIOUS_TYPES : suspiciousTypes;

        Map<String, IpAccumulator> byIp = new LinkedHashMap<>();
        for (NormalizedEvent event : events) {
            byIp.computeIfAbsent(event.getIp(), k -> new IpAccumulator()).add(event, attack, suspicious);
        }

        List<FeatureVector> vectors = new ArrayList<>(byIp.size());
        byIp.forEach((ip, acc) -> vectors.add(acc.toFeatures(ip, windowSec)));
        log.debug("Aggregated {} events into {} IP feature vectors (window={}s)", events.size(), vectors.size(), windowSec);
        return vectors;
    }

    private static final class IpAccumulator {
        private int count;
        private int attackCount;
        private int suspiciousCount;
        private int maxSeverity = Integer.MIN_VALUE;
        private long severitySum;
        private int cnt403;
        private int cnt4xx;
        private final Set<String> paths = new HashSet<>();
        private final Set<String> methods = new HashSet<>();
        private final Set<String> userAgents = new HashSet<>();

        void add(NormalizedEvent e, Set<Integer> attack, Set<Integer> suspicious) {
            count++;
            if (attack.contains(e.getEventType())) attackCount++;
            if (suspicious.contains(e.getEventType())) suspiciousCount++;
            maxSeverity = Math.max(maxSeverity, e.getSeverity());
            severitySum += e.getSeverity();
            Integer status = e.getStatusCode();
            if (status != null) {
                if (status == 403) cnt403++;
                if (status >= 400 && status <= 499) cnt4xx++;
            }
            addIfPresent(paths, e.getPath());
            addIfPresent(methods, e.getMethod());
            addIfPresent(userAgents, e.getUserAgent());
        }

        FeatureVector toFeatures(String ip, int windowSec) {
            double denom = Math.max(count, 1);
            return FeatureVector.builder()
                    .ip(ip)
                    .eventsCount(count)
                    .eventsRate(count / (double) windowSec)
                    .attackTypeCount(attackCount)
                    .suspiciousTypeCount(suspiciousCount)
                    .maxSeverity(count > 0 ? maxSeverity : 0)
                    .meanSeverity(count > 0 ? severitySum / (double) count : 0.0)
                    .cnt403(cnt403)
                    .cnt4xx(cnt4xx)
                    .uniqPath(paths.size())
                    .uniqMethod(methods.size())
                    .uniqUa(userAgents.size())
                    .ratioAttackType(attackCount / denom)
                    .ratioSuspiciousType(suspiciousCount / denom)
                    .ratio403(cnt403 / denom)
                    .ratio4xx(cnt4xx / denom)
                    .build();
        }

        private static void addIfPresent(Set<String> values, String value) {
            if (Objects.nonNull(value)) {
                values.add(value);
            }
        }
    }
}
