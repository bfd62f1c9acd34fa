package com.security.anomaly.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Activity of one source IP over an inference window. Column names match the ones the model
 * artifact lists in {@code feature_cols}.
 */
@Value
@Builder
public class FeatureVector {

    public static final List<String> COLUMNS = List.of(
            "events_count", "events_rate",
            "attack_type_count", "suspicious_type_count",
            "max_severity", "mean_severity",
            "cnt_403", "cnt_4xx",
            "uniq_path", "uniq_method", "uniq_ua",
            "ratio_attack_type", "ratio_suspicious_type",
            "ratio_403", "ratio_4xx");

    String ip;
    int eventsCount;
    /** eventsCount / window seconds. */
    double eventsRate;
    int attackTypeCount;
    int suspiciousTypeCount;
    int maxSeverity;
    double meanSeverity;
    int cnt403;
    int cnt4xx;
    int uniqPath;
    int uniqMethod;
    int uniqUa;
    // ratios are count / max(eventsCount, 1)
    double ratioAttackType;
    double ratioSuspiciousType;
    double ratio403;
    double ratio4xx;

    /** Feature values by column name, in {@link #COLUMNS} order. */
    public Map<String, Double> asColumns() {
        Map<String, Double> columns = new LinkedHashMap<>();
        columns.put("events_count", (double) eventsCount);
        columns.put("events_rate", eventsRate);
        columns.put("attack_type_count", (double) attackTypeCount);
        columns.put("suspicious_type_count", (double) suspiciousTypeCount);
        columns.put("max_severity", (double) maxSeverity);
        columns.put("mean_severity", meanSeverity);
        columns.put("cnt_403", (double) cnt403);
        columns.put("cnt_4xx", (double) cnt4xx);
        columns.put("uniq_path", (double) uniqPath);
        columns.put("uniq_method", (double) uniqMethod);
        columns.put("uniq_ua", (double) uniqUa);
        columns.put("ratio_attack_type", ratioAttackType);
        columns.put("ratio_suspicious_type", ratioSuspiciousType);
        columns.put("ratio_403", ratio403);
        columns.put("ratio_4xx", ratio4xx);
        return Collections.unmodifiableMap(columns);
    }
}
