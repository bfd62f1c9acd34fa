package com.security.anomaly.risk.api;

import com.security.anomaly.risk.domain.RiskAlertBatch;
import com.security.anomaly.risk.model.ModelArtifact;
import com.security.anomaly.risk.model.ModelArtifactCache;
import com.security.anomaly.risk.store.RecentAlertsStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the risk job for dashboards and testing. Batches are also published to
 * the integration topic.
 */
@RestController
@RequestMapping("/api/v1/risk")
@RequiredArgsConstructor
@Tag(name = "Risk", description = "IP risk alerts and the loaded model")
public class RiskAlertController {

    private final RecentAlertsStore recentAlertsStore;
    private final ModelArtifactCache artifactCache;

    @GetMapping("/alerts")
    @Operation(summary = "List recent alert batches", description = "Returns recently published batches, newest first (in-memory; last 100)")
    public ResponseEntity<List<RiskAlertBatch>> listAlerts(
            @RequestParam(defaultValue = "50") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(recentAlertsStore.getRecent(limit));
    }

    @GetMapping("/model")
    @Operation(summary = "Describe loaded model", description = "Metadata of the artifact used by the last inference cycle")
    public ResponseEntity<Map<String, Object>> model() {
        Optional<ModelArtifact> current = artifactCache.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("loaded", current.isPresent());
        body.put("path", artifactCache.getPath().toString());
        current.ifPresent(a -> {
            body.put("mode", a.getMode().getWireName());
            body.put("feature_cols", a.getFeatureCols());
            body.put("window_sec", a.getWindowSec());
            body.put("trained_at", a.getTrainedAt());
            body.put("metrics", a.getMetrics());
        });
        return ResponseEntity.ok(body);
    }
}
