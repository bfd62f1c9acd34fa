package com.security.anomaly.risk.store;

import com.security.anomaly.risk.domain.RiskAlertBatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory store of the last published alert batches for the REST API, newest first.
 * Consumers that need history should read the integration topic.
 */
@Component
public class RecentAlertsStore {

    static final int MAX_RECENT = 100;
    private final ConcurrentLinkedDeque<RiskAlertBatch> recent = new ConcurrentLinkedDeque<>();

    public void add(RiskAlertBatch batch) {
        recent.addFirst(batch);
        while (recent.size() > MAX_RECENT) recent.removeLast();
    }

    public List<RiskAlertBatch> getRecent(int limit) {
        List<RiskAlertBatch> out = new ArrayList<>();
        for (RiskAlertBatch b : recent) {
            if (out.size() >= limit) break;
            out.add(b);
        }
        return out;
    }
}
