package com.security.anomaly.risk.alert;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Last time each IP was alerted, in epoch seconds. Used only from the scheduling thread.
 */
@Slf4j
@Component
public class CooldownTracker {

    private final Map<String, Long> lastSent = new HashMap<>();

    @Value("${anomaly.risk.cooldown-sec:60}")
    private long cooldownSec;

    /**
     * Records {@code now} for the IP unless it was alerted less than the cooldown ago.
     *
     * @return false when the IP is still cooling down (nothing is recorded then)
     */
    public boolean tryAcquire(String ip, long nowEpochSec) {
        Long last = lastSent.get(ip);
        if (last != null && nowEpochSec - last < cooldownSec) {
            return false;
        }
        lastSent.put(ip, nowEpochSec);
        return true;
    }

    /**
     * Undoes {@link #tryAcquire} for alerts that were never delivered. An IP only gets through
     * {@code tryAcquire} when its previous entry had expired, so dropping the entry is enough.
     */
    public void release(Collection<String> ips) {
        ips.forEach(lastSent::remove);
        log.debug("Released cooldown for {} IPs", ips.size());
    }

    /** Drops entries old enough that they can no longer suppress anything. */
    public int evictExpired(long nowEpochSec) {
        int before = lastSent.size();
        lastSent.values().removeIf(last -> nowEpochSec - last >= cooldownSec);
        int evicted = before - lastSent.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired cooldown entries, {} remain", evicted, lastSent.size());
        }
        return evicted;
    }

    public int size() {
        return lastSent.size();
    }
}
