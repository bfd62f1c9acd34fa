package com.security.anomaly.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Kind of security event raised by a gateway, WAF or firewall. Stored as its integer code.
 */
public enum SecurityEventType {
    Unknown(0),
    SQLInjection(1),
    XSS(2),
    RateLimiting(10),
    TooManyRequestsBurst(11),
    SuspiciousScan(12),
    BotDetected(13),
    WafRuleTriggered(20),
    FirewallBlock(21);

    /** Used when a model artifact does not list its own attack types. */
    public static final Set<Integer> DEFAULT_ATTACK_TYPES = Set.of(SQLInjection.code, XSS.code);

    /** Used when a model artifact does not list its own suspicious types. */
    public static final Set<Integer> DEFAULT_SUSPICIOUS_TYPES = Set.of(
            RateLimiting.code, TooManyRequestsBurst.code, SuspiciousScan.code,
            BotDetected.code, WafRuleTriggered.code, FirewallBlock.code);

    private static final Map<String, Integer> CODES;

    static {
        Map<String, Integer> codes = new LinkedHashMap<>();
        for (SecurityEventType t : values()) {
            codes.put(t.name(), t.code);
        }
        CODES = Collections.unmodifiableMap(codes);
    }

    private final int code;

    SecurityEventType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static Map<String, Integer> codes() {
        return CODES;
    }
}
