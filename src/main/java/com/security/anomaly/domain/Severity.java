package com.security.anomaly.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Severity reported by the producing service. Stored as its integer code.
 */
public enum Severity {
    Info(0),
    Warning(1),
    Error(2),
    Attack(3);

    private static final Map<String, Integer> CODES;

    static {
        Map<String, Integer> codes = new LinkedHashMap<>();
        for (Severity s : values()) {
            codes.put(s.name(), s.code);
        }
        CODES = Collections.unmodifiableMap(codes);
    }

    private final int code;

    Severity(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /** Symbolic name to code, as accepted on the wire. */
    public static Map<String, Integer> codes() {
        return CODES;
    }
}
