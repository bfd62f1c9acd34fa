package com.security.anomaly.ingestion;

import java.math.BigInteger;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves enum-valued fields that producers send as integers, numeric strings or symbolic names.
 */
public final class EnumValueParser {

    private static final Pattern INTEGER_LITERAL = Pattern.compile("-?\\d+");

    private EnumValueParser() {
    }

    /**
     * Resolve {@code value} to its integer code.
     * <ul>
     *   <li>integral numbers pass through unchanged</li>
     *   <li>strings: integer literal, then exact name, then case-insensitive name</li>
     * </ul>
     *
     * @throws EventValidationException when the value is null, of an unsupported type, or unknown
     */
    public static int resolve(Object value, Map<String, Integer> mapping, String fieldName) {
        if (value == null) {
            throw EventValidationException.missing(fieldName);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return toIntExact((Number) value, fieldName);
        }
        if (value instanceof String) {
            String v = ((String) value).trim();
            if (INTEGER_LITERAL.matcher(v).matches()) {
                try {
                    return Integer.parseInt(v);
                } catch (NumberFormatException e) {
                    throw new EventValidationException(fieldName, "Invalid " + fieldName + ": '" + value + "'", e);
                }
            }
            Integer exact = mapping.get(v);
            if (exact != null) {
                return exact;
            }
            for (Map.Entry<String, Integer> entry : mapping.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(v)) {
                    return entry.getValue();
                }
            }
            throw new EventValidationException(fieldName, "Invalid " + fieldName + ": '" + value + "'");
        }
        throw new EventValidationException(fieldName,
                "Invalid " + fieldName + " type: " + value.getClass().getSimpleName());
    }

    private static int toIntExact(Number n, String fieldName) {
        try {
            if (n instanceof BigInteger) {
                return ((BigInteger) n).intValueExact();
            }
            return Math.toIntExact(n.longValue());
        } catch (ArithmeticException e) {
            throw new EventValidationException(fieldName, "Invalid " + fieldName + ": " + n + " out of range", e);
        }
    }
}
