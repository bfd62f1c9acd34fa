package com.security.anomaly.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.security.anomaly.domain.NormalizedEvent;
import com.security.anomaly.domain.SecurityEventType;
import com.security.anomaly.domain.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a raw inbound event (any supported key casing, enums as names or codes) into a
 * {@link NormalizedEvent}. Pure: no I/O.
 */
@Component
public class EventNormalizer {

    private final ObjectReader jsonReader;

    public EventNormalizer(ObjectMapper objectMapper) {
        this.jsonReader = objectMapper.readerFor(Object.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @throws EventValidationException when a required field is missing or cannot be resolved
     */
    public NormalizedEvent normalize(Map<String, ?> raw) {
        if (raw == null) {
            throw new EventValidationException(null, "Event payload is null");
        }
        String serviceName = requiredText(raw, EventField.SERVICE_NAME);
        String ip = requiredText(raw, EventField.IP);
        String description = requiredText(raw, EventField.DESCRIPTION);

        int eventType = EnumValueParser.resolve(EventField.EVENT_TYPE.lookup(raw),
                SecurityEventType.codes(), EventField.EVENT_TYPE.wireName());
        int severity = EnumValueParser.resolve(EventField.SEVERITY.lookup(raw),
                Severity.codes(), EventField.SEVERITY.wireName());
        Instant occurredAt = parseOccurredAt(EventField.OCCURRED_AT.lookup(raw));

        return NormalizedEvent.builder()
                .serviceName(serviceName)
                .ip(ip)
                .eventType(eventType)
                .severity(severity)
                .description(description)
                .occurredAt(occurredAt)
                .requestId(optionalText(raw, EventField.REQUEST_ID))
                .method(optionalText(raw, EventField.METHOD))
                .path(optionalText(raw, EventField.PATH))
                .statusCode(parseStatusCode(EventField.STATUS_CODE.lookup(raw)))
                .userAgent(optionalText(raw, EventField.USER_AGENT))
                .request(coerceRequest(EventField.REQUEST.lookup(raw)))
                .build();
    }

    /**
     * Accepts typed timestamps and ISO-8601 strings; a trailing {@code Z} means UTC and a value
     * without offset is read as UTC. As a last resort everything from the first {@code +} on is
     * dropped and the rest parsed as a local date-time.
     */
    Instant parseOccurredAt(Object value) {
        String field = EventField.OCCURRED_AT.wireName();
        if (value == null) {
            throw EventValidationException.missing(field);
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (!(value instanceof String)) {
            throw new EventValidationException(field,
                    "Invalid " + field + " type: " + value.getClass().getSimpleName());
        }
        String s = ((String) value).trim();
        if (s.isEmpty()) {
            throw EventValidationException.missing(field);
        }
        if (s.length() > 10 && s.charAt(10) == ' ') {
            s = s.substring(0, 10) + 'T' + s.substring(11);
        }
        if (s.endsWith("Z") || s.endsWith("z")) {
            s = s.substring(0, s.length() - 1) + "+00:00";
        }
        try {
            return parseIso(s);
        } catch (DateTimeParseException e) {
            int plus = s.indexOf('+');
            String degraded = plus >= 0 ? s.substring(0, plus) : s;
            try {
                return LocalDateTime.parse(degraded).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException fallback) {
                throw new EventValidationException(field, "Invalid " + field + " datetime: '" + value + "'", fallback);
            }
        }
    }

    private static Instant parseIso(String s) {
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notDateTime) {
                return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
        }
    }

    /**
     * Objects and arrays pass through; strings are parsed as JSON when they can be, otherwise
     * kept under {@code raw}; any other scalar is stringified under {@code raw}.
     */
    Object coerceRequest(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            return value;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                return jsonReader.readValue(s);
            } catch (JsonProcessingException e) {
                return rawWrapper(s);
            }
        }
        return rawWrapper(String.valueOf(value));
    }

    /** Lenient: anything that is not an integer or a numeric string becomes absent. */
    static Integer parseStatusCode(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long code = ((Number) value).longValue();
            return code >= Integer.MIN_VALUE && code <= Integer.MAX_VALUE ? (int) code : null;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) {
                try {
                    return Integer.parseInt(s);
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    private static Map<String, Object> rawWrapper(String s) {
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("raw", s);
        return wrapped;
    }

    private static String requiredText(Map<String, ?> raw, EventField field) {
        Object value = field.lookup(raw);
        String text = value == null ? null : String.valueOf(value);
        if (text == null || text.isBlank()) {
            throw EventValidationException.missing(field.wireName());
        }
        return text;
    }

    private static String optionalText(Map<String, ?> raw, EventField field) {
        Object value = field.lookup(raw);
        return value == null ? null : String.valueOf(value);
    }
}
