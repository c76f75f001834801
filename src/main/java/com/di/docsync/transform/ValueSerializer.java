package com.di.docsync.transform;

import com.di.docsync.source.ColumnKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Clob;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Deterministic text form of a source value, chosen by the column's declared kind.
 * <ul>
 *   <li>integers: plain decimal string</li>
 *   <li>decimals: plain decimal string, no exponent</li>
 *   <li>booleans: {@code true} / {@code false}</li>
 *   <li>timestamps: {@code yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'} in UTC; zone-less values are taken as UTC</li>
 *   <li>dates: {@code yyyy-MM-dd}</li>
 *   <li>json and arrays: compact JSON with object keys sorted</li>
 *   <li>binary: base64</li>
 * </ul>
 * NULL serializes to {@code null} and the caller omits the field.
 * A value that cannot be read as its declared kind raises {@link IllegalArgumentException}.
 */
public final class ValueSerializer {

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final ObjectWriter CANONICAL = MAPPER.writer()
            .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private ValueSerializer() {
    }

    public static String serialize(ColumnKind kind, Object raw) {
        if (raw == null) {
            return null;
        }
        return switch (kind) {
            case INTEGER -> integer(raw);
            case DECIMAL -> decimal(raw);
            case BOOLEAN -> bool(raw);
            case TIMESTAMP, TIMESTAMP_TZ -> TIMESTAMP_FORMAT.format(toInstant(raw));
            case DATE -> date(raw);
            case TIME -> raw instanceof LocalTime t ? t.toString() : LocalTime.parse(raw.toString().trim()).toString();
            case JSON -> canonicalJson(raw);
            case ARRAY -> canonicalArray(raw);
            case UUID -> raw instanceof UUID u ? u.toString() : UUID.fromString(raw.toString().trim()).toString();
            case BINARY -> raw instanceof byte[] b ? Base64.getEncoder().encodeToString(b) : raw.toString();
            case TEXT -> text(raw);
            case OTHER -> byValueType(raw);
        };
    }

    /**
     * Parses any supported temporal representation into an instant, zone-less values as UTC.
     */
    public static Instant toInstant(Object raw) {
        if (raw instanceof Instant i) return i;
        if (raw instanceof OffsetDateTime odt) return odt.toInstant();
        if (raw instanceof ZonedDateTime zdt) return zdt.toInstant();
        if (raw instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
        if (raw instanceof LocalDate ld) return ld.atStartOfDay().toInstant(ZoneOffset.UTC);
        if (raw instanceof java.sql.Timestamp ts) return ts.toLocalDateTime().toInstant(ZoneOffset.UTC);
        if (raw instanceof java.sql.Date d) return d.toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC);
        if (raw instanceof java.util.Date d) return d.toInstant();
        if (raw instanceof CharSequence cs) return parseTimestamp(cs.toString());
        throw new IllegalArgumentException("Not a timestamp: " + raw.getClass().getSimpleName());
    }

    static Instant parseTimestamp(String text) {
        String s = text.trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to zone-less forms
        }
        try {
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through to date-only
        }
        try {
            return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable timestamp '" + text + "'", e);
        }
    }

    private static String integer(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte
                || raw instanceof BigInteger) {
            return raw.toString();
        }
        if (raw instanceof BigDecimal bd) {
            return bd.toBigIntegerExact().toString();
        }
        if (raw instanceof Number n) {
            return BigDecimal.valueOf(n.doubleValue()).toBigIntegerExact().toString();
        }
        try {
            return new BigDecimal(raw.toString().trim()).toBigIntegerExact().toString();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: '" + raw + "'", e);
        }
    }

    private static String decimal(Object raw) {
        if (raw instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (raw instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return d.toString();
        }
        if (raw instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return f.toString();
        }
        if (raw instanceof Double || raw instanceof Float) {
            return new BigDecimal(raw.toString()).toPlainString();
        }
        if (raw instanceof Number n) {
            return new BigDecimal(n.toString()).toPlainString();
        }
        try {
            return new BigDecimal(raw.toString().trim()).toPlainString();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a decimal: '" + raw + "'", e);
        }
    }

    private static String bool(Object raw) {
        if (raw instanceof Boolean b) {
            return b.toString();
        }
        if (raw instanceof Number n) {
            return Boolean.toString(n.intValue() != 0);
        }
        return switch (raw.toString().trim().toLowerCase(Locale.ROOT)) {
            case "t", "true", "1", "y", "yes", "on" -> "true";
            case "f", "false", "0", "n", "no", "off" -> "false";
            default -> throw new IllegalArgumentException("Not a boolean: '" + raw + "'");
        };
    }

    private static String date(Object raw) {
        if (raw instanceof LocalDate ld) return ld.toString();
        if (raw instanceof java.sql.Date d) return d.toLocalDate().toString();
        if (raw instanceof CharSequence cs) {
            String s = cs.toString().trim();
            return s.length() > 10 ? toInstant(s).atOffset(ZoneOffset.UTC).toLocalDate().toString() : LocalDate.parse(s).toString();
        }
        return toInstant(raw).atOffset(ZoneOffset.UTC).toLocalDate().toString();
    }

    private static String text(Object raw) {
        if (raw instanceof Clob clob) {
            try {
                return clob.getSubString(1, (int) clob.length());
            } catch (SQLException e) {
                throw new IllegalArgumentException("Unreadable text value", e);
            }
        }
        return raw.toString();
    }

    static String canonicalJson(Object raw) {
        try {
            Object tree = (raw instanceof Map || raw instanceof Collection)
                    ? raw
                    : MAPPER.readValue(raw.toString(), Object.class);
            return CANONICAL.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String canonicalArray(Object raw) {
        if (raw instanceof Object[] array) {
            return canonicalJson(Arrays.asList(array));
        }
        if (raw instanceof Collection<?>) {
            return canonicalJson(raw);
        }
        String s = raw.toString().trim();
        if (s.startsWith("[")) {
            return canonicalJson(s);
        }
        if (s.startsWith("{") && s.endsWith("}")) {
            // PostgreSQL array literal, e.g. {a,b,c}
            String body = s.substring(1, s.length() - 1);
            List<String> items = new ArrayList<>();
            if (!body.isBlank()) {
                for (String item : body.split(",")) {
                    items.add(item.trim().replaceAll("^\"|\"$", ""));
                }
            }
            return canonicalJson(items);
        }
        throw new IllegalArgumentException("Not an array: '" + raw + "'");
    }

    private static String byValueType(Object raw) {
        if (raw instanceof Boolean) return bool(raw);
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte
                || raw instanceof BigInteger) return raw.toString();
        if (raw instanceof Number) return decimal(raw);
        if (raw instanceof LocalDate ld) return ld.toString();
        if (raw instanceof java.sql.Date d) return d.toLocalDate().toString();
        if (raw instanceof LocalTime t) return t.toString();
        if (raw instanceof java.time.temporal.Temporal || raw instanceof java.util.Date) {
            return TIMESTAMP_FORMAT.format(toInstant(raw));
        }
        if (raw instanceof Map || raw instanceof Collection) return canonicalJson(raw);
        if (raw instanceof Object[] array) return canonicalJson(Arrays.asList(array));
        if (raw instanceof byte[] b) return Base64.getEncoder().encodeToString(b);
        return text(raw);
    }
}
