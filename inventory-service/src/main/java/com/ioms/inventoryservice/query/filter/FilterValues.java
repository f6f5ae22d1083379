package com.ioms.inventoryservice.query.filter;

import com.ioms.inventoryservice.query.InvalidFilterValueException;
import com.ioms.inventoryservice.query.schema.AttributeDescriptor;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.UUID;

/**
 * Value handling for filter clauses.
 * <p>
 * {@link #coerce(String)} applies the parameter-level rules: {@code true}/{@code false} become booleans,
 * all-digit strings become integers, anything else stays a string. {@link #convert} then turns the value
 * into the Java type of the attribute it is compared with.
 */
public final class FilterValues {

    private FilterValues() {
    }

    public static Object coerce(String raw) {
        String value = raw.trim();
        if (value.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (value.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        if (isDigits(value) && value.length() <= 18) {
            long number = Long.parseLong(value);
            if (number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        return value;
    }

    public static boolean isDigits(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * @param coerced value produced by {@link #coerce(String)}
     * @param raw     the trimmed parameter text, used for text attributes so {@code 007} keeps its zeros
     * @throws InvalidFilterValueException if the value cannot represent the attribute's type
     */
    public static Object convert(AttributeDescriptor attribute, Lookup lookup, Object coerced, String raw) {
        if (lookup == Lookup.ISNULL) {
            if (coerced instanceof Boolean) {
                return coerced;
            }
            throw invalid(attribute, raw, "isnull expects true or false");
        }
        Class<?> type = attribute.getJavaType();
        if (lookup.isTextual() && type != String.class) {
            throw invalid(attribute, raw, "lookup '" + lookup.token() + "' applies only to text fields");
        }
        try {
            if (type == String.class) {
                return raw;
            }
            if (type == Boolean.class) {
                if (coerced instanceof Boolean) {
                    return coerced;
                }
                throw invalid(attribute, raw, "expected true or false");
            }
            if (type == Integer.class) {
                return coerced instanceof Integer ? coerced : Integer.valueOf(raw);
            }
            if (type == Long.class) {
                return Long.valueOf(raw);
            }
            if (type == BigDecimal.class) {
                return new BigDecimal(raw);
            }
            if (type == UUID.class) {
                return UUID.fromString(raw);
            }
            if (type == Instant.class) {
                return parseInstant(raw);
            }
            if (type.isEnum()) {
                return enumValue(type, raw);
            }
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new InvalidFilterValueException(String.format(
                    "Invalid value '%s' for field '%s': %s", raw, attribute.getName(), e.getMessage()), e);
        }
        throw invalid(attribute, raw, "unsupported field type " + type.getSimpleName());
    }

    /**
     * Accepts an ISO date (start of day, UTC), an ISO date-time with offset, or a local date-time taken as UTC.
     */
    private static Instant parseInstant(String raw) {
        if (raw.length() == 10) {
            return LocalDate.parse(raw).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(raw);
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetDateTime.from(parsed).toInstant();
        }
        return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object enumValue(Class<?> type, String raw) {
        return Enum.valueOf((Class<? extends Enum>) type, raw.toUpperCase(Locale.ROOT));
    }

    private static InvalidFilterValueException invalid(AttributeDescriptor attribute, String raw, String reason) {
        return new InvalidFilterValueException(String.format(
                "Invalid value '%s' for field '%s': %s", raw, attribute.getName(), reason));
    }
}
