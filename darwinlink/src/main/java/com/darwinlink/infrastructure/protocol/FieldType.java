package com.darwinlink.infrastructure.protocol;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Value types that can appear in a wire field.
 *
 * Decimals are always {@link BigDecimal}: prices, liquidity and P&L are
 * currency and must not drift through binary floating point.
 */
public enum FieldType {
    STRING(String.class),
    INTEGER(Long.class),
    DECIMAL(BigDecimal.class),
    TIME(LocalTime.class),
    TIMESTAMP(LocalDateTime.class);

    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd HH:mm:ss");
    static final DateTimeFormatter COMPACT_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Class<?> javaType;

    FieldType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    public boolean accepts(Object value) {
        return javaType.isInstance(value);
    }

    /**
     * Parse a non-empty field.
     *
     * @throws RuntimeException (NumberFormatException, ArithmeticException,
     *         DateTimeParseException) when the text does not fit the type
     */
    Object parse(String text) {
        return switch (this) {
            case STRING -> text;
            case INTEGER -> parseInteger(text);
            case DECIMAL -> parseDecimal(text);
            case TIME -> LocalTime.parse(text, TIME_FORMAT);
            case TIMESTAMP -> text.length() == 14 && text.indexOf(' ') < 0
                ? LocalDateTime.parse(text, COMPACT_TIMESTAMP_FORMAT)
                : LocalDateTime.parse(text, TIMESTAMP_FORMAT);
        };
    }

    /**
     * Format a value for an outbound command. Timestamps use the compact
     * form since commands separate arguments with commas and spaces.
     */
    String format(Object value) {
        return switch (this) {
            case STRING -> (String) value;
            case INTEGER -> Long.toString((Long) value);
            case DECIMAL -> ((BigDecimal) value).toPlainString();
            case TIME -> ((LocalTime) value).format(TIME_FORMAT);
            case TIMESTAMP -> ((LocalDateTime) value).format(COMPACT_TIMESTAMP_FORMAT);
        };
    }

    private static Long parseInteger(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            // Quantities occasionally come through as "100.0"
            return new BigDecimal(text).longValueExact();
        }
    }

    private static BigDecimal parseDecimal(String text) {
        // The platform may use the Italian decimal comma
        if (text.indexOf('.') < 0 && text.indexOf(',') >= 0) {
            return new BigDecimal(text.replace(',', '.'));
        }
        return new BigDecimal(text);
    }
}
