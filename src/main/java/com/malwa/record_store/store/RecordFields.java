package com.malwa.record_store.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Field names the engine maintains on every record, and typed readers for the
 * untyped record payloads.
 */
public final class RecordFields {

    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private RecordFields() {
    }

    /**
     * Reads a numeric field as a decimal. Missing values read as zero; numeric strings are accepted.
     *
     * @throws IllegalStateException if the value is present but not a number
     */
    public static BigDecimal decimal(Map<String, Object> record, String field) {
        Object value = record.get(field);
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number || value instanceof String) {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return BigDecimal.ZERO;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new IllegalStateException(
                    String.format("Field %s is not numeric: %s", field, value), e);
            }
        }
        throw new IllegalStateException(String.format("Field %s is not numeric: %s", field, value));
    }

    public static String string(Map<String, Object> record, String field) {
        Object value = record.get(field);
        return value != null ? value.toString() : null;
    }

    /**
     * Reads an ISO-8601 timestamp field. Missing or unparseable values read as null.
     */
    public static Instant instant(Map<String, Object> record, String field) {
        String value = string(record, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
