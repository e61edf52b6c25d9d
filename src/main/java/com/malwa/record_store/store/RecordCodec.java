package com.malwa.record_store.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts records to and from their stored JSON form and derives index keys.
 *
 * Index keys are type-tagged strings ({@code s:}, {@code n:}, {@code b:}) so that the
 * string "5" and the number 5 never collide, while 5 and 5.00 do. Values that are not
 * scalars (objects, arrays, non-finite numbers) are not indexed.
 */
@Component
@RequiredArgsConstructor
public class RecordCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String write(Map<String, Object> record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> read(String document) {
        try {
            return objectMapper.readValue(document, RECORD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Returns the record exactly as it will read back from storage.
     */
    public Map<String, Object> normalize(Map<String, Object> record) {
        return read(write(record));
    }

    public String indexKey(Object value) {
        Object scalar = toScalar(value);
        if (scalar instanceof String text) {
            return "s:" + text;
        }
        if (scalar instanceof Boolean flag) {
            return "b:" + flag;
        }
        if (scalar instanceof Number number) {
            if ((number instanceof Double d && !Double.isFinite(d)) || (number instanceof Float f && !Float.isFinite(f))) {
                return null;
            }
            BigDecimal decimal = number instanceof BigDecimal bd ? bd : new BigDecimal(number.toString());
            return "n:" + decimal.stripTrailingZeros().toPlainString();
        }
        return null;
    }

    /**
     * Equality used by full-scan queries: scalars compare by index key, numbers by value.
     */
    public boolean matches(Object recordValue, Object filterValue) {
        if (recordValue == null) {
            return false;
        }
        String left = indexKey(recordValue);
        String right = indexKey(filterValue);
        if (left != null && right != null) {
            return left.equals(right);
        }
        return Objects.equals(recordValue, toScalar(filterValue));
    }

    private Object toScalar(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return objectMapper.convertValue(value, Object.class);
    }
}
