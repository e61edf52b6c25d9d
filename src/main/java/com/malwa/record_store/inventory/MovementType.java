package com.malwa.record_store.inventory;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;

public enum MovementType {
    IN,
    OUT,
    ADJUSTMENT;

    /**
     * Stock level after applying a movement of {@code quantity} to {@code current}.
     * Adjustments set the level outright.
     */
    public BigDecimal apply(BigDecimal current, BigDecimal quantity) {
        return switch (this) {
            case IN -> current.add(quantity);
            case OUT -> current.subtract(quantity);
            case ADJUSTMENT -> quantity;
        };
    }

    /**
     * Lower-case name used in stored movement records.
     */
    public String storedName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MovementType fromStoredName(String value) {
        return Arrays.stream(values())
            .filter(type -> type.storedName().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown movement type: " + value));
    }
}
