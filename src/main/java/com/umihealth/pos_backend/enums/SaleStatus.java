package com.umihealth.pos_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SaleStatus {
    PENDING,
    COMPLETED,
    CANCELLED,
    RETURNED;

    /**
     * Case-insensitive lookup, shared by JSON bodies and query parameters.
     *
     * @throws IllegalArgumentException if the value names no sale status
     */
    @JsonCreator
    public static SaleStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        for (SaleStatus candidate : values()) {
            if (candidate.name().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown sale status: " + value);
    }

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
