package com.umihealth.pos_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentStatus {
    PENDING,
    PAID,
    PARTIAL,
    REFUNDED;

    /**
     * Case-insensitive lookup, shared by JSON bodies and query parameters.
     *
     * @throws IllegalArgumentException if the value names no payment status
     */
    @JsonCreator
    public static PaymentStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        for (PaymentStatus candidate : values()) {
            if (candidate.name().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown payment status: " + value);
    }

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
