package com.umihealth.pos_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum PaymentMethod {
    CASH("cash"),
    CARD("card"),
    MOBILE("mobile", "mobile_money"),
    INSURANCE("insurance");

    private final String code;
    private final String[] aliases;

    PaymentMethod(String code, String... aliases) {
        this.code = code;
        this.aliases = aliases;
    }

    /**
     * Resolves a wire value case-insensitively, including the legacy {@code mobile_money} spelling.
     *
     * @throws IllegalArgumentException if the value names no payment method
     */
    @JsonCreator
    public static PaymentMethod fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (PaymentMethod method : values()) {
            if (method.code.equals(normalized) || Arrays.asList(method.aliases).contains(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown payment method: " + value);
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
