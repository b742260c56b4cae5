package com.umihealth.pos_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Role {
    ADMIN("admin", "superadmin", "tenantadmin"),
    MANAGER("manager", "operations"),
    PHARMACIST("pharmacist"),
    CASHIER("cashier");

    private final String[] claimNames;

    Role(String... claimNames) {
        this.claimNames = claimNames;
    }

    /**
     * Maps a token role claim to a role. Case, underscores and hyphens are ignored,
     * so {@code super_admin}, {@code SuperAdmin} and {@code superadmin} all resolve to ADMIN.
     *
     * @return the role, or null when the claim is missing or not recognised
     */
    public static Role fromClaim(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace("_", "").replace("-", "");
        for (Role role : values()) {
            if (Arrays.asList(role.claimNames).contains(normalized)) {
                return role;
            }
        }
        return null;
    }

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
