package com.flagship.retainer_settlement.identity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Roles resolved by the identity gateway in front of this service.
 */
public enum CallerRole {
    SUPER_ADMIN("super_admin"),
    ADMIN("admin"),
    LAWYER("lawyer"),
    AGENT("agent"),
    ACCOUNTS("accounts");

    private final String value;

    CallerRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<CallerRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
