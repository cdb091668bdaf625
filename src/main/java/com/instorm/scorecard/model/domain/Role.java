package com.instorm.scorecard.model.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Organizational roles known to the client. The API may send roles that are not
 * listed here; those are kept as raw strings on {@link User} and displayed as-is.
 */
public enum Role {
    SALES_DIRECTOR("Sales Director"),
    REGIONAL_SALES_MANAGER("Regional Sales Manager"),
    SALES_LEAD("Sales Lead"),
    SALESPERSON("Salesperson"),
    ADMIN("Administrator");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean matches(String code) {
        return name().equals(code);
    }

    public static Optional<Role> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(role -> role.matches(code))
                .findFirst();
    }

    /**
     * Label shown for a role code. Unknown codes are returned unchanged so that a
     * role added on the server never breaks rendering.
     */
    public static String displayLabel(String code) {
        if (code == null) {
            return "";
        }
        return fromCode(code).map(Role::getLabel).orElse(code);
    }
}
