package org.politia.warehouse.entity;

import java.util.Locale;

/**
 * The two chambers of the Italian parliament.
 */
public enum Chamber {

    CAMERA("C"),
    SENATO("S");

    private final String code;

    Chamber(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Accepts either the one-letter code or the enum name, case-insensitive.
     */
    public static Chamber fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Chamber code is required");
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (Chamber chamber : values()) {
            if (chamber.code.equals(upper) || chamber.name().equals(upper)) {
                return chamber;
            }
        }
        throw new IllegalArgumentException("Unknown chamber code: " + value);
    }
}
