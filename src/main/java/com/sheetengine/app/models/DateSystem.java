package com.sheetengine.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Epoch used to turn serial day numbers into dates.
 */
public enum DateSystem {
    SYSTEM_1900("1900"),
    SYSTEM_1904("1904");

    private final String label;

    DateSystem(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts "1900"/"1904" as well as the enum names.
     */
    @JsonCreator
    public static DateSystem fromValue(String value) {
        for (DateSystem system : values()) {
            if (system.label.equals(value) || system.name().equalsIgnoreCase(value)) {
                return system;
            }
        }
        throw new IllegalArgumentException("Unknown date system: " + value);
    }
}
