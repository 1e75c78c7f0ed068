package com.sheetengine.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * AUTO propagates every edit synchronously; MANUAL defers propagation
 * until an explicit recalculation.
 */
public enum CalculationMode {
    AUTO,
    MANUAL;

    /**
     * Allows case-insensitive JSON input, e.g. "auto" -> AUTO.
     */
    @JsonCreator
    public static CalculationMode fromValue(String value) {
        return CalculationMode.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
