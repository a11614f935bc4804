package com.al.pricetransparency.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Setting {
    INPATIENT("inpatient"),
    OUTPATIENT("outpatient"),
    BOTH("both");

    private final String value;

    Setting(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Setting fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Setting setting : values()) {
            if (setting.value.equals(normalized)) {
                return setting;
            }
        }
        return null;
    }

    /**
     * Resolves a cell value, defaulting to {@link #BOTH} when the source leaves it empty or unrecognized.
     */
    public static Setting fromValueOrBoth(String raw) {
        Setting setting = fromValue(raw);
        return setting != null ? setting : BOTH;
    }
}
