package com.al.pricetransparency.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Methodology {
    CASE_RATE("case rate"),
    FEE_SCHEDULE("fee schedule"),
    PERCENT_OF_TOTAL_BILLED_CHARGES("percent of total billed charges"),
    PER_DIEM("per diem"),
    OTHER("other");

    private final String value;

    Methodology(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Free-text methodologies that do not match a CMS value are kept as {@link #OTHER}.
     */
    @JsonCreator
    public static Methodology fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', ' ');
        for (Methodology methodology : values()) {
            if (methodology.value.equals(normalized)) {
                return methodology;
            }
        }
        return OTHER;
    }
}
