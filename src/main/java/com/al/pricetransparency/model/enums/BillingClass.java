package com.al.pricetransparency.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Schema v2.x only.
 */
public enum BillingClass {
    FACILITY("facility"),
    PROFESSIONAL("professional");

    private final String value;

    BillingClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BillingClass fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (BillingClass billingClass : values()) {
            if (billingClass.value.equals(normalized)) {
                return billingClass;
            }
        }
        return null;
    }
}
