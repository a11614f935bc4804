package com.al.pricetransparency.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum DrugMeasurementType {
    GR, ML, ME, UN, F2, GM, EA;

    @JsonCreator
    public static DrugMeasurementType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
