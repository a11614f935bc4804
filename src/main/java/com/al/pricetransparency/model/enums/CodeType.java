package com.al.pricetransparency.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Billing code systems recognized by the CMS hospital price transparency schema.
 * CMG and MS-LTC-DRG were introduced with schema v3.0.
 */
public enum CodeType {
    CPT("CPT"),
    HCPCS("HCPCS"),
    NDC("NDC"),
    RC("RC"),
    ICD("ICD"),
    DRG("DRG"),
    MS_DRG("MS-DRG"),
    R_DRG("R-DRG"),
    S_DRG("S-DRG"),
    APS_DRG("APS-DRG"),
    AP_DRG("AP-DRG"),
    APR_DRG("APR-DRG"),
    APC("APC"),
    LOCAL("LOCAL"),
    EAPG("EAPG"),
    HIPPS("HIPPS"),
    CDT("CDT"),
    CDM("CDM"),
    TRIS_DRG("TRIS-DRG"),
    CMG("CMG"),
    MS_LTC_DRG("MS-LTC-DRG");

    private final String value;

    CodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup of a wire value. Returns null for blank or unrecognized input.
     */
    @JsonCreator
    public static CodeType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        for (CodeType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
