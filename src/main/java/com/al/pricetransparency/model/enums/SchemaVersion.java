package com.al.pricetransparency.model.enums;

/**
 * CMS schema generation a file claims to follow. {@link #UNKNOWN} never stops ingestion.
 */
public enum SchemaVersion {
    V2("2.2.0"),
    V3("3.0.0"),
    UNKNOWN("unknown");

    private final String label;

    SchemaVersion(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static SchemaVersion fromVersionString(String version) {
        if (version == null) {
            return UNKNOWN;
        }
        String trimmed = version.trim();
        if (trimmed.startsWith("3.")) {
            return V3;
        }
        if (trimmed.startsWith("2.")) {
            return V2;
        }
        return UNKNOWN;
    }
}
