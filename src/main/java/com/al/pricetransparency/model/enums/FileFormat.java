package com.al.pricetransparency.model.enums;

public enum FileFormat {
    JSON,
    CSV_TALL,
    CSV_WIDE,
    VENDOR_JSON
}
