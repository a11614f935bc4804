package com.al.pricetransparency.model.enums;

public enum IngestionStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
