package com.al.pricetransparency.service.ingestion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionError {

    public enum Type {
        PARSE, VALIDATION, DATABASE, UNKNOWN
    }

    private Type type;
    private String message;

    /**
     * Index of the failing item within its array or data rows, when known.
     */
    private Long itemIndex;
    private Instant timestamp;

    public static IngestionError of(Type type, String message, Long itemIndex) {
        return new IngestionError(type, message, itemIndex, Instant.now());
    }
}
