package com.al.pricetransparency.service.persistence;

import lombok.Value;

/**
 * Outcome of one bulk write. Partial failures show up in {@code errors} rather than as exceptions.
 */
@Value
public class BulkWriteSummary {
    int inserted;
    int modified;
    int errors;

    public static BulkWriteSummary empty() {
        return new BulkWriteSummary(0, 0, 0);
    }
}
