package com.al.pricetransparency.service.ingestion;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class IngestionOptions {

    @Builder.Default
    int batchSize = 500;

    /**
     * Parse and normalize without writing anything.
     */
    boolean dryRun;

    /**
     * Caps the number of parsed items per file; null means no limit.
     */
    Integer maxItems;

    /**
     * Leave a hospital untouched when it is already stored.
     */
    boolean skipExisting;

    /**
     * Delete the hospital's stored charges and modifiers before writing the new ones.
     */
    boolean replaceExisting;

    @Builder.Default
    boolean upsert = true;

    public static IngestionOptions defaults() {
        return IngestionOptions.builder().build();
    }
}
