package com.al.pricetransparency.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ingestion trigger. Exactly one of {@code file} and {@code directory} is given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionRequest {
    private String file;
    private String directory;

    @Positive
    private Integer batchSize;

    private boolean dryRun;

    @Positive
    private Integer maxItems;

    private boolean skipExisting;
    private boolean replaceExisting;

    /**
     * Ingest the files of {@code directory} concurrently.
     */
    private boolean parallel;
}
