package com.al.pricetransparency.service.ingestion;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.enums.IngestionStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Running and final counters of one file ingestion.
 */
@Data
@NoArgsConstructor
public class IngestionStats {

    /**
     * Errors beyond this many are counted but not recorded individually.
     */
    public static final int MAX_RECORDED_ERRORS = 100;

    private String hospitalId;
    private String hospitalName;
    private String sourceFile;
    private FileFormat format;
    private String version = "unknown";
    private IngestionStatus status = IngestionStatus.RUNNING;

    /**
     * Estimated while parsing, the exact parsed count once completed.
     */
    private long totalCharges;
    private long processedCharges;
    private long insertedCharges;
    private long updatedCharges;
    private long skippedCharges;
    private long failedCharges;
    private long invalidCharges;

    private long totalModifiers;
    private long processedModifiers;

    private boolean skippedExisting;

    private List<IngestionError> errors = new ArrayList<>();

    private Instant startTime;
    private Instant endTime;
    private double avgBatchTimeMs;

    public IngestionStats(String hospitalId, String sourceFile) {
        this.hospitalId = hospitalId;
        this.sourceFile = sourceFile;
        this.startTime = Instant.now();
    }

    public void recordError(IngestionError error) {
        if (errors.size() < MAX_RECORDED_ERRORS) {
            errors.add(error);
        }
    }

    public long getStoredCharges() {
        return insertedCharges + updatedCharges;
    }
}
