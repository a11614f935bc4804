package com.al.pricetransparency.service.parser;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.mrf.HospitalMetadata;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParseResult {
    HospitalMetadata metadata;
    FileFormat format;
    long chargeCount;
    long modifierCount;

    /**
     * Elements or rows that could not be parsed and were skipped.
     */
    long failedCount;

    /**
     * Rows ignored on purpose, e.g. without a description.
     */
    long skippedCount;
}
