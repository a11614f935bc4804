package com.al.pricetransparency.service.detect;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.enums.SchemaVersion;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * What the detector learned about a file before parsing it.
 * {@code estimatedRecordCount} is a rough hint for progress reporting and may be null.
 */
@Value
@Builder
public class FileMetadata {
    Path path;
    FileFormat format;
    SchemaVersion version;
    String rawVersion;
    long sizeBytes;
    Long estimatedRecordCount;
}
