package com.al.pricetransparency.service.parser;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.service.detect.FileMetadata;

import java.io.IOException;

/**
 * Parser for one input dialect. Implementations are stateless between calls
 * and may be used for several files concurrently.
 */
public interface ChargeFileParser {

    FileFormat format();

    ParseResult parse(FileMetadata file, ChargeItemListener listener, ParseOptions options) throws IOException;
}
