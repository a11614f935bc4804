package com.al.pricetransparency.service.parser;

import com.al.pricetransparency.exception.UnsupportedFileFormatException;
import com.al.pricetransparency.model.enums.FileFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ChargeFileParserRegistry {

    private final Map<FileFormat, ChargeFileParser> parsers = new EnumMap<>(FileFormat.class);

    public ChargeFileParserRegistry(List<ChargeFileParser> parsers) {
        for (ChargeFileParser parser : parsers) {
            ChargeFileParser previous = this.parsers.put(parser.format(), parser);
            if (previous != null) {
                throw new IllegalStateException("Duplicate parser for format " + parser.format() + ": "
                        + previous.getClass().getSimpleName() + ", " + parser.getClass().getSimpleName());
            }
        }
        log.info("Registered parsers for formats {}", this.parsers.keySet());
    }

    public ChargeFileParser getParser(FileFormat format) {
        ChargeFileParser parser = parsers.get(format);
        if (parser == null) {
            throw new UnsupportedFileFormatException("No parser registered for format " + format);
        }
        return parser;
    }
}
