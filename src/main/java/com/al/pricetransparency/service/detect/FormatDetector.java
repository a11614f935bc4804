package com.al.pricetransparency.service.detect;

import com.al.pricetransparency.config.IngestionProperties;
import com.al.pricetransparency.exception.UnsupportedFileFormatException;
import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.enums.SchemaVersion;
import com.al.pricetransparency.service.parser.csv.CsvField;
import com.al.pricetransparency.service.parser.csv.CsvHeaderIndex;
import com.al.pricetransparency.service.parser.csv.WidePayerColumn;
import com.al.pricetransparency.util.FileReaders;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which parser a file needs by looking at its name and its first bytes only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FormatDetector {

    static final int SAMPLE_BYTES = 1024 * 1024;
    static final int CSV_HEADER_ROWS = 3;

    private static final Pattern VERSION = Pattern.compile("\"(?:version|VERSION)\"\\s*:\\s*\"?([^\",}\\s]+)\"?");
    private static final Pattern VENDOR_VERSION_2 = Pattern.compile("\"VERSION\"\\s*:\\s*\"?2\"?\\s*[,}]");
    private static final Pattern DESCRIPTION_KEY = Pattern.compile("\"description\"\\s*:");

    private final IngestionProperties properties;

    public FileMetadata detect(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new UnsupportedFileFormatException("Not a regular file: " + path);
        }
        long size = Files.size(path);
        String prefix = FileReaders.readPrefix(path, properties.getHeaderPrefixBytes());

        FileMetadata metadata = isJson(path, prefix)
                ? detectJson(path, prefix, size)
                : detectCsv(path, size);
        log.info("Detected {}: format={}, version={}, size={} bytes, ~{} records", path.getFileName(),
                metadata.getFormat(), metadata.getVersion(), size, metadata.getEstimatedRecordCount());
        return metadata;
    }

    private boolean isJson(Path path, String prefix) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return true;
        }
        if (name.endsWith(".csv")) {
            return false;
        }
        String content = prefix.stripLeading();
        if (content.startsWith("{") || content.startsWith("[")) {
            return true;
        }
        int lineEnd = content.indexOf('\n');
        String firstLine = lineEnd >= 0 ? content.substring(0, lineEnd) : content;
        if (firstLine.contains(",")) {
            return false;
        }
        throw new UnsupportedFileFormatException("Unrecognized price file format: " + path.getFileName());
    }

    private FileMetadata detectJson(Path path, String prefix, long size) throws IOException {
        boolean vendor = prefix.contains("\"HOSPITAL NAME\"")
                || (VENDOR_VERSION_2.matcher(prefix).find() && prefix.contains("\"code|1\""));

        String rawVersion = null;
        Matcher matcher = VERSION.matcher(prefix);
        if (matcher.find()) {
            rawVersion = matcher.group(1);
        }

        return FileMetadata.builder()
                .path(path)
                .format(vendor ? FileFormat.VENDOR_JSON : FileFormat.JSON)
                .version(SchemaVersion.fromVersionString(rawVersion))
                .rawVersion(rawVersion)
                .sizeBytes(size)
                .estimatedRecordCount(estimateJsonRecords(path, size))
                .build();
    }

    private Long estimateJsonRecords(Path path, long size) throws IOException {
        String sample = FileReaders.readPrefix(path, SAMPLE_BYTES);
        if (sample.isEmpty()) {
            return null;
        }
        long matches = DESCRIPTION_KEY.matcher(sample).results().count();
        if (matches == 0) {
            return null;
        }
        long sampled = Math.min(size, SAMPLE_BYTES);
        return Math.round((double) matches / sampled * size);
    }

    private FileMetadata detectCsv(Path path, long size) throws IOException {
        List<List<String>> rows = readCsvHeaderRows(path);
        if (rows.size() < CSV_HEADER_ROWS) {
            throw new UnsupportedFileFormatException(
                    "CSV file " + path.getFileName() + " has fewer than three header rows");
        }

        String rawVersion = null;
        List<String> names = rows.get(0);
        List<String> values = rows.get(1);
        for (int i = 0; i < names.size() && i < values.size(); i++) {
            if (CsvHeaderIndex.normalize(names.get(i)).equals("version")) {
                rawVersion = values.get(i).trim();
                break;
            }
        }

        return FileMetadata.builder()
                .path(path)
                .format(classifyCsv(rows.get(2)))
                .version(SchemaVersion.fromVersionString(rawVersion))
                .rawVersion(rawVersion)
                .sizeBytes(size)
                .estimatedRecordCount(estimateCsvRecords(path, size))
                .build();
    }

    /**
     * Tall files carry a payer_name column; wide files encode payers in pipe-delimited headers.
     */
    static FileFormat classifyCsv(List<String> dataHeaders) {
        CsvHeaderIndex index = new CsvHeaderIndex(dataHeaders);
        if (index.has(CsvField.PAYER_NAME)) {
            return FileFormat.CSV_TALL;
        }
        for (int i = 0; i < dataHeaders.size(); i++) {
            String header = dataHeaders.get(i);
            String[] segments = header.split("\\|");
            for (String segment : segments) {
                if (segments.length > 1 && segment.toLowerCase(Locale.ROOT).contains("payer")) {
                    return FileFormat.CSV_WIDE;
                }
            }
            if (WidePayerColumn.classify(i, header).isPresent()) {
                return FileFormat.CSV_WIDE;
            }
        }
        return FileFormat.CSV_TALL;
    }

    private List<List<String>> readCsvHeaderRows(Path path) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (BufferedReader reader = FileReaders.openUtf8(path);
                CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            while (rows.size() < CSV_HEADER_ROWS && records.hasNext()) {
                List<String> row = new ArrayList<>();
                records.next().forEach(row::add);
                rows.add(row);
            }
        }
        return rows;
    }

    private Long estimateCsvRecords(Path path, long size) throws IOException {
        String sample = FileReaders.readPrefix(path, SAMPLE_BYTES);
        long lines = sample.chars().filter(c -> c == '\n').count();
        if (lines == 0) {
            return null;
        }
        long sampled = Math.min(size, SAMPLE_BYTES);
        long estimate = Math.round((double) lines / sampled * size) - CSV_HEADER_ROWS;
        return Math.max(0, estimate);
    }
}
