package com.al.pricetransparency.service.parser.csv;

import com.al.pricetransparency.model.enums.CodeType;
import com.al.pricetransparency.model.mrf.CodeInformation;
import com.al.pricetransparency.util.NumberParser;
import org.apache.commons.csv.CSVRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Column lookup for the data header row (row 3) of a CMS CSV file.
 */
public class CsvHeaderIndex {

    static final int MAX_CODE_COLUMNS = 10;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<String> headers;
    private final Map<String, Integer> positions = new HashMap<>();

    public CsvHeaderIndex(List<String> headers) {
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        for (int i = 0; i < headers.size(); i++) {
            // first occurrence wins for duplicated headers
            positions.putIfAbsent(normalize(headers.get(i)), i);
        }
    }

    public static String normalize(String header) {
        return header == null ? "" : WHITESPACE.matcher(header.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    public List<String> getHeaders() {
        return headers;
    }

    public boolean has(String normalizedHeader) {
        return positions.containsKey(normalizedHeader);
    }

    public boolean has(CsvField field) {
        return field.getAliases().stream().anyMatch(this::has);
    }

    /**
     * First non-blank value among the given header spellings, or null.
     */
    public String value(CSVRecord record, String... keys) {
        for (String key : keys) {
            Integer position = positions.get(normalize(key));
            if (position != null && position < record.size()) {
                String value = NumberParser.trimToNull(record.get(position));
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    public String value(CSVRecord record, CsvField field) {
        return value(record, field.getAliases().toArray(new String[0]));
    }

    public Double number(CSVRecord record, CsvField field) {
        return NumberParser.parse(value(record, field));
    }

    /**
     * Extracts the code/type pairs of a row. Indexed pairs {@code code|[n]} or
     * {@code code|n} are tried for n = 1..10 ({@code code|[i]} also stands for the
     * first one); rows of files without indexed columns fall back to a bare
     * {@code code} column. Duplicate pairs are removed.
     */
    public List<CodeInformation> codes(CSVRecord record) {
        Set<String> seen = new LinkedHashSet<>();
        List<CodeInformation> codes = new ArrayList<>();
        for (int n = 1; n <= MAX_CODE_COLUMNS; n++) {
            String code;
            String type;
            if (n == 1) {
                code = value(record, "code|[1]", "code|1", "code|[i]");
                type = value(record, "code|[1]|type", "code|1|type", "code|[i]|type");
            } else {
                code = value(record, "code|[" + n + "]", "code|" + n);
                type = value(record, "code|[" + n + "]|type", "code|" + n + "|type");
            }
            addCode(codes, seen, code, type);
        }
        if (codes.isEmpty()) {
            addCode(codes, seen, value(record, "code"), value(record, "code|type", "code_type"));
        }
        return codes;
    }

    private static void addCode(List<CodeInformation> codes, Set<String> seen, String code, String type) {
        if (code == null || type == null) {
            return;
        }
        if (seen.add(code + ":" + type.toUpperCase(Locale.ROOT))) {
            codes.add(new CodeInformation(code, CodeType.fromValue(type)));
        }
    }
}
