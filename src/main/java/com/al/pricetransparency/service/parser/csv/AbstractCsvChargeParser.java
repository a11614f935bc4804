package com.al.pricetransparency.service.parser.csv;

import com.al.pricetransparency.exception.UnsupportedFileFormatException;
import com.al.pricetransparency.model.enums.BillingClass;
import com.al.pricetransparency.model.enums.DrugMeasurementType;
import com.al.pricetransparency.model.enums.SchemaVersion;
import com.al.pricetransparency.model.mrf.DrugInformation;
import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.al.pricetransparency.model.mrf.PayerCharge;
import com.al.pricetransparency.service.detect.FileMetadata;
import com.al.pricetransparency.service.parser.ChargeFileParser;
import com.al.pricetransparency.service.parser.ChargeItemListener;
import com.al.pricetransparency.service.parser.ParseOptions;
import com.al.pricetransparency.service.parser.ParseResult;
import com.al.pricetransparency.util.FileReaders;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Shared layout handling of CMS CSV files: row 1 general element names, row 2
 * their values, row 3 data headers, rows 4+ data. Records are streamed one at a time.
 */
public abstract class AbstractCsvChargeParser implements ChargeFileParser {

    static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .build();

    @Override
    public ParseResult parse(FileMetadata file, ChargeItemListener listener, ParseOptions options)
            throws IOException {
        try (BufferedReader reader = FileReaders.openUtf8(file.getPath());
                CSVParser parser = CSV_FORMAT.parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            List<String> names = nextRow(records);
            List<String> values = nextRow(records);
            List<String> dataHeaders = nextRow(records);
            if (dataHeaders == null) {
                throw new UnsupportedFileFormatException(
                        "CSV file " + file.getPath().getFileName() + " has fewer than three header rows");
            }

            HospitalMetadata metadata = CsvMetadataReader.read(names, values);
            if (metadata.getVersion() == null) {
                metadata.setVersion(file.getRawVersion());
            }
            SchemaVersion version = SchemaVersion.fromVersionString(metadata.getVersion());
            listener.onMetadata(metadata);

            return parseRecords(records, new CsvHeaderIndex(dataHeaders), metadata, version, file, listener,
                    options);
        }
    }

    protected abstract ParseResult parseRecords(Iterator<CSVRecord> records, CsvHeaderIndex headers,
            HospitalMetadata metadata, SchemaVersion version, FileMetadata file, ChargeItemListener listener,
            ParseOptions options);

    private static List<String> nextRow(Iterator<CSVRecord> records) {
        if (!records.hasNext()) {
            return null;
        }
        List<String> row = new ArrayList<>();
        records.next().forEach(row::add);
        return row;
    }

    protected static DrugInformation drugInformation(CSVRecord record, CsvHeaderIndex headers) {
        Double unit = headers.number(record, CsvField.DRUG_UNIT);
        DrugMeasurementType type = DrugMeasurementType.fromValue(headers.value(record, CsvField.DRUG_TYPE));
        return unit != null && type != null ? new DrugInformation(unit, type) : null;
    }

    protected static List<String> modifierCodes(CSVRecord record, CsvHeaderIndex headers) {
        List<String> codes = CsvMetadataReader.splitList(headers.value(record, CsvField.MODIFIERS));
        return codes.isEmpty() ? null : codes;
    }

    protected static BillingClass billingClass(CSVRecord record, CsvHeaderIndex headers) {
        return BillingClass.fromValue(headers.value(record, CsvField.BILLING_CLASS));
    }

    /**
     * Drops the payer fields the schema version does not define. Median, percentiles and
     * count belong to v3.0; the estimated amount to v2.x. Unknown versions keep everything.
     */
    protected static void retainVersionFields(PayerCharge payer, SchemaVersion version) {
        if (version == SchemaVersion.V3) {
            payer.setEstimatedAmount(null);
        } else if (version == SchemaVersion.V2) {
            payer.setMedianAmount(null);
            payer.setPercentile10(null);
            payer.setPercentile90(null);
            payer.setCount(null);
        }
    }
}
