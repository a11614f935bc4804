package com.al.pricetransparency.service.parser.csv;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.enums.Methodology;
import com.al.pricetransparency.model.enums.SchemaVersion;
import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.al.pricetransparency.model.mrf.PayerCharge;
import com.al.pricetransparency.model.mrf.SettingCharge;
import com.al.pricetransparency.service.detect.FileMetadata;
import com.al.pricetransparency.service.parser.ChargeItemListener;
import com.al.pricetransparency.service.parser.ParseOptions;
import com.al.pricetransparency.service.parser.ParseResult;
import com.al.pricetransparency.util.NumberParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parser for "wide" CMS CSV files: one row per item and setting, with payer/plan
 * names encoded in the column headers. Payer columns are discovered once from the
 * data header row; see {@link WidePayerColumn} for the recognized layouts.
 */
@Component
@Slf4j
public class CsvWideChargeParser extends AbstractCsvChargeParser {

    @Override
    public FileFormat format() {
        return FileFormat.CSV_WIDE;
    }

    @Override
    protected ParseResult parseRecords(Iterator<CSVRecord> records, CsvHeaderIndex headers,
            HospitalMetadata metadata, SchemaVersion version, FileMetadata file, ChargeItemListener listener,
            ParseOptions options) {
        List<WidePayerColumn> payerColumns = discoverPayerColumns(headers.getHeaders());
        log.debug("Found {} payer columns in {}", payerColumns.size(), file.getPath().getFileName());

        long emitted = 0;
        long failed = 0;
        long skipped = 0;

        while (!options.limitReached(emitted) && records.hasNext()) {
            CSVRecord record = records.next();
            try {
                String description = headers.value(record, CsvField.DESCRIPTION);
                if (description == null) {
                    skipped++;
                    continue;
                }

                SettingCharge charge = SettingCharge.builder()
                        .setting(Setting.fromValueOrBoth(headers.value(record, CsvField.SETTING)))
                        .grossCharge(headers.number(record, CsvField.GROSS_CHARGE))
                        .discountedCashPrice(headers.number(record, CsvField.DISCOUNTED_CASH))
                        .minNegotiated(headers.number(record, CsvField.MINIMUM))
                        .maxNegotiated(headers.number(record, CsvField.MAXIMUM))
                        .notes(headers.value(record, CsvField.GENERIC_NOTES))
                        .modifierCodes(modifierCodes(record, headers))
                        .billingClass(billingClass(record, headers))
                        .payerCharges(payerCharges(record, payerColumns, version))
                        .build();

                ChargeItem item = ChargeItem.builder()
                        .description(description)
                        .codes(headers.codes(record))
                        .drugInfo(drugInformation(record, headers))
                        .settingCharges(new ArrayList<>(List.of(charge)))
                        .build();

                listener.onChargeItem(item, emitted++);
                if (options.isProgressDue(emitted)) {
                    listener.onProgress(emitted, file.getEstimatedRecordCount(), record.getCharacterPosition());
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Skipping malformed CSV row {} in {}: {}", record.getRecordNumber(),
                        file.getPath().getFileName(), e.getMessage());
                listener.onParseError(record.getRecordNumber(), e.getMessage());
            }
        }

        log.info("Parsed {} charge items from wide CSV {} ({} rows skipped, {} failed)", emitted,
                file.getPath().getFileName(), skipped, failed);
        return ParseResult.builder()
                .metadata(metadata)
                .format(FileFormat.CSV_WIDE)
                .chargeCount(emitted)
                .failedCount(failed)
                .skippedCount(skipped)
                .build();
    }

    static List<WidePayerColumn> discoverPayerColumns(List<String> headers) {
        List<WidePayerColumn> columns = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            Optional<WidePayerColumn> column = WidePayerColumn.classify(i, headers.get(i));
            column.ifPresent(columns::add);
        }
        return columns;
    }

    private static List<PayerCharge> payerCharges(CSVRecord record, List<WidePayerColumn> columns,
            SchemaVersion version) {
        Map<String, PayerCharge> byPayer = new LinkedHashMap<>();
        for (WidePayerColumn column : columns) {
            if (column.getIndex() >= record.size()) {
                continue;
            }
            String value = NumberParser.trimToNull(record.get(column.getIndex()));
            if (value == null) {
                continue;
            }
            PayerCharge payer = byPayer.computeIfAbsent(column.payerKey(), k -> PayerCharge.builder()
                    .payerName(column.getPayerName())
                    .planName(column.getPlanName())
                    .build());
            apply(payer, column.getField(), value);
        }
        List<PayerCharge> payers = new ArrayList<>(byPayer.values());
        payers.forEach(p -> retainVersionFields(p, version));
        return payers;
    }

    private static void apply(PayerCharge payer, PayerField field, String value) {
        switch (field) {
            case NEGOTIATED_DOLLAR:
                payer.setDollarAmount(NumberParser.parse(value));
                break;
            case NEGOTIATED_PERCENTAGE:
                payer.setPercentage(NumberParser.parse(value));
                break;
            case NEGOTIATED_ALGORITHM:
                payer.setAlgorithm(value);
                break;
            case METHODOLOGY:
                payer.setMethodology(Methodology.fromValue(value));
                break;
            case ESTIMATED_AMOUNT:
                payer.setEstimatedAmount(NumberParser.parse(value));
                break;
            case MEDIAN_AMOUNT:
                payer.setMedianAmount(NumberParser.parse(value));
                break;
            case PERCENTILE_10:
                payer.setPercentile10(NumberParser.parse(value));
                break;
            case PERCENTILE_90:
                payer.setPercentile90(NumberParser.parse(value));
                break;
            case COUNT:
                payer.setCount(value);
                break;
            case ADDITIONAL_PAYER_NOTES:
                payer.setNotes(value);
                break;
            default:
                log.debug("Ignoring payer field {}", field);
        }
    }
}
