package com.al.pricetransparency.service.parser.csv;

import com.al.pricetransparency.model.enums.FileFormat;
import com.al.pricetransparency.model.enums.Methodology;
import com.al.pricetransparency.model.enums.SchemaVersion;
import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.model.mrf.ChargeItem;
import com.al.pricetransparency.model.mrf.CodeInformation;
import com.al.pricetransparency.model.mrf.DrugInformation;
import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.al.pricetransparency.model.mrf.PayerCharge;
import com.al.pricetransparency.model.mrf.SettingCharge;
import com.al.pricetransparency.service.detect.FileMetadata;
import com.al.pricetransparency.service.parser.ChargeItemListener;
import com.al.pricetransparency.service.parser.ParseOptions;
import com.al.pricetransparency.service.parser.ParseResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parser for "tall" CMS CSV files, which publish one row per item and payer/plan.
 *
 * <p>
 * Consecutive rows with the same description and codes are folded into one
 * {@link ChargeItem}: a new {@link SettingCharge} per distinct setting and one
 * {@link PayerCharge} per payer row. Only contiguous rows are folded; an item whose
 * rows are interleaved with other items is emitted several times.
 */
@Component
@Slf4j
public class CsvTallChargeParser extends AbstractCsvChargeParser {

    @Override
    public FileFormat format() {
        return FileFormat.CSV_TALL;
    }

    @Override
    protected ParseResult parseRecords(Iterator<CSVRecord> records, CsvHeaderIndex headers,
            HospitalMetadata metadata, SchemaVersion version, FileMetadata file, ChargeItemListener listener,
            ParseOptions options) {
        long emitted = 0;
        long failed = 0;
        long skipped = 0;
        long position = 0;
        ChargeGroup group = null;

        while (!options.limitReached(emitted) && records.hasNext()) {
            CSVRecord record = records.next();
            position = record.getCharacterPosition();
            try {
                String description = headers.value(record, CsvField.DESCRIPTION);
                if (description == null) {
                    skipped++;
                    continue;
                }
                List<CodeInformation> codes = headers.codes(record);
                String key = groupKey(description, codes);

                if (group == null || !group.key.equals(key)) {
                    if (group != null) {
                        listener.onChargeItem(group.toItem(), emitted++);
                        reportProgress(listener, options, emitted, file, position);
                        if (options.limitReached(emitted)) {
                            group = null;
                            break;
                        }
                    }
                    group = new ChargeGroup(key, description, codes, drugInformation(record, headers));
                }
                group.addRow(record, headers, version);
            } catch (RuntimeException e) {
                failed++;
                log.warn("Skipping malformed CSV row {} in {}: {}", record.getRecordNumber(),
                        file.getPath().getFileName(), e.getMessage());
                listener.onParseError(record.getRecordNumber(), e.getMessage());
            }
        }

        if (group != null && !options.limitReached(emitted)) {
            listener.onChargeItem(group.toItem(), emitted++);
        }

        log.info("Parsed {} charge items from tall CSV {} ({} rows skipped, {} failed)", emitted,
                file.getPath().getFileName(), skipped, failed);
        return ParseResult.builder()
                .metadata(metadata)
                .format(FileFormat.CSV_TALL)
                .chargeCount(emitted)
                .failedCount(failed)
                .skippedCount(skipped)
                .build();
    }

    private static void reportProgress(ChargeItemListener listener, ParseOptions options, long emitted,
            FileMetadata file, long position) {
        if (options.isProgressDue(emitted)) {
            listener.onProgress(emitted, file.getEstimatedRecordCount(), position);
        }
    }

    private static String groupKey(String description, List<CodeInformation> codes) {
        return description + "|" + codes.stream()
                .map(c -> c.getCode() + ":" + c.getType())
                .collect(Collectors.joining(","));
    }

    /**
     * Rows of the item currently being folded.
     */
    private static final class ChargeGroup {
        private final String key;
        private final String description;
        private final List<CodeInformation> codes;
        private final DrugInformation drugInfo;
        private final Map<Setting, SettingCharge> settings = new LinkedHashMap<>();

        ChargeGroup(String key, String description, List<CodeInformation> codes, DrugInformation drugInfo) {
            this.key = key;
            this.description = description;
            this.codes = codes;
            this.drugInfo = drugInfo;
        }

        void addRow(CSVRecord record, CsvHeaderIndex headers, SchemaVersion version) {
            Setting setting = Setting.fromValueOrBoth(headers.value(record, CsvField.SETTING));
            Double gross = headers.number(record, CsvField.GROSS_CHARGE);
            Double cash = headers.number(record, CsvField.DISCOUNTED_CASH);
            Double min = headers.number(record, CsvField.MINIMUM);
            Double max = headers.number(record, CsvField.MAXIMUM);
            String notes = headers.value(record, CsvField.GENERIC_NOTES);

            SettingCharge charge = settings.get(setting);
            if (charge == null) {
                charge = SettingCharge.builder()
                        .setting(setting)
                        .grossCharge(gross)
                        .discountedCashPrice(cash)
                        .minNegotiated(min)
                        .maxNegotiated(max)
                        .notes(notes)
                        .modifierCodes(modifierCodes(record, headers))
                        .billingClass(billingClass(record, headers))
                        .build();
                settings.put(setting, charge);
            } else {
                if (charge.getGrossCharge() == null) {
                    charge.setGrossCharge(gross);
                }
                if (charge.getDiscountedCashPrice() == null) {
                    charge.setDiscountedCashPrice(cash);
                }
                if (min != null && (charge.getMinNegotiated() == null || min < charge.getMinNegotiated())) {
                    charge.setMinNegotiated(min);
                }
                if (max != null && (charge.getMaxNegotiated() == null || max > charge.getMaxNegotiated())) {
                    charge.setMaxNegotiated(max);
                }
                if (charge.getNotes() == null) {
                    charge.setNotes(notes);
                }
            }

            String payerName = headers.value(record, CsvField.PAYER_NAME);
            if (payerName != null) {
                PayerCharge payer = PayerCharge.builder()
                        .payerName(payerName)
                        .planName(headers.value(record, CsvField.PLAN_NAME))
                        .methodology(Methodology.fromValue(headers.value(record, CsvField.METHODOLOGY)))
                        .dollarAmount(headers.number(record, CsvField.NEGOTIATED_DOLLAR))
                        .percentage(headers.number(record, CsvField.NEGOTIATED_PERCENTAGE))
                        .algorithm(headers.value(record, CsvField.NEGOTIATED_ALGORITHM))
                        .medianAmount(headers.number(record, CsvField.MEDIAN_AMOUNT))
                        .percentile10(headers.number(record, CsvField.PERCENTILE_10))
                        .percentile90(headers.number(record, CsvField.PERCENTILE_90))
                        .count(headers.value(record, CsvField.COUNT))
                        .estimatedAmount(headers.number(record, CsvField.ESTIMATED_AMOUNT))
                        .notes(headers.value(record, CsvField.PAYER_NOTES))
                        .build();
                retainVersionFields(payer, version);
                charge.getPayerCharges().add(payer);
            }
        }

        ChargeItem toItem() {
            return ChargeItem.builder()
                    .description(description)
                    .codes(codes)
                    .drugInfo(drugInfo)
                    .settingCharges(new ArrayList<>(settings.values()))
                    .build();
        }
    }
}
