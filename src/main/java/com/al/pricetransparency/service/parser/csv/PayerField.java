package com.al.pricetransparency.service.parser.csv;

import java.util.Locale;

/**
 * Payer-scoped value kinds found in wide CSV headers.
 */
public enum PayerField {
    NEGOTIATED_DOLLAR,
    NEGOTIATED_PERCENTAGE,
    NEGOTIATED_ALGORITHM,
    METHODOLOGY,
    ESTIMATED_AMOUNT,
    MEDIAN_AMOUNT,
    PERCENTILE_10,
    PERCENTILE_90,
    COUNT,
    ADDITIONAL_PAYER_NOTES;

    /**
     * Classifies a header segment, or returns null when it names no payer field.
     */
    public static PayerField fromToken(String token) {
        if (token == null) {
            return null;
        }
        String t = CsvHeaderIndex.normalize(token).toLowerCase(Locale.ROOT);
        if (t.contains("dollar")) {
            return NEGOTIATED_DOLLAR;
        }
        if (t.contains("percentage")) {
            return NEGOTIATED_PERCENTAGE;
        }
        if (t.contains("algorithm")) {
            return NEGOTIATED_ALGORITHM;
        }
        if (t.contains("methodology")) {
            return METHODOLOGY;
        }
        if (t.contains("estimated_amount")) {
            return ESTIMATED_AMOUNT;
        }
        if (t.contains("median_amount")) {
            return MEDIAN_AMOUNT;
        }
        if (t.contains("10th_percentile")) {
            return PERCENTILE_10;
        }
        if (t.contains("90th_percentile")) {
            return PERCENTILE_90;
        }
        if (t.contains("count") && !t.contains("discount")) {
            return COUNT;
        }
        if (t.contains("payer_notes")) {
            return ADDITIONAL_PAYER_NOTES;
        }
        return null;
    }
}
