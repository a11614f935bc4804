package com.al.pricetransparency.service.parser.csv;

import java.util.List;

/**
 * Logical data columns of a CMS CSV file and the header spellings each one is
 * published under, most common first. Aliases are compared after lower-casing
 * and removing whitespace.
 */
public enum CsvField {
    DESCRIPTION("description"),
    SETTING("setting"),
    PAYER_NAME("payer_name"),
    PLAN_NAME("plan_name"),
    GROSS_CHARGE("standard_charge|gross", "standard_charge|gross_charge", "gross_charge"),
    DISCOUNTED_CASH("standard_charge|discounted_cash", "discounted_cash"),
    NEGOTIATED_DOLLAR("standard_charge|negotiated_dollar", "negotiated_dollar"),
    NEGOTIATED_PERCENTAGE("standard_charge|negotiated_percentage", "negotiated_percentage"),
    NEGOTIATED_ALGORITHM("standard_charge|negotiated_algorithm", "negotiated_algorithm"),
    METHODOLOGY("standard_charge|methodology", "methodology"),
    MINIMUM("standard_charge|min", "standard_charge|minimum", "minimum"),
    MAXIMUM("standard_charge|max", "standard_charge|maximum", "maximum"),
    MEDIAN_AMOUNT("median_amount", "standard_charge|median_amount"),
    PERCENTILE_10("10th_percentile", "standard_charge|10th_percentile"),
    PERCENTILE_90("90th_percentile", "standard_charge|90th_percentile"),
    COUNT("count", "standard_charge|count"),
    ESTIMATED_AMOUNT("estimated_amount", "standard_charge|estimated_amount"),
    GENERIC_NOTES("additional_generic_notes"),
    PAYER_NOTES("additional_payer_notes"),
    DRUG_UNIT("drug_unit_of_measurement"),
    DRUG_TYPE("drug_type_of_measurement"),
    MODIFIERS("modifiers", "modifier_code"),
    BILLING_CLASS("billing_class");

    private final List<String> aliases;

    CsvField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> getAliases() {
        return aliases;
    }
}
