package com.al.pricetransparency.service.parser.csv;

import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.al.pricetransparency.util.NumberParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads the general data elements of rows 1-2 of a CMS CSV file. Row 1 holds
 * the element names, row 2 their values. Names are matched by substring because
 * publishers decorate them, e.g. {@code license_number|CA}.
 */
public final class CsvMetadataReader {

    static final String UNKNOWN_HOSPITAL = "Unknown Hospital";

    private static final String ATTESTATION_MARKER = "to the best of its knowledge";
    private static final String LICENSE_PREFIX = "license_number|";

    private CsvMetadataReader() {
    }

    public static HospitalMetadata read(List<String> names, List<String> values) {
        Row row = new Row(names, values);
        String attestationHeader = names.stream()
                .filter(h -> h != null && h.toLowerCase(Locale.ROOT).contains(ATTESTATION_MARKER))
                .findFirst()
                .orElse(null);
        String attestationValue = attestationHeader != null ? row.valueAt(names.indexOf(attestationHeader)) : null;

        String hospitalName = row.get("hospital_name");
        return HospitalMetadata.builder()
                .hospitalName(hospitalName != null ? hospitalName : UNKNOWN_HOSPITAL)
                .lastUpdatedOn(row.get("last_updated_on"))
                .version(row.get("version"))
                .locations(splitList(row.get("location_name", "hospital_location")))
                .addresses(splitList(row.get("hospital_address")))
                .npiNumbers(splitList(row.get("type_2_npi")))
                .licenseNumber(row.get("license_number"))
                .licenseState(licenseState(names, row))
                .attestationText(attestationHeader)
                .attestationConfirmed(attestationHeader != null && !"false".equalsIgnoreCase(attestationValue))
                .attesterName(row.get("attester_name"))
                .financialAidPolicy(nullIfEmpty(splitList(row.get("financial_aid_policy"))))
                .generalContractProvisions(row.get("general_contract_provisions"))
                .build();
    }

    /**
     * The state is carried in the header itself ({@code license_number|CA}) or in a state column.
     */
    private static String licenseState(List<String> names, Row row) {
        for (String name : names) {
            String normalized = CsvHeaderIndex.normalize(name);
            if (normalized.startsWith(LICENSE_PREFIX) && normalized.length() > LICENSE_PREFIX.length()) {
                return normalized.substring(LICENSE_PREFIX.length()).toUpperCase(Locale.ROOT);
            }
        }
        String state = row.get("state");
        return state != null ? state.toUpperCase(Locale.ROOT) : null;
    }

    static List<String> splitList(String value) {
        if (value == null) {
            return new ArrayList<>();
        }
        List<String> items = new ArrayList<>();
        Arrays.stream(value.split("\\|"))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .forEach(items::add);
        return items;
    }

    private static List<String> nullIfEmpty(List<String> list) {
        return list.isEmpty() ? null : list;
    }

    private static final class Row {
        private final List<String> names;
        private final List<String> values;

        Row(List<String> names, List<String> values) {
            this.names = names;
            this.values = values;
        }

        String get(String... terms) {
            for (String term : terms) {
                for (int i = 0; i < names.size(); i++) {
                    String name = names.get(i);
                    if (name != null && name.toLowerCase(Locale.ROOT).contains(term)) {
                        String value = valueAt(i);
                        if (value != null) {
                            return value;
                        }
                    }
                }
            }
            return null;
        }

        String valueAt(int index) {
            return index >= 0 && index < values.size() ? NumberParser.trimToNull(values.get(index)) : null;
        }
    }
}
