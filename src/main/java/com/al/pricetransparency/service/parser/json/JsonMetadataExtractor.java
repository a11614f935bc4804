package com.al.pricetransparency.service.parser.json;

import com.al.pricetransparency.model.mrf.HospitalMetadata;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link HospitalMetadata} from the top-level fields of a CMS JSON file,
 * either from the parsed header tree or, for streamed files, from the raw file prefix.
 */
public final class JsonMetadataExtractor {

    static final String UNKNOWN_HOSPITAL = "Unknown Hospital";

    private static final Pattern HOSPITAL_NAME = field("hospital_name");
    private static final Pattern VERSION = field("version");
    private static final Pattern LAST_UPDATED = field("last_updated_on");
    private static final Pattern LICENSE_NUMBER = field("license_number");
    private static final Pattern STATE = Pattern.compile("\"state\"\\s*:\\s*\"([A-Z]{2})\"");

    private JsonMetadataExtractor() {
    }

    /**
     * v3.0 files publish {@code attestation} and {@code location_name}; anything else is read as v2.x.
     */
    public static HospitalMetadata fromTree(JsonNode root) {
        boolean v3 = root.has("attestation") && root.has("location_name");
        JsonNode license = root.path("license_information");

        HospitalMetadata.HospitalMetadataBuilder builder = HospitalMetadata.builder()
                .hospitalName(textOr(root.path("hospital_name"), UNKNOWN_HOSPITAL))
                .addresses(textList(root.path("hospital_address")))
                .licenseNumber(text(license.path("license_number")))
                .licenseState(text(license.path("state")))
                .version(text(root.path("version")))
                .lastUpdatedOn(text(root.path("last_updated_on")))
                .generalContractProvisions(text(root.path("general_contract_provisions")));

        if (v3) {
            JsonNode attestation = root.path("attestation");
            builder.locations(textList(root.path("location_name")))
                    .npiNumbers(textList(root.path("type_2_npi")))
                    .attestationText(text(attestation.path("attestation")))
                    .attestationConfirmed(attestation.path("confirm_attestation").asBoolean(false))
                    .attesterName(text(attestation.path("attester_name")));
        } else {
            JsonNode affirmation = root.path("affirmation");
            List<String> aidPolicy = textList(root.path("financial_aid_policy"));
            builder.locations(textList(root.path("hospital_location")))
                    .attestationText(text(affirmation.path("affirmation")))
                    .attestationConfirmed(affirmation.path("confirm_affirmation").asBoolean(false))
                    .financialAidPolicy(aidPolicy.isEmpty() ? null : aidPolicy);
        }
        return builder.build();
    }

    /**
     * Best-effort metadata from the first bytes of a file too large to parse as a tree.
     */
    public static HospitalMetadata fromPrefix(String prefix) {
        String name = match(HOSPITAL_NAME, prefix);
        return HospitalMetadata.builder()
                .hospitalName(name != null ? name : UNKNOWN_HOSPITAL)
                .version(match(VERSION, prefix))
                .lastUpdatedOn(match(LAST_UPDATED, prefix))
                .licenseNumber(match(LICENSE_NUMBER, prefix))
                .licenseState(match(STATE, prefix))
                .build();
    }

    private static Pattern field(String name) {
        return Pattern.compile("\"" + name + "\"\\s*:\\s*\"([^\"]+)\"");
    }

    private static String match(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static String textOr(JsonNode node, String fallback) {
        String value = text(node);
        return value != null ? value : fallback;
    }

    /**
     * Accepts either a single string or an array of strings.
     */
    static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                String value = text(element);
                if (value != null) {
                    values.add(value);
                }
            }
        } else {
            String value = text(node);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
