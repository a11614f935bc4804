package com.al.pricetransparency.model.mrf;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Format-agnostic billable item produced by every parser and consumed by the document builder.
 * Binds directly to a {@code standard_charge_information[]} element of a CMS JSON file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChargeItem {

    private String description;

    @Builder.Default
    @JsonProperty("code_information")
    private List<CodeInformation> codes = new ArrayList<>();

    @JsonProperty("drug_information")
    private DrugInformation drugInfo;

    @Builder.Default
    @JsonProperty("standard_charges")
    private List<SettingCharge> settingCharges = new ArrayList<>();
}
