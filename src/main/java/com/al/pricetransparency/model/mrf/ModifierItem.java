package com.al.pricetransparency.model.mrf;

import com.al.pricetransparency.model.enums.Setting;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Billing-code modifier ({@code modifier_information[]}). The setting is only published by v3.0 files.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModifierItem {

    private String code;

    private String description;

    private Setting setting;

    @Builder.Default
    @JsonProperty("modifier_payer_information")
    private List<PayerModification> payerInformation = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PayerModification {
        @JsonProperty("payer_name")
        private String payerName;

        @JsonProperty("plan_name")
        private String planName;

        private String description;
    }
}
