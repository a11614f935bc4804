package com.al.pricetransparency.model.mrf;

import com.al.pricetransparency.model.enums.BillingClass;
import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.util.LenientDoubleDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Charges of an item in one care setting ({@code standard_charges[]} in the CMS JSON schema).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettingCharge {

    private Setting setting;

    @JsonProperty("gross_charge")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double grossCharge;

    @JsonProperty("discounted_cash")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double discountedCashPrice;

    @JsonProperty("minimum")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double minNegotiated;

    @JsonProperty("maximum")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double maxNegotiated;

    @Builder.Default
    @JsonProperty("payers_information")
    private List<PayerCharge> payerCharges = new ArrayList<>();

    @JsonProperty("modifier_code")
    private List<String> modifierCodes;

    @JsonProperty("billing_class")
    private BillingClass billingClass;

    @JsonProperty("additional_generic_notes")
    private String notes;

    /**
     * A row is meaningful when it publishes a gross charge, a cash price or at least one payer rate.
     */
    @JsonIgnore
    public boolean isMeaningful() {
        return grossCharge != null
                || discountedCashPrice != null
                || (payerCharges != null && payerCharges.stream().anyMatch(Objects::nonNull));
    }
}
