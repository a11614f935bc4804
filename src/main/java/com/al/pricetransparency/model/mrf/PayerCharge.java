package com.al.pricetransparency.model.mrf;

import com.al.pricetransparency.model.enums.Methodology;
import com.al.pricetransparency.util.LenientDoubleDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Negotiated rate of one payer/plan for a setting.
 *
 * <p>
 * A rate is published as a dollar amount, a percentage of billed charges, an
 * algorithm description, or any combination of them. {@code algorithmicPricing}
 * marks rates the hospital declares as computed by an undisclosed formula; such
 * entries never carry a coerced number.
 * <p>
 * Median, percentiles and count exist only in schema v3.0; the estimated amount
 * only in v2.x.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PayerCharge {

    @JsonProperty("payer_name")
    private String payerName;

    @JsonProperty("plan_name")
    private String planName;

    private Methodology methodology;

    @JsonProperty("standard_charge_dollar")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double dollarAmount;

    @JsonProperty("standard_charge_percentage")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double percentage;

    @JsonProperty("standard_charge_algorithm")
    private String algorithm;

    @JsonIgnore
    private boolean algorithmicPricing;

    @JsonProperty("median_amount")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double medianAmount;

    @JsonProperty("10th_percentile")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double percentile10;

    @JsonProperty("90th_percentile")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double percentile90;

    private String count;

    @JsonProperty("estimated_amount")
    @JsonDeserialize(using = LenientDoubleDeserializer.class)
    private Double estimatedAmount;

    @JsonProperty("additional_payer_notes")
    private String notes;

    /**
     * Whether this entry carries any published rate worth keeping.
     */
    @JsonIgnore
    public boolean hasPriceSignal() {
        return dollarAmount != null
                || percentage != null
                || (algorithm != null && !algorithm.isBlank())
                || algorithmicPricing
                || estimatedAmount != null;
    }
}
