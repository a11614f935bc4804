package com.al.pricetransparency.model;

import com.al.pricetransparency.model.enums.Methodology;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payer rate embedded in a {@link StandardChargeDocument}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayerChargeDocument {
    private String payerName;
    private String planName;
    private Methodology methodology;

    private Double dollarAmount;
    private Double percentage;
    private String algorithm;
    private boolean algorithmicPricing;

    private Double medianAmount;
    private Double percentile10;
    private Double percentile90;
    private String count;

    private Double estimatedAmount;
    private String notes;
}
