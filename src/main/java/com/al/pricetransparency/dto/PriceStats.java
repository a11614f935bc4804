package com.al.pricetransparency.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Gross and cash price spread of one code across every stored hospital.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PriceStats {
    private long count;
    private Double avgGross;
    private Double minGross;
    private Double maxGross;
    private Double avgDiscounted;

    public static PriceStats empty() {
        return new PriceStats();
    }
}
