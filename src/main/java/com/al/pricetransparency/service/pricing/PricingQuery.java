package com.al.pricetransparency.service.pricing;

import lombok.Value;

import java.util.Locale;

/**
 * One lookup against the pricing API. The cache key is case-insensitive.
 */
@Value
public class PricingQuery {
    String procedureId;
    String metroSlug;
    String priceType;

    public String cacheKey() {
        return (procedureId + ":" + metroSlug + ":" + priceType).toLowerCase(Locale.ROOT);
    }
}
