package com.al.pricetransparency.service.pricing;

import lombok.Value;

import java.util.Map;

@Value
public class PricingResponse {
    Map<String, Object> data;
    long fetchDurationMs;
}
