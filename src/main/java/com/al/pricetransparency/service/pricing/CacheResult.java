package com.al.pricetransparency.service.pricing;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CacheResult {
    boolean hit;
    Map<String, Object> data;
    boolean fromCache;

    /**
     * Age of the cached entry in milliseconds; null on a miss.
     */
    Long cacheAgeMs;
}
