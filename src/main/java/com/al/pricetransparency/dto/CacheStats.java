package com.al.pricetransparency.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CacheStats {
    private long totalEntries;
    private long totalHits;
    private double avgFetchDuration;
    private Instant oldestEntry;
    private Instant newestEntry;

    public static CacheStats empty() {
        return new CacheStats();
    }
}
