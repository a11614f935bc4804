package com.al.pricetransparency.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Cached response of the external pricing API. Mongo removes the entry once {@code expiresAt} passes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "pricing_cache")
@CompoundIndex(def = "{'procedureId': 1, 'metroSlug': 1, 'priceType': 1}", name = "pricing_query_idx")
public class PricingCacheDocument {
    @Id
    private String id;

    @Indexed(unique = true)
    private String cacheKey;

    private String procedureId;
    private String metroSlug;
    private String priceType;

    private Map<String, Object> data;

    @Indexed(name = "expires_at_ttl_idx", expireAfterSeconds = 0)
    private Instant expiresAt;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastAccessedAt;
    private long hitCount;

    private String dataVersion;
    private Long fetchDurationMs;
    private Integer providerCount;
}
