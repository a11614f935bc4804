package com.al.pricetransparency.service.pricing;

import com.al.pricetransparency.config.PricingProperties;
import com.al.pricetransparency.model.PricingCacheDocument;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes fetched pricing responses back to the cache off the request thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PricingCacheWriter {

    private final MongoTemplate mongoTemplate;
    private final PricingProperties properties;

    /**
     * Upserts the entry for {@code query}. Hit count and creation time are only set when
     * the entry is created. Failures are logged and never reach the caller.
     */
    @Async
    public void write(PricingQuery query, PricingResponse response) {
        try {
            String cacheKey = query.cacheKey();
            Instant now = Instant.now();
            Instant expiresAt = now.plus(Duration.ofHours(properties.getCacheTtlHours()));
            int providerCount = providerCount(response.getData());

            Update update = new Update()
                    .set("procedureId", query.getProcedureId().toLowerCase(Locale.ROOT))
                    .set("metroSlug", query.getMetroSlug().toLowerCase(Locale.ROOT))
                    .set("priceType", query.getPriceType().toLowerCase(Locale.ROOT))
                    .set("data", response.getData())
                    .set("updatedAt", now)
                    .set("expiresAt", expiresAt)
                    .set("fetchDurationMs", response.getFetchDurationMs())
                    .set("providerCount", providerCount)
                    .set("dataVersion", properties.getCacheVersion())
                    .setOnInsert("createdAt", now)
                    .setOnInsert("hitCount", 0L);

            UpdateResult result = mongoTemplate.upsert(new Query(Criteria.where("cacheKey").is(cacheKey)), update,
                    PricingCacheDocument.class);
            String outcome = result.getUpsertedId() != null ? "INSERTED"
                    : result.getModifiedCount() > 0 ? "UPDATED" : "NO-OP";
            log.info("{} cache for {} ({} providers, expires: {})", outcome, cacheKey, providerCount, expiresAt);
        } catch (Exception e) {
            log.error("Failed to write pricing cache for {}: {}", query.cacheKey(), e.getMessage(), e);
        }
    }

    /**
     * Number of providers at {@code data.results.results} of an API response.
     */
    @SuppressWarnings("unchecked")
    static int providerCount(Map<String, Object> body) {
        Object node = body;
        for (String key : List.of("data", "results", "results")) {
            if (!(node instanceof Map)) {
                return 0;
            }
            node = ((Map<String, Object>) node).get(key);
        }
        return node instanceof List ? ((List<?>) node).size() : 0;
    }
}
