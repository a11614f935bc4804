package com.al.pricetransparency.service.pricing;

import com.al.pricetransparency.config.PricingProperties;
import com.al.pricetransparency.dto.CacheStats;
import com.al.pricetransparency.model.PricingCacheDocument;
import com.al.pricetransparency.repository.PricingCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Cache-aside access to the pricing API backed by the {@code pricing_cache} collection.
 *
 * <p>
 * A cached entry is served only while it has not expired and was written under the
 * current {@code app.pricing.cache-version}. On a miss the API is called synchronously
 * and the answer is written back asynchronously, so a slow or failing cache write never
 * delays or fails the response.
 */
@Service
@Slf4j
public class PricingCacheService {

    private final MongoTemplate mongoTemplate;
    private final PricingCacheRepository cacheRepository;
    private final PricingApiClient apiClient;
    private final PricingCacheWriter cacheWriter;
    private final PricingProperties properties;

    @Autowired
    public PricingCacheService(MongoTemplate mongoTemplate,
            PricingCacheRepository cacheRepository,
            PricingApiClient apiClient,
            PricingCacheWriter cacheWriter,
            PricingProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.cacheRepository = cacheRepository;
        this.apiClient = apiClient;
        this.cacheWriter = cacheWriter;
        this.properties = properties;
    }

    public CacheResult getPricingWithCache(PricingQuery query) {
        PricingCacheDocument cached = findCached(query);
        if (cached != null) {
            Long cacheAgeMs = cached.getCreatedAt() != null
                    ? Duration.between(cached.getCreatedAt(), Instant.now()).toMillis()
                    : null;
            return CacheResult.builder()
                    .hit(true)
                    .data(cached.getData())
                    .fromCache(true)
                    .cacheAgeMs(cacheAgeMs)
                    .build();
        }

        PricingResponse response = apiClient.fetch(query);
        cacheWriter.write(query, response);

        return CacheResult.builder()
                .hit(false)
                .data(response.getData())
                .fromCache(false)
                .build();
    }

    /**
     * Returns the live entry for {@code query} and records the hit, or null on a miss.
     * A failing cache read counts as a miss.
     */
    public PricingCacheDocument findCached(PricingQuery query) {
        String cacheKey = query.cacheKey();
        Instant now = Instant.now();
        try {
            Query live = new Query(Criteria.where("cacheKey").is(cacheKey)
                    .and("expiresAt").gt(now)
                    .and("dataVersion").is(properties.getCacheVersion()));
            Update hit = new Update().inc("hitCount", 1).set("lastAccessedAt", now);
            PricingCacheDocument document = mongoTemplate.findAndModify(live, hit,
                    FindAndModifyOptions.options().returnNew(true), PricingCacheDocument.class);
            if (document != null) {
                log.info("Cache HIT for {} (hits: {})", cacheKey, document.getHitCount());
            } else {
                log.info("Cache MISS for {}", cacheKey);
            }
            return document;
        } catch (DataAccessException e) {
            log.error("Error reading pricing cache for {}: {}", cacheKey, e.getMessage());
            return null;
        }
    }

    public boolean invalidate(PricingQuery query) {
        String cacheKey = query.cacheKey();
        try {
            boolean deleted = cacheRepository.deleteByCacheKey(cacheKey) > 0;
            log.info("Invalidated cache for {}: {}", cacheKey, deleted);
            return deleted;
        } catch (DataAccessException e) {
            log.error("Error invalidating pricing cache for {}: {}", cacheKey, e.getMessage());
            return false;
        }
    }

    public CacheStats getCacheStats() {
        List<CacheStats> aggregated = cacheRepository.aggregateStats();
        if (aggregated.isEmpty()) {
            return CacheStats.empty();
        }
        CacheStats stats = aggregated.get(0);
        stats.setAvgFetchDuration(Math.round(stats.getAvgFetchDuration()));
        return stats;
    }

    public long clearAll() {
        long deleted = mongoTemplate.remove(new Query(), PricingCacheDocument.class).getDeletedCount();
        log.info("Cleared {} cache entries", deleted);
        return deleted;
    }
}
