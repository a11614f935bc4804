package com.al.pricetransparency.repository;

import com.al.pricetransparency.dto.CacheStats;
import com.al.pricetransparency.model.PricingCacheDocument;
import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PricingCacheRepository extends MongoRepository<PricingCacheDocument, String> {

        long deleteByCacheKey(String cacheKey);

        @Aggregation(pipeline = {
                        "{ $group: { _id: null, totalEntries: { $sum: 1 }, totalHits: { $sum: '$hitCount' }, "
                                        + "avgFetchDuration: { $avg: '$fetchDurationMs' }, "
                                        + "oldestEntry: { $min: '$createdAt' }, newestEntry: { $max: '$createdAt' } } }"
        })
        List<CacheStats> aggregateStats();
}
