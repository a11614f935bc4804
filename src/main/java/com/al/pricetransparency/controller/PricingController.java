package com.al.pricetransparency.controller;

import com.al.pricetransparency.dto.CacheStats;
import com.al.pricetransparency.service.pricing.CacheResult;
import com.al.pricetransparency.service.pricing.PricingCacheService;
import com.al.pricetransparency.service.pricing.PricingQuery;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
@Tag(name = "Pricing", description = "Cached procedure pricing lookups")
public class PricingController {

    static final String DEFAULT_PRICE_TYPE = "public";

    private final PricingCacheService pricingCacheService;

    @Autowired
    public PricingController(PricingCacheService pricingCacheService) {
        this.pricingCacheService = pricingCacheService;
    }

    @Operation(summary = "Procedure prices in a metro area, served from cache when fresh")
    @GetMapping("/pricing")
    public ResponseEntity<Map<String, Object>> getPricing(
            @RequestParam(name = "procedure_id", required = false) String procedureId,
            @RequestParam(name = "metro_slug", required = false) String metroSlug,
            @RequestParam(name = "price_type", required = false) String priceType) {
        PricingQuery query = toQuery(procedureId, metroSlug, priceType);
        CacheResult result = pricingCacheService.getPricingWithCache(query);

        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .header("X-Cache", result.isFromCache() ? "HIT" : "MISS");
        if (result.getCacheAgeMs() != null) {
            response.header("X-Cache-Age", String.valueOf(Math.round(result.getCacheAgeMs() / 1000.0)));
        }
        return response.body(result.getData());
    }

    @Operation(summary = "Pricing cache statistics")
    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> getCacheStats() {
        CacheStats stats = pricingCacheService.getCacheStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("stats", stats);
        return ResponseEntity.ok(body);
    }

    /**
     * Drops one entry when {@code procedure_id} and {@code metro_slug} are given, otherwise the whole cache.
     */
    @Operation(summary = "Invalidate one pricing cache entry or clear the cache")
    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache(
            @RequestParam(name = "procedure_id", required = false) String procedureId,
            @RequestParam(name = "metro_slug", required = false) String metroSlug,
            @RequestParam(name = "price_type", required = false) String priceType) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        if (procedureId != null || metroSlug != null) {
            body.put("invalidated", pricingCacheService.invalidate(toQuery(procedureId, metroSlug, priceType)));
        } else {
            body.put("deleted", pricingCacheService.clearAll());
        }
        return ResponseEntity.ok(body);
    }

    private static PricingQuery toQuery(String procedureId, String metroSlug, String priceType) {
        if (isBlank(procedureId) || isBlank(metroSlug)) {
            throw new IllegalArgumentException("Missing required parameters: procedure_id and metro_slug");
        }
        return new PricingQuery(procedureId, metroSlug, isBlank(priceType) ? DEFAULT_PRICE_TYPE : priceType);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
