package com.al.pricetransparency.controller;

import com.al.pricetransparency.dto.CacheStats;
import com.al.pricetransparency.exception.GlobalExceptionHandler;
import com.al.pricetransparency.exception.PricingApiException;
import com.al.pricetransparency.service.pricing.CacheResult;
import com.al.pricetransparency.service.pricing.PricingCacheService;
import com.al.pricetransparency.service.pricing.PricingQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class PricingControllerTest {

    @Mock
    private PricingCacheService pricingCacheService;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PricingController(pricingCacheService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void testGetPricing_CacheMiss() throws Exception {
        when(pricingCacheService.getPricingWithCache(any(PricingQuery.class))).thenReturn(CacheResult.builder()
                .hit(false)
                .fromCache(false)
                .data(Map.of("status", "ok"))
                .build());

        mockMvc.perform(get("/api/pricing")
                .param("procedure_id", "70551")
                .param("metro_slug", "austin-tx"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(header().doesNotExist("X-Cache-Age"))
                .andExpect(jsonPath("$.status").value("ok"));

        ArgumentCaptor<PricingQuery> query = ArgumentCaptor.forClass(PricingQuery.class);
        verify(pricingCacheService).getPricingWithCache(query.capture());
        assertEquals("70551", query.getValue().getProcedureId());
        assertEquals("austin-tx", query.getValue().getMetroSlug());
        assertEquals(PricingController.DEFAULT_PRICE_TYPE, query.getValue().getPriceType());
    }

    @Test
    public void testGetPricing_CacheHitReportsAgeInSeconds() throws Exception {
        when(pricingCacheService.getPricingWithCache(any(PricingQuery.class))).thenReturn(CacheResult.builder()
                .hit(true)
                .fromCache(true)
                .cacheAgeMs(89_600L)
                .data(Map.of("status", "ok"))
                .build());

        mockMvc.perform(get("/api/pricing")
                .param("procedure_id", "70551")
                .param("metro_slug", "austin-tx")
                .param("price_type", "negotiated"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "HIT"))
                .andExpect(header().string("X-Cache-Age", "90"));
    }

    @Test
    public void testGetPricing_MissingParameter() throws Exception {
        mockMvc.perform(get("/api/pricing").param("procedure_id", "70551"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Input Error"))
                .andExpect(jsonPath("$.path").value("/api/pricing"));

        verifyNoInteractions(pricingCacheService);
    }

    @Test
    public void testGetPricing_UpstreamFailure() throws Exception {
        when(pricingCacheService.getPricingWithCache(any(PricingQuery.class)))
                .thenThrow(new PricingApiException("Pricing API returned 503", 503));

        mockMvc.perform(get("/api/pricing")
                .param("procedure_id", "70551")
                .param("metro_slug", "austin-tx"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Upstream Error"))
                .andExpect(jsonPath("$.upstreamStatus").value(503));
    }

    @Test
    public void testGetCacheStats() throws Exception {
        when(pricingCacheService.getCacheStats()).thenReturn(CacheStats.builder()
                .totalEntries(4)
                .totalHits(11)
                .avgFetchDuration(120.5)
                .build());

        mockMvc.perform(get("/api/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.stats.totalEntries").value(4))
                .andExpect(jsonPath("$.stats.totalHits").value(11));
    }

    @Test
    public void testClearCache_SingleEntry() throws Exception {
        when(pricingCacheService.invalidate(any(PricingQuery.class))).thenReturn(true);

        mockMvc.perform(delete("/api/cache")
                .param("procedure_id", "70551")
                .param("metro_slug", "austin-tx"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(true));

        verify(pricingCacheService, never()).clearAll();
    }

    @Test
    public void testClearCache_All() throws Exception {
        when(pricingCacheService.clearAll()).thenReturn(7L);

        mockMvc.perform(delete("/api/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(7));

        verify(pricingCacheService, never()).invalidate(any());
    }

    @Test
    public void testClearCache_PartialKeyRejected() throws Exception {
        mockMvc.perform(delete("/api/cache").param("metro_slug", "austin-tx"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(pricingCacheService);
    }
}
