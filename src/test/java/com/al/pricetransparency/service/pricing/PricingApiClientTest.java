package com.al.pricetransparency.service.pricing;

import com.al.pricetransparency.config.PricingProperties;
import com.al.pricetransparency.exception.PricingApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class PricingApiClientTest {

    private static final String API_URL = "http://pricing.local/api/prices";
    private static final PricingQuery QUERY = new PricingQuery("mri-brain", "los-angeles", "public");

    @Mock
    private RestTemplate restTemplate;

    private PricingApiClient apiClient;

    @BeforeEach
    public void setUp() {
        PricingProperties properties = new PricingProperties();
        properties.setApiUrl(API_URL);
        apiClient = new PricingApiClient(restTemplate, properties);
    }

    @Test
    public void testFetch_PostsQueryAndReturnsBody() {
        Map<String, Object> body = Map.of("success", true);
        when(restTemplate.exchange(eq(API_URL), eq(HttpMethod.POST), any(HttpEntity.class),
                ArgumentMatchers.<ParameterizedTypeReference<Map<String, Object>>>any()))
                .thenReturn(ResponseEntity.ok(body));

        PricingResponse response = apiClient.fetch(QUERY);

        assertEquals(body, response.getData());
        assertTrue(response.getFetchDurationMs() >= 0);

        ArgumentCaptor<HttpEntity<?>> request = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).exchange(eq(API_URL), eq(HttpMethod.POST), request.capture(),
                ArgumentMatchers.<ParameterizedTypeReference<Map<String, Object>>>any());
        Map<?, ?> payload = (Map<?, ?>) request.getValue().getBody();
        assertEquals("mri-brain", payload.get("procedure_id"));
        assertEquals("los-angeles", payload.get("metro_slug"));
        assertEquals("public", payload.get("price_type"));
    }

    @Test
    public void testFetch_UpstreamErrorStatus() {
        when(restTemplate.exchange(eq(API_URL), eq(HttpMethod.POST), any(HttpEntity.class),
                ArgumentMatchers.<ParameterizedTypeReference<Map<String, Object>>>any()))
                .thenThrow(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE));

        PricingApiException e = assertThrows(PricingApiException.class, () -> apiClient.fetch(QUERY));

        assertEquals(503, e.getStatusCode());
        assertEquals("External API error: 503", e.getMessage());
    }

    @Test
    public void testFetch_Unreachable() {
        when(restTemplate.exchange(eq(API_URL), eq(HttpMethod.POST), any(HttpEntity.class),
                ArgumentMatchers.<ParameterizedTypeReference<Map<String, Object>>>any()))
                .thenThrow(new ResourceAccessException("Connection refused"));

        PricingApiException e = assertThrows(PricingApiException.class, () -> apiClient.fetch(QUERY));

        assertNull(e.getStatusCode());
        assertTrue(e.getMessage().contains("Connection refused"));
    }
}
