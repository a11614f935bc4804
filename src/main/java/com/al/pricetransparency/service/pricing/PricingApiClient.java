package com.al.pricetransparency.service.pricing;

import com.al.pricetransparency.config.PricingProperties;
import com.al.pricetransparency.exception.PricingApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Client of the external procedure pricing API.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PricingApiClient {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestTemplate restTemplate;
    private final PricingProperties properties;

    /**
     * @throws PricingApiException on a non-2xx answer or when the API cannot be reached
     */
    public PricingResponse fetch(PricingQuery query) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("procedure_id", query.getProcedureId());
        payload.put("metro_slug", query.getMetroSlug());
        payload.put("price_type", query.getPriceType());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        long startTime = System.currentTimeMillis();
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    properties.getApiUrl(),
                    HttpMethod.POST,
                    new HttpEntity<>(payload, headers),
                    RESPONSE_TYPE);
            long durationMs = System.currentTimeMillis() - startTime;

            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new PricingApiException("External API error: " + response.getStatusCode().value(),
                        response.getStatusCode().value());
            }
            log.info("Fetched pricing for {} from external API in {}ms", query.cacheKey(), durationMs);
            return new PricingResponse(response.getBody(), durationMs);
        } catch (HttpStatusCodeException e) {
            log.error("External API error {} for {}: {}", e.getStatusCode().value(), query.cacheKey(),
                    e.getResponseBodyAsString());
            throw new PricingApiException("External API error: " + e.getStatusCode().value(),
                    e.getStatusCode().value());
        } catch (RestClientException e) {
            log.error("External API call failed for {}: {}", query.cacheKey(), e.getMessage());
            throw new PricingApiException("External API unavailable: " + e.getMessage(), e);
        }
    }
}
