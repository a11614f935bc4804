package com.al.pricetransparency.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, PricingProperties pricingProperties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(pricingProperties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(pricingProperties.getReadTimeoutMs()))
                .build();
    }
}
