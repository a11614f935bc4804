package com.al.pricetransparency.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "app.pricing")
public class PricingProperties {

    private String apiUrl;

    private long cacheTtlHours = 24;

    /**
     * Entries written under another version are treated as misses.
     */
    private String cacheVersion = "1.0.0";

    private int connectTimeoutMs = 5000;

    private int readTimeoutMs = 60000;
}
