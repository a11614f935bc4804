package com.al.pricetransparency.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI configuration.
 * Swagger UI at: /swagger-ui.html
 * OpenAPI JSON at: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:price-transparency-ingest}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Hospital price transparency file ingestion and pricing lookup API.

                                                                ## Features
                                                                - **Ingestion**: CMS JSON (v2.x, v3.x), tall and wide CSV and vendor JSON files
                                                                - **Normalization**: one stored charge per item and care setting
                                                                - **Pricing cache**: cache-aside lookups against the upstream pricing service
                                                                """))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Ingestion")
                                                                .description("File ingestion and collection statistics"),
                                                new Tag().name("Pricing")
                                                                .description("Cached procedure pricing lookups"),
                                                new Tag().name("Charges")
                                                                .description("Stored charge queries")));
        }
}
