package com.example.salesmart.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Marketplace HTTP client shared by the scrapers.
 */
@Configuration
public class HttpClientConfig {

    static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    @Bean
    public RestTemplate scraperRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(15))
                .defaultHeader("User-Agent", USER_AGENT)
                .defaultHeader("Accept-Language", "vi-VN,vi;q=0.9,en;q=0.8")
                .build();
    }
}
