package com.example.salesmart.llm;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "llm")
public class ModelProperties {

    private static final Logger log = LoggerFactory.getLogger(ModelProperties.class);

    /** gemini | openai */
    private String provider = "gemini";
    private String apiKey;
    private String baseUrl;
    private String model = "gemini-2.5-flash";
    private Duration timeout = Duration.ofSeconds(30);

    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(2);
    }

    @PostConstruct
    public void init() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("llm.api-key not configured, provider={} calls will be rejected by the backend", provider);
        }
    }

    public String getEffectiveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        }
        return "openai".equalsIgnoreCase(provider)
                ? "https://api.openai.com/v1"
                : "https://generativelanguage.googleapis.com";
    }
}
