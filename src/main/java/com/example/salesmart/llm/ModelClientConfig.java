package com.example.salesmart.llm;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Model backend selection.
 * - llm.provider=gemini (default): GeminiModelClient
 * - llm.provider=openai: OpenAiModelClient
 */
@Configuration
public class ModelClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ModelClientConfig.class);

    @Bean
    public ModelClient modelClient(ModelProperties props, WebClient.Builder webClientBuilder) {
        String provider = props.getProvider() == null ? "gemini" : props.getProvider().toLowerCase(Locale.ROOT);
        log.info("Model backend provider={} model={} baseUrl={}", provider, props.getModel(),
                props.getEffectiveBaseUrl());
        return switch (provider) {
            case "openai" -> new OpenAiModelClient(props, webClientBuilder.clone());
            case "gemini", "google" -> new GeminiModelClient(props, webClientBuilder.clone());
            default -> throw new IllegalStateException("Unknown llm.provider: " + props.getProvider());
        };
    }
}
