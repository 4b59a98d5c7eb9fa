package com.example.salesmart.llm;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Gemini Generative Language API ({@code /v1beta/models/{model}:generateContent}).
 */
public class GeminiModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiModelClient.class);
    private static final String PROVIDER = "google";

    private final ModelProperties props;
    private final WebClient webClient;

    public GeminiModelClient(ModelProperties props, WebClient.Builder webClientBuilder) {
        this.props = props;
        this.webClient = webClientBuilder
                .baseUrl(props.getEffectiveBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public ModelResponse generate(ModelRequest request) {
        Duration timeout = request.timeout() != null ? request.timeout() : props.getTimeout();
        log.debug("[Gemini] generateContent model={} jsonMode={} promptChars={}",
                props.getModel(), request.structuredOutput(), request.prompt().length());

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(uri -> uri.path("/v1beta/models/{model}:generateContent")
                            .queryParam("key", props.getApiKey())
                            .build(props.getModel()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildPayload(request))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            JsonNode error = ModelJson.parseObject(e.getResponseBodyAsString()).map(n -> n.path("error"))
                    .orElse(null);
            String status = error != null ? error.path("status").asText(null) : null;
            String message = error != null ? error.path("message").asText(e.getMessage()) : e.getMessage();
            throw new ModelBackendException(PROVIDER, "Gemini API error " + e.getStatusCode().value() + ": " + message,
                    e.getStatusCode().value(), status, e);
        } catch (RuntimeException e) {
            throw new ModelBackendException(PROVIDER, "Gemini call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ModelBackendException(PROVIDER, "Null response from Gemini", null);
        }
        return new ModelResponse(extractText(response), extractUsage(response), PROVIDER, props.getModel());
    }

    private Map<String, Object> buildPayload(ModelRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", request.prompt())))));

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        if (request.structuredOutput()) {
            generationConfig.put("responseMimeType", MediaType.APPLICATION_JSON_VALUE);
        }
        if (request.responseSchema() != null) {
            generationConfig.put("responseSchema", request.responseSchema());
        }
        if (!generationConfig.isEmpty()) {
            payload.put("generationConfig", generationConfig);
        }
        if (!request.tools().isEmpty()) {
            payload.put("tools", request.tools());
        }
        return payload;
    }

    static String extractText(JsonNode response) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : response.path("candidates").path(0).path("content").path("parts")) {
            if (part.hasNonNull("text")) {
                sb.append(part.get("text").asText());
            }
        }
        return sb.toString();
    }

    static ModelUsage extractUsage(JsonNode response) {
        JsonNode usage = response.path("usageMetadata");
        if (usage.isMissingNode()) {
            return ModelUsage.empty();
        }
        return new ModelUsage(
                intOrNull(usage, "promptTokenCount"),
                intOrNull(usage, "candidatesTokenCount"),
                intOrNull(usage, "totalTokenCount"));
    }

    private static Integer intOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asInt() : null;
    }
}
