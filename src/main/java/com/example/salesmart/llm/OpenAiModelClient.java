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
 * OpenAI-compatible chat completions ({@code POST /chat/completions}).
 */
public class OpenAiModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiModelClient.class);
    private static final String PROVIDER = "openai";

    private final ModelProperties props;
    private final WebClient webClient;

    public OpenAiModelClient(ModelProperties props, WebClient.Builder webClientBuilder) {
        this.props = props;
        this.webClient = webClientBuilder
                .baseUrl(props.getEffectiveBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
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
        log.debug("[OpenAI] chat/completions model={} jsonMode={} promptChars={}",
                props.getModel(), request.structuredOutput(), request.prompt().length());

        JsonNode response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildPayload(request))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            JsonNode error = ModelJson.parseObject(e.getResponseBodyAsString()).map(n -> n.path("error"))
                    .orElse(null);
            String code = null;
            if (error != null) {
                code = error.hasNonNull("code") ? error.get("code").asText() : error.path("type").asText(null);
            }
            String message = error != null ? error.path("message").asText(e.getMessage()) : e.getMessage();
            throw new ModelBackendException(PROVIDER, "OpenAI API error " + e.getStatusCode().value() + ": " + message,
                    e.getStatusCode().value(), code, e);
        } catch (RuntimeException e) {
            throw new ModelBackendException(PROVIDER, "OpenAI call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ModelBackendException(PROVIDER, "Null response from OpenAI", null);
        }

        String text = response.at("/choices/0/message/content").asText("");
        JsonNode usage = response.path("usage");
        ModelUsage modelUsage = usage.isMissingNode()
                ? ModelUsage.empty()
                : new ModelUsage(
                        usage.hasNonNull("prompt_tokens") ? usage.get("prompt_tokens").asInt() : null,
                        usage.hasNonNull("completion_tokens") ? usage.get("completion_tokens").asInt() : null,
                        usage.hasNonNull("total_tokens") ? usage.get("total_tokens").asInt() : null);
        return new ModelResponse(text, modelUsage, PROVIDER, props.getModel());
    }

    private Map<String, Object> buildPayload(ModelRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", props.getModel());
        payload.put("temperature", 0);
        payload.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));
        if (request.structuredOutput()) {
            payload.put("response_format", Map.of("type", "json_object"));
        }
        if (!request.tools().isEmpty()) {
            payload.put("tools", request.tools());
        }
        return payload;
    }
}
