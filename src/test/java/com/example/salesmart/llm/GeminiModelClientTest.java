package com.example.salesmart.llm;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

class GeminiModelClientTest {

    @Test
    void extractTextAndUsage() throws Exception {
        JsonNode response = ModelJson.mapper().readTree("""
                {"candidates":[{"content":{"parts":[{"text":"{\\"a\\":"},{"text":"1}"}]}}],
                 "usageMetadata":{"promptTokenCount":12,"candidatesTokenCount":3,"totalTokenCount":15}}
                """);

        assertEquals("{\"a\":1}", GeminiModelClient.extractText(response));
        ModelUsage usage = GeminiModelClient.extractUsage(response);
        assertEquals(12, usage.promptTokens());
        assertEquals(15, usage.totalTokens());
    }

    @Test
    void missingCandidatesGiveEmptyText() throws Exception {
        JsonNode response = ModelJson.mapper().readTree("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}");

        assertEquals("", GeminiModelClient.extractText(response));
        assertNull(GeminiModelClient.extractUsage(response).totalTokens());
    }
}
