package com.example.salesmart.llm;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

public record ModelRequest(
        String prompt,
        JsonNode responseSchema,
        List<Map<String, Object>> tools,
        boolean jsonMode,
        Duration timeout) {

    public ModelRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is blank");
        }
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public boolean structuredOutput() {
        return jsonMode || responseSchema != null;
    }
}
